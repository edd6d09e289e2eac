package uk.gegc.accesssync.features.role.domain.repository;

import uk.gegc.accesssync.features.role.domain.model.PermissionDocument;
import uk.gegc.accesssync.features.role.domain.model.RemoteRole;
import uk.gegc.accesssync.features.role.domain.model.RoleSummary;

import java.util.List;

/**
 * Roles of the remote access-management system.
 */
public interface RoleGateway {

    List<RoleSummary> query();

    RemoteRole create(String name, PermissionDocument permissions);

    RemoteRole get(String id);

    RemoteRole save(RemoteRole role);
}
