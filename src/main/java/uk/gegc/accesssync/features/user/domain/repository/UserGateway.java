package uk.gegc.accesssync.features.user.domain.repository;

import uk.gegc.accesssync.features.user.domain.model.RemoteUser;

import java.util.List;

/**
 * Users of the remote access-management system.
 */
public interface UserGateway {

    List<RemoteUser> query();

    RemoteUser create(String email, String name, String roleId);

    RemoteUser get(String id);

    RemoteUser save(RemoteUser user);
}
