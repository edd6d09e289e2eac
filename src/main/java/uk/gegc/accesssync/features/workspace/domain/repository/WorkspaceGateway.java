package uk.gegc.accesssync.features.workspace.domain.repository;

import uk.gegc.accesssync.features.workspace.domain.model.RemoteWorkspace;

import java.util.List;

/**
 * Workspaces of the remote access-management system.
 */
public interface WorkspaceGateway {

    List<RemoteWorkspace> query();

    RemoteWorkspace create(String slug, String name);

    RemoteWorkspace save(RemoteWorkspace workspace);
}
