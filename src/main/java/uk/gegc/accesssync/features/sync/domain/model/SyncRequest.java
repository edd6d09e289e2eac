package uk.gegc.accesssync.features.sync.domain.model;

import uk.gegc.accesssync.features.user.domain.model.UserColumns;
import uk.gegc.accesssync.features.workspace.domain.model.WorkspaceColumns;

import java.nio.file.Path;

/**
 * Where the desired state lives and how its columns are named.
 */
public record SyncRequest(
        Path workspacesFile,
        Path rolesFile,
        Path usersDirectory,
        WorkspaceColumns workspaceColumns,
        UserColumns userColumns
) {

    public static SyncRequest withDefaults(Path dataDir) {
        return new SyncRequest(
                dataDir.resolve("workspaces.xlsx"),
                dataDir.resolve("roles.xlsx"),
                dataDir.resolve("users"),
                WorkspaceColumns.defaults(),
                UserColumns.defaults());
    }
}
