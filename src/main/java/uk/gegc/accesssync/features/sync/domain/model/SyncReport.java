package uk.gegc.accesssync.features.sync.domain.model;

import uk.gegc.accesssync.features.role.domain.model.RemoteRole;
import uk.gegc.accesssync.features.user.domain.model.RemoteUser;
import uk.gegc.accesssync.features.workspace.domain.model.RemoteWorkspace;

import java.util.List;

/**
 * Outcome of a whole run: one summary per kind and the remote records no workbook declares.
 */
public record SyncReport(
        List<SyncSummary> summaries,
        List<RemoteWorkspace> unknownWorkspaces,
        List<RemoteRole> unknownRoles,
        List<RemoteUser> unknownUsers
) {

    public SyncReport {
        summaries = List.copyOf(summaries);
        unknownWorkspaces = List.copyOf(unknownWorkspaces);
        unknownRoles = List.copyOf(unknownRoles);
        unknownUsers = List.copyOf(unknownUsers);
    }

    public boolean hasUnknownResources() {
        return !unknownWorkspaces.isEmpty() || !unknownRoles.isEmpty() || !unknownUsers.isEmpty();
    }

    public boolean hasChanges() {
        return summaries.stream().anyMatch(SyncSummary::hasChanges);
    }
}
