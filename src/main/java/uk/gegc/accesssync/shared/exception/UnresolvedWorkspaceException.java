package uk.gegc.accesssync.shared.exception;

/**
 * A role references a workspace that has no remote identifier yet.
 */
public class UnresolvedWorkspaceException extends SyncException {

    private final String slug;

    public UnresolvedWorkspaceException(String roleName, String slug) {
        super("Failed to create role '" + roleName + "'", "Workspace '" + slug + "' not found");
        this.slug = slug;
    }

    public String getSlug() {
        return slug;
    }
}
