package uk.gegc.accesssync.features.workspace.domain.model;

/**
 * Header texts of the workspace workbook columns.
 */
public record WorkspaceColumns(String slug, String name) {

    public static WorkspaceColumns defaults() {
        return new WorkspaceColumns("Slug", "Name");
    }
}
