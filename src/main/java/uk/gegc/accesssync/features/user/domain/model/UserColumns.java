package uk.gegc.accesssync.features.user.domain.model;

/**
 * Header texts of the user workbook columns.
 */
public record UserColumns(String workspace, String name, String email, String role, String active) {

    public static UserColumns defaults() {
        return new UserColumns("Workspace", "Name", "Email", "Role", "Active");
    }
}
