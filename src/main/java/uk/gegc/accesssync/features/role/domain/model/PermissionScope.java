package uk.gegc.accesssync.features.role.domain.model;

/**
 * Section of a role template a permission is written to.
 */
public enum PermissionScope {
    ORGANIZATION("organization"),
    PRIMARY_WORKSPACES("primary_workspaces"),
    OTHER_WORKSPACES("other_workspaces");

    private final String prefix;

    PermissionScope(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public String path(LabelledPermission permission) {
        return prefix + "." + permission.key();
    }
}
