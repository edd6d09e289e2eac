package uk.gegc.accesssync.features.sync.domain.model;

public enum ResourceKind {
    WORKSPACES("workspace", "workspaces"),
    ROLES("role", "roles"),
    USERS("user", "users");

    private final String singular;
    private final String plural;

    ResourceKind(String singular, String plural) {
        this.singular = singular;
        this.plural = plural;
    }

    public String singular() {
        return singular;
    }

    public String plural() {
        return plural;
    }

    public String title() {
        return Character.toUpperCase(plural.charAt(0)) + plural.substring(1);
    }
}
