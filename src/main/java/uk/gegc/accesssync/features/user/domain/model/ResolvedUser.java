package uk.gegc.accesssync.features.user.domain.model;

/**
 * A desired user together with the remote id of the role compiled for it.
 */
public record ResolvedUser(DesiredUser user, String roleName, String roleId) {

    public String email() {
        return user.email();
    }
}
