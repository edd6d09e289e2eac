package uk.gegc.accesssync.features.user.domain.model;

public record RemoteUser(String id, String email, String name, boolean active, String roleId) {

    public RemoteUser withProfile(String newName, boolean newActive, String newRoleId) {
        return new RemoteUser(id, email, newName, newActive, newRoleId);
    }
}
