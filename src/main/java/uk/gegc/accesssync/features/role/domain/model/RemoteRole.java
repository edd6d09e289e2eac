package uk.gegc.accesssync.features.role.domain.model;

/**
 * Role as stored remotely. The permission document never carries the remote-only
 * {@code private} and {@code user} fields.
 */
public record RemoteRole(String id, String name, PermissionDocument permissions) {

    public RemoteRole withPermissions(PermissionDocument newPermissions) {
        return new RemoteRole(id, name, newPermissions);
    }
}
