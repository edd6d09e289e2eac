package uk.gegc.accesssync.features.role.domain.model;

/**
 * Role as listed by the remote system, without its permissions.
 */
public record RoleSummary(String id, String name) {
}
