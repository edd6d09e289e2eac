package uk.gegc.accesssync.features.role.domain.model;

/**
 * A permission flag as it appears in a role template sheet ({@link #label()}) and in the remote
 * permission document ({@link #key()}).
 */
public interface LabelledPermission {

    String label();

    String key();
}
