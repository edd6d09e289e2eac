package uk.gegc.accesssync.features.sync.domain.model;

/**
 * A desired record paired with its remote counterpart.
 *
 * @param key     natural key shared by both sides
 * @param remote  matching remote record, {@code null} when the record is to be created
 */
public record ReconciliationItem<D, R>(String key, D desired, R remote, ReconciliationAction action) {

    public boolean isPending() {
        return action != ReconciliationAction.UNCHANGED;
    }
}
