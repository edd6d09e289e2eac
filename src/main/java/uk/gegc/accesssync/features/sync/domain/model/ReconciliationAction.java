package uk.gegc.accesssync.features.sync.domain.model;

public enum ReconciliationAction {
    UNCHANGED,
    CREATE,
    UPDATE
}
