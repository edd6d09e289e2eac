package uk.gegc.accesssync.features.sync.application;

import uk.gegc.accesssync.features.sync.domain.model.ReconciliationAction;
import uk.gegc.accesssync.features.sync.domain.model.ResourceKind;
import uk.gegc.accesssync.features.sync.domain.model.SyncReport;

/**
 * Operator-facing progress of a run.
 */
public interface SyncReporter {

    void phase(String title);

    void loaded(String what, int count);

    void changesDetected(ResourceKind kind, long created, long updated);

    void progress(ResourceKind kind, ReconciliationAction action, String key, int done, int total);

    void synchronizedKind(ResourceKind kind);

    void upToDate(ResourceKind kind, int total);

    void unknownResources(SyncReport report);

    void failure(String message, String detail);
}
