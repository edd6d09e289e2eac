package uk.gegc.accesssync.features.sync.application;

import uk.gegc.accesssync.features.sync.domain.model.SyncReport;
import uk.gegc.accesssync.features.sync.domain.model.SyncRequest;

/**
 * Brings the remote access-management system in line with the workbooks.
 */
public interface AccessSynchronizer {

    /**
     * Load and validate the desired state, then synchronize workspaces, roles and users in that
     * order. Each pass feeds the remote identifiers it resolved into the next one.
     *
     * @return per-kind summaries and the remote resources no workbook declares
     * @throws uk.gegc.accesssync.shared.exception.SyncException on the first validation error,
     *                                                            remote failure or declined approval
     */
    SyncReport synchronize(SyncRequest request);
}
