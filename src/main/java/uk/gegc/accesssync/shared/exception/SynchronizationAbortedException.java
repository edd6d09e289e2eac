package uk.gegc.accesssync.shared.exception;

public class SynchronizationAbortedException extends SyncException {

    public SynchronizationAbortedException(String resource) {
        super("Synchronization aborted", "Changes to " + resource + " were not approved");
    }
}
