package uk.gegc.accesssync.features.sync.application;

import uk.gegc.accesssync.features.sync.domain.model.ResourceKind;

/**
 * How the {@link Reconciler} matches, compares and writes one kind of resource.
 *
 * @param <D> desired record
 * @param <R> remote record
 */
public interface ResourceSyncStrategy<D, R> {

    ResourceKind kind();

    String desiredKey(D desired);

    String remoteKey(R remote);

    /**
     * Whether a matched remote record differs from the desired one.
     */
    boolean isChanged(D desired, R remote);

    R create(D desired);

    R update(D desired, R remote);

    /**
     * Whether an undeclared remote record belongs in the unknown-resources report.
     */
    default boolean isReportedWhenUnknown(R remote) {
        return true;
    }
}
