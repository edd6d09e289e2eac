package uk.gegc.accesssync.features.sync.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of synchronizing one kind.
 *
 * @param resolved remote record of every desired record after apply, keyed by natural key
 */
public record SyncOutcome<D, R>(ReconciliationPlan<D, R> plan, Map<String, R> resolved) {

    public SyncOutcome {
        resolved = Collections.unmodifiableMap(new LinkedHashMap<>(resolved));
    }

    public SyncSummary summary() {
        return SyncSummary.of(plan);
    }
}
