package uk.gegc.accesssync.features.sync.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.accesssync.features.sync.domain.model.*;
import uk.gegc.accesssync.shared.exception.SynchronizationAbortedException;

import java.util.*;

/**
 * Diffs desired records against remote records of one kind and applies the difference.
 * <p>
 * Records are matched by natural key. Remote records without a desired counterpart are only
 * reported; nothing is ever deleted. Changes are applied one at a time after the
 * {@link ApprovalGate} agrees, and a failure part way leaves earlier changes in place.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Reconciler {

    private final ApprovalGate approvalGate;
    private final SyncReporter reporter;

    public <D, R> SyncOutcome<D, R> reconcile(ResourceSyncStrategy<D, R> strategy,
                                              Collection<D> desired,
                                              Collection<R> remote) {
        ReconciliationPlan<D, R> plan = plan(strategy, desired, remote);
        return new SyncOutcome<>(plan, apply(strategy, plan));
    }

    public <D, R> ReconciliationPlan<D, R> plan(ResourceSyncStrategy<D, R> strategy,
                                                Collection<D> desired,
                                                Collection<R> remote) {
        Map<String, D> desiredByKey = new LinkedHashMap<>();
        for (D record : desired) {
            String key = strategy.desiredKey(record);
            if (desiredByKey.put(key, record) != null) {
                throw new IllegalArgumentException("Duplicate " + strategy.kind().singular() + " key '" + key + "'");
            }
        }

        Map<String, R> remoteByKey = new HashMap<>();
        List<R> unknown = new ArrayList<>();
        for (R record : remote) {
            String key = strategy.remoteKey(record);
            if (desiredByKey.containsKey(key)) {
                remoteByKey.put(key, record);
            } else if (strategy.isReportedWhenUnknown(record)) {
                unknown.add(record);
            }
        }

        List<ReconciliationItem<D, R>> items = new ArrayList<>(desiredByKey.size());
        desiredByKey.forEach((key, record) -> {
            R match = remoteByKey.get(key);
            ReconciliationAction action;
            if (match == null) {
                action = ReconciliationAction.CREATE;
            } else if (strategy.isChanged(record, match)) {
                action = ReconciliationAction.UPDATE;
            } else {
                action = ReconciliationAction.UNCHANGED;
            }
            items.add(new ReconciliationItem<>(key, record, match, action));
        });

        ReconciliationPlan<D, R> plan = new ReconciliationPlan<>(strategy.kind(), items, unknown);
        log.debug("Planned {}: {} desired, {} to create, {} to update, {} unknown",
                strategy.kind().plural(), plan.total(), plan.created(), plan.updated(), unknown.size());
        return plan;
    }

    /**
     * Apply the pending items of {@code plan}.
     *
     * @return the remote record of every desired record, keyed by natural key
     * @throws SynchronizationAbortedException if the changes are not approved
     */
    public <D, R> Map<String, R> apply(ResourceSyncStrategy<D, R> strategy, ReconciliationPlan<D, R> plan) {
        ResourceKind kind = strategy.kind();
        Map<String, R> resolved = new LinkedHashMap<>();

        if (!plan.hasChanges()) {
            plan.items().forEach(item -> resolved.put(item.key(), item.remote()));
            reporter.upToDate(kind, plan.total());
            return resolved;
        }

        reporter.changesDetected(kind, plan.created(), plan.updated());
        if (!approvalGate.approve(kind, plan.created(), plan.updated())) {
            log.info("Synchronization of {} declined", kind.plural());
            throw new SynchronizationAbortedException(kind.plural());
        }

        int total = plan.pending().size();
        int done = 0;
        for (ReconciliationItem<D, R> item : plan.items()) {
            switch (item.action()) {
                case UNCHANGED -> resolved.put(item.key(), item.remote());
                case CREATE -> {
                    resolved.put(item.key(), strategy.create(item.desired()));
                    log.info("Created {} '{}'", kind.singular(), item.key());
                    reporter.progress(kind, item.action(), item.key(), ++done, total);
                }
                case UPDATE -> {
                    resolved.put(item.key(), strategy.update(item.desired(), item.remote()));
                    log.info("Updated {} '{}'", kind.singular(), item.key());
                    reporter.progress(kind, item.action(), item.key(), ++done, total);
                }
            }
        }

        reporter.synchronizedKind(kind);
        return resolved;
    }
}
