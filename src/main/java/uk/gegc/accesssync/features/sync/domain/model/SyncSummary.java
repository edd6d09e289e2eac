package uk.gegc.accesssync.features.sync.domain.model;

public record SyncSummary(ResourceKind kind, int total, long created, long updated, int unknown) {

    public static SyncSummary of(ReconciliationPlan<?, ?> plan) {
        return new SyncSummary(plan.kind(), plan.total(), plan.created(), plan.updated(), plan.unknown().size());
    }

    public boolean hasChanges() {
        return created > 0 || updated > 0;
    }
}
