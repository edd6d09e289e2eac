package uk.gegc.accesssync.features.sync.domain.model;

import java.util.List;

/**
 * Classification of every desired record of one kind, plus remote records nobody declared.
 */
public record ReconciliationPlan<D, R>(ResourceKind kind, List<ReconciliationItem<D, R>> items, List<R> unknown) {

    public ReconciliationPlan {
        items = List.copyOf(items);
        unknown = List.copyOf(unknown);
    }

    public int total() {
        return items.size();
    }

    public long created() {
        return count(ReconciliationAction.CREATE);
    }

    public long updated() {
        return count(ReconciliationAction.UPDATE);
    }

    public List<ReconciliationItem<D, R>> pending() {
        return items.stream().filter(ReconciliationItem::isPending).toList();
    }

    public boolean hasChanges() {
        return items.stream().anyMatch(ReconciliationItem::isPending);
    }

    private long count(ReconciliationAction action) {
        return items.stream().filter(item -> item.action() == action).count();
    }
}
