package uk.gegc.accesssync.features.sync.application;

import uk.gegc.accesssync.features.sync.domain.model.ResourceKind;

/**
 * Decides whether pending changes of one kind may be applied. Blocks until a decision is made.
 */
public interface ApprovalGate {

    boolean approve(ResourceKind kind, long created, long updated);
}
