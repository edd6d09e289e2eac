package uk.gegc.accesssync.features.sync.infra;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.accesssync.features.sync.application.ApprovalGate;
import uk.gegc.accesssync.features.sync.domain.model.ResourceKind;

/**
 * Approves everything, for unattended runs.
 */
@Slf4j
public class AutoApprovalGate implements ApprovalGate {

    @Override
    public boolean approve(ResourceKind kind, long created, long updated) {
        log.info("Approving {} changes to {} without confirmation", created + updated, kind.plural());
        return true;
    }
}
