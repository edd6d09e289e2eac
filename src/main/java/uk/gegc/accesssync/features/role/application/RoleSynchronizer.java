package uk.gegc.accesssync.features.role.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.accesssync.features.role.domain.model.CompiledRole;
import uk.gegc.accesssync.features.role.domain.model.RemoteRole;
import uk.gegc.accesssync.features.role.domain.model.RoleSummary;
import uk.gegc.accesssync.features.role.domain.repository.RoleGateway;
import uk.gegc.accesssync.features.sync.application.Reconciler;
import uk.gegc.accesssync.features.sync.application.ResourceSyncStrategy;
import uk.gegc.accesssync.features.sync.domain.model.ResourceKind;
import uk.gegc.accesssync.features.sync.domain.model.SyncOutcome;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Roles match by compiled name and differ when their permission documents differ.
 * <p>
 * Permission documents are only fetched for roles that are declared; undeclared roles are
 * reported by name, except the built-in {@value #ADMIN_ROLE} role.
 */
@Component
@RequiredArgsConstructor
public class RoleSynchronizer implements ResourceSyncStrategy<CompiledRole, RemoteRole> {

    public static final String ADMIN_ROLE = "Admin";

    private final RoleGateway roleGateway;
    private final Reconciler reconciler;

    public SyncOutcome<CompiledRole, RemoteRole> synchronize(Collection<CompiledRole> roles) {
        Set<String> declared = roles.stream().map(CompiledRole::name).collect(Collectors.toSet());
        List<RemoteRole> remote = new ArrayList<>();
        for (RoleSummary summary : roleGateway.query()) {
            remote.add(declared.contains(summary.name())
                    ? roleGateway.get(summary.id())
                    : new RemoteRole(summary.id(), summary.name(), null));
        }
        return reconciler.reconcile(this, roles, remote);
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.ROLES;
    }

    @Override
    public String desiredKey(CompiledRole desired) {
        return desired.name();
    }

    @Override
    public String remoteKey(RemoteRole remote) {
        return remote.name();
    }

    @Override
    public boolean isChanged(CompiledRole desired, RemoteRole remote) {
        return !desired.permissions().equals(remote.permissions());
    }

    @Override
    public RemoteRole create(CompiledRole desired) {
        return roleGateway.create(desired.name(), desired.permissions());
    }

    @Override
    public RemoteRole update(CompiledRole desired, RemoteRole remote) {
        return roleGateway.save(remote.withPermissions(desired.permissions()));
    }

    @Override
    public boolean isReportedWhenUnknown(RemoteRole remote) {
        return !ADMIN_ROLE.equals(remote.name());
    }
}
