package uk.gegc.accesssync.features.user.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.accesssync.features.role.domain.model.RemoteRole;
import uk.gegc.accesssync.features.role.domain.model.RoleAssignments;
import uk.gegc.accesssync.features.sync.application.Reconciler;
import uk.gegc.accesssync.features.sync.application.ResourceSyncStrategy;
import uk.gegc.accesssync.features.sync.domain.model.ResourceKind;
import uk.gegc.accesssync.features.sync.domain.model.SyncOutcome;
import uk.gegc.accesssync.features.user.domain.model.DesiredUser;
import uk.gegc.accesssync.features.user.domain.model.RemoteUser;
import uk.gegc.accesssync.features.user.domain.model.ResolvedUser;
import uk.gegc.accesssync.features.user.domain.repository.UserGateway;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Users match by email and differ on name, active flag or role id.
 */
@Component
@RequiredArgsConstructor
public class UserSynchronizer implements ResourceSyncStrategy<ResolvedUser, RemoteUser> {

    private final UserGateway userGateway;
    private final Reconciler reconciler;

    public SyncOutcome<ResolvedUser, RemoteUser> synchronize(List<DesiredUser> users,
                                                             RoleAssignments assignments,
                                                             Map<String, RemoteRole> resolvedRoles) {
        List<ResolvedUser> resolved = users.stream()
                .map(user -> {
                    String roleName = assignments.roleOf(user.email()).name();
                    RemoteRole role = resolvedRoles.get(roleName);
                    if (role == null) {
                        throw new IllegalStateException("Role '" + roleName + "' has not been synchronized");
                    }
                    return new ResolvedUser(user, roleName, role.id());
                })
                .toList();
        return reconciler.reconcile(this, resolved, userGateway.query());
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.USERS;
    }

    @Override
    public String desiredKey(ResolvedUser desired) {
        return desired.email();
    }

    @Override
    public String remoteKey(RemoteUser remote) {
        return remote.email();
    }

    @Override
    public boolean isChanged(ResolvedUser desired, RemoteUser remote) {
        DesiredUser user = desired.user();
        return !Objects.equals(user.name(), remote.name())
                || user.active() != remote.active()
                || !Objects.equals(desired.roleId(), remote.roleId());
    }

    /**
     * New users are created active, so an inactive user gets a follow-up save.
     */
    @Override
    public RemoteUser create(ResolvedUser desired) {
        DesiredUser user = desired.user();
        RemoteUser created = userGateway.create(user.email(), user.name(), desired.roleId());
        if (created.active() != user.active()) {
            created = userGateway.save(created.withProfile(user.name(), user.active(), desired.roleId()));
        }
        return created;
    }

    @Override
    public RemoteUser update(ResolvedUser desired, RemoteUser remote) {
        DesiredUser user = desired.user();
        RemoteUser current = userGateway.get(remote.id());
        return userGateway.save(current.withProfile(user.name(), user.active(), desired.roleId()));
    }
}
