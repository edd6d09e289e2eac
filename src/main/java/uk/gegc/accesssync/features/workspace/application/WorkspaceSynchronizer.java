package uk.gegc.accesssync.features.workspace.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.accesssync.features.sync.application.Reconciler;
import uk.gegc.accesssync.features.sync.application.ResourceSyncStrategy;
import uk.gegc.accesssync.features.sync.domain.model.ResourceKind;
import uk.gegc.accesssync.features.sync.domain.model.SyncOutcome;
import uk.gegc.accesssync.features.workspace.domain.model.RemoteWorkspace;
import uk.gegc.accesssync.features.workspace.domain.model.Workspace;
import uk.gegc.accesssync.features.workspace.domain.repository.WorkspaceGateway;

import java.util.Collection;
import java.util.Objects;

/**
 * Workspaces match by slug and differ when the remote name is not the display name.
 */
@Component
@RequiredArgsConstructor
public class WorkspaceSynchronizer implements ResourceSyncStrategy<Workspace, RemoteWorkspace> {

    private final WorkspaceGateway workspaceGateway;
    private final Reconciler reconciler;

    public SyncOutcome<Workspace, RemoteWorkspace> synchronize(Collection<Workspace> workspaces) {
        return reconciler.reconcile(this, workspaces, workspaceGateway.query());
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.WORKSPACES;
    }

    @Override
    public String desiredKey(Workspace desired) {
        return desired.slug();
    }

    @Override
    public String remoteKey(RemoteWorkspace remote) {
        return remote.slug();
    }

    @Override
    public boolean isChanged(Workspace desired, RemoteWorkspace remote) {
        return !Objects.equals(desired.displayName(), remote.name());
    }

    @Override
    public RemoteWorkspace create(Workspace desired) {
        return workspaceGateway.create(desired.slug(), desired.displayName());
    }

    @Override
    public RemoteWorkspace update(Workspace desired, RemoteWorkspace remote) {
        return workspaceGateway.save(remote.withName(desired.displayName()));
    }
}
