package uk.gegc.accesssync.features.sync.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.accesssync.features.role.application.RoleCompiler;
import uk.gegc.accesssync.features.role.application.RoleSynchronizer;
import uk.gegc.accesssync.features.role.domain.model.CompiledRole;
import uk.gegc.accesssync.features.role.domain.model.RemoteRole;
import uk.gegc.accesssync.features.role.domain.model.RoleAssignments;
import uk.gegc.accesssync.features.sync.application.AccessSynchronizer;
import uk.gegc.accesssync.features.sync.application.DesiredStateLoader;
import uk.gegc.accesssync.features.sync.application.SyncReporter;
import uk.gegc.accesssync.features.sync.domain.model.DesiredState;
import uk.gegc.accesssync.features.sync.domain.model.SyncOutcome;
import uk.gegc.accesssync.features.sync.domain.model.SyncReport;
import uk.gegc.accesssync.features.sync.domain.model.SyncRequest;
import uk.gegc.accesssync.features.user.application.UserSynchronizer;
import uk.gegc.accesssync.features.user.domain.model.RemoteUser;
import uk.gegc.accesssync.features.user.domain.model.ResolvedUser;
import uk.gegc.accesssync.features.workspace.application.WorkspaceSynchronizer;
import uk.gegc.accesssync.features.workspace.domain.model.RemoteWorkspace;
import uk.gegc.accesssync.features.workspace.domain.model.Workspace;
import uk.gegc.accesssync.features.workspace.domain.model.WorkspaceIdentifiers;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class AccessSynchronizerImpl implements AccessSynchronizer {

    private final DesiredStateLoader desiredStateLoader;
    private final WorkspaceSynchronizer workspaceSynchronizer;
    private final RoleCompiler roleCompiler;
    private final RoleSynchronizer roleSynchronizer;
    private final UserSynchronizer userSynchronizer;
    private final SyncReporter reporter;

    @Override
    public SyncReport synchronize(SyncRequest request) {
        log.info("Starting synchronization from {}", request.workspacesFile().getParent());
        DesiredState desired = desiredStateLoader.load(request);

        reporter.phase("Synchronizing Workspaces...");
        SyncOutcome<Workspace, RemoteWorkspace> workspaces = workspaceSynchronizer.synchronize(desired.workspaces());
        WorkspaceIdentifiers workspaceIds = WorkspaceIdentifiers.fromRemote(workspaces.resolved());

        reporter.phase("Synchronizing Roles...");
        RoleAssignments assignments = roleCompiler.compile(
                desired.users(), desired.roleTemplates(), desired.workspaceSlugs(), workspaceIds);
        SyncOutcome<CompiledRole, RemoteRole> roles = roleSynchronizer.synchronize(assignments.compiledRoles());

        reporter.phase("Synchronizing Users...");
        SyncOutcome<ResolvedUser, RemoteUser> users =
                userSynchronizer.synchronize(desired.users(), assignments, roles.resolved());

        SyncReport report = new SyncReport(
                List.of(workspaces.summary(), roles.summary(), users.summary()),
                workspaces.plan().unknown(),
                roles.plan().unknown(),
                users.plan().unknown());
        if (report.hasUnknownResources()) {
            reporter.unknownResources(report);
        }
        log.info("Synchronization finished: {}", report.summaries());
        return report;
    }
}
