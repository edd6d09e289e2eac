package uk.gegc.accesssync.features.sync.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.accesssync.features.role.application.RoleTemplateLoader;
import uk.gegc.accesssync.features.role.domain.model.RoleTemplate;
import uk.gegc.accesssync.features.sync.domain.model.DesiredState;
import uk.gegc.accesssync.features.sync.domain.model.SyncRequest;
import uk.gegc.accesssync.features.user.application.UserLoader;
import uk.gegc.accesssync.features.user.domain.model.DesiredUser;
import uk.gegc.accesssync.features.workspace.application.WorkspaceLoader;
import uk.gegc.accesssync.features.workspace.domain.model.Workspace;
import uk.gegc.accesssync.shared.exception.TemplateDefinitionException;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Reads and validates all workbooks before anything is sent to the remote system. Every role
 * template a user references must be defined.
 */
@Component
@RequiredArgsConstructor
public class DesiredStateLoader {

    private final WorkspaceLoader workspaceLoader;
    private final RoleTemplateLoader roleTemplateLoader;
    private final UserLoader userLoader;
    private final SyncReporter reporter;

    public DesiredState load(SyncRequest request) {
        reporter.phase("Reading Workspaces...");
        List<Workspace> workspaces = workspaceLoader.load(request.workspacesFile(), request.workspaceColumns());
        reporter.loaded("workspaces", workspaces.size());

        reporter.phase("Reading Role Templates...");
        Map<String, RoleTemplate> templates = roleTemplateLoader.load(request.rolesFile());
        reporter.loaded("role templates", templates.size());

        reporter.phase("Reading Users...");
        List<DesiredUser> users = userLoader.load(request.usersDirectory(),
                new LinkedHashSet<>(workspaces.stream().map(Workspace::slug).toList()),
                request.userColumns());
        reporter.loaded("users", users.size());

        for (DesiredUser user : users) {
            if (!templates.containsKey(user.roleTemplateName())) {
                throw new TemplateDefinitionException("Failed to read users",
                        "Role template '" + user.roleTemplateName() + "' referenced by user " + user.email()
                                + " is not defined");
            }
        }
        return new DesiredState(workspaces, templates, users);
    }
}
