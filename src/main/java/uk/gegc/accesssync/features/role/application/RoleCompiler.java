package uk.gegc.accesssync.features.role.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.accesssync.features.role.domain.model.CompiledRole;
import uk.gegc.accesssync.features.role.domain.model.RoleAssignments;
import uk.gegc.accesssync.features.role.domain.model.RoleTemplate;
import uk.gegc.accesssync.features.user.domain.model.DesiredUser;
import uk.gegc.accesssync.features.workspace.domain.model.WorkspaceIdentifiers;
import uk.gegc.accesssync.shared.exception.TemplateDefinitionException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives one role per distinct (primary workspaces, template) group of users.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoleCompiler {

    private final PermissionCompiler permissionCompiler;

    public RoleAssignments compile(List<DesiredUser> users,
                                   Map<String, RoleTemplate> templates,
                                   Collection<String> desiredSlugs,
                                   WorkspaceIdentifiers workspaceIds) {
        Map<String, CompiledRole> roles = new LinkedHashMap<>();
        Map<String, String> roleNameByEmail = new LinkedHashMap<>();

        for (DesiredUser user : users) {
            String templateName = user.roleTemplateName();
            String roleName = CompiledRole.nameFor(user.workspaceSlugs(), templateName);
            if (!roles.containsKey(roleName)) {
                RoleTemplate template = templates.get(templateName);
                if (template == null) {
                    throw new TemplateDefinitionException("Failed to create role '" + roleName + "'",
                            "Role template '" + templateName + "' referenced by user " + user.email() + " is not defined");
                }
                roles.put(roleName, permissionCompiler.compile(template, user.workspaceSlugs(), desiredSlugs, workspaceIds));
            }
            roleNameByEmail.put(user.email(), roleName);
        }

        log.debug("Compiled {} roles for {} users", roles.size(), users.size());
        return new RoleAssignments(roles, roleNameByEmail);
    }
}
