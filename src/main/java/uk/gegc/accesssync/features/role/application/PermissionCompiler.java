package uk.gegc.accesssync.features.role.application;

import org.springframework.stereotype.Component;
import uk.gegc.accesssync.features.role.domain.model.CompiledRole;
import uk.gegc.accesssync.features.role.domain.model.PermissionDocument;
import uk.gegc.accesssync.features.role.domain.model.RoleTemplate;
import uk.gegc.accesssync.features.role.domain.model.WorkspacePermission;
import uk.gegc.accesssync.features.role.domain.model.WorkspacePermissions;
import uk.gegc.accesssync.features.workspace.domain.model.WorkspaceIdentifiers;
import uk.gegc.accesssync.shared.exception.UnresolvedWorkspaceException;

import java.util.*;

/**
 * Expands a role template against a group's primary workspaces.
 * <p>
 * The document holds the template's organization flags, one primary entry per primary workspace
 * and, when the template grants anything on other workspaces, one entry for every remaining
 * desired workspace.
 */
@Component
public class PermissionCompiler {

    public CompiledRole compile(RoleTemplate template,
                                List<String> primarySlugs,
                                Collection<String> desiredSlugs,
                                WorkspaceIdentifiers workspaceIds) {
        String roleName = CompiledRole.nameFor(primarySlugs, template.name());
        Set<String> primary = new LinkedHashSet<>(primarySlugs);

        List<WorkspacePermissions> entries = new ArrayList<>();
        for (String slug : primary) {
            entries.add(entry(roleName, slug, workspaceIds, template.primaryWorkspaces()));
        }
        if (template.grantsOtherWorkspaces()) {
            for (String slug : desiredSlugs) {
                if (!primary.contains(slug)) {
                    entries.add(entry(roleName, slug, workspaceIds, template.otherWorkspaces()));
                }
            }
        }

        PermissionDocument document = new PermissionDocument(template.organization(), entries);
        return new CompiledRole(roleName, template.name(), List.copyOf(primary), document);
    }

    private static WorkspacePermissions entry(String roleName,
                                              String slug,
                                              WorkspaceIdentifiers workspaceIds,
                                              Map<WorkspacePermission, Boolean> flags) {
        String workspaceId = workspaceIds.find(slug)
                .orElseThrow(() -> new UnresolvedWorkspaceException(roleName, slug));
        return new WorkspacePermissions(workspaceId, flags);
    }
}
