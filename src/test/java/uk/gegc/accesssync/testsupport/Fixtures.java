package uk.gegc.accesssync.testsupport;

import uk.gegc.accesssync.features.role.domain.model.OrganizationPermission;
import uk.gegc.accesssync.features.role.domain.model.PermissionCategory;
import uk.gegc.accesssync.features.role.domain.model.RoleTemplate;
import uk.gegc.accesssync.features.role.domain.model.WorkspacePermission;
import uk.gegc.accesssync.features.user.domain.model.DesiredUser;
import uk.gegc.accesssync.features.user.domain.model.WorkspaceAssignment;

import java.util.LinkedHashMap;
import java.util.Map;

public final class Fixtures {

    private Fixtures() {
    }

    /**
     * Reads patients on primary workspaces and may create API keys.
     */
    public static RoleTemplate standardTemplate() {
        return RoleTemplate.builder()
                .name("Standard")
                .grant(PermissionCategory.ADVANCED_USER, OrganizationPermission.CREATE_API_KEYS, true)
                .grant(PermissionCategory.PRIMARY_WORKSPACES, WorkspacePermission.READ_PATIENTS, true)
                .grant(PermissionCategory.PRIMARY_WORKSPACES, WorkspacePermission.VIEW_PHI, true)
                .build();
    }

    /**
     * Standard access plus read access to every other workspace.
     */
    public static RoleTemplate broadTemplate() {
        return RoleTemplate.builder()
                .name("Broad")
                .grant(PermissionCategory.PRIMARY_WORKSPACES, WorkspacePermission.READ_PATIENTS, true)
                .grant(PermissionCategory.OTHER_WORKSPACES, WorkspacePermission.READ_PATIENTS, true)
                .build();
    }

    public static DesiredUser user(String email, String name, boolean active, String template, String... slugs) {
        Map<String, WorkspaceAssignment> assignments = new LinkedHashMap<>();
        int row = 2;
        for (String slug : slugs) {
            assignments.put(slug, new WorkspaceAssignment(slug, template, "users/" + slug + ".xlsx", row++));
        }
        return new DesiredUser(email, name, active, assignments);
    }
}
