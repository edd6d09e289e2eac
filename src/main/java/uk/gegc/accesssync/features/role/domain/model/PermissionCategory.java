package uk.gegc.accesssync.features.role.domain.model;

import java.util.*;

import static uk.gegc.accesssync.features.role.domain.model.OrganizationPermission.*;

/**
 * Category headers accepted in a role template sheet. Each category owns a fixed table from the
 * human readable permission label to the permission it sets.
 */
public enum PermissionCategory {
    ADVANCED_USER("Advanced User Permissions", PermissionScope.ORGANIZATION,
            List.of(CREATE_API_KEYS)),
    ORGANIZATION_MANAGEMENT("Organization Management Permissions", PermissionScope.ORGANIZATION,
            List.of(MANAGE_ACCESS, MANAGE_CUSTOM_METRICS, MANAGE_RENAMING_RULES, MANAGE_TEMPLATE_METRIC_SETS,
                    MANAGE_TEMPLATE_CHECKLISTS, MANAGE_TEMPLATE_STRUCTURE_SETS, MANAGE_WORKSPACE_ALGORITHMS)),
    ALL_WORKSPACES("All Workspaces", PermissionScope.ORGANIZATION,
            List.of(ORGANIZATION_READ_PATIENTS, ORGANIZATION_MANAGE_ACCESS_PATIENTS, ORGANIZATION_VIEW_PHI,
                    ORGANIZATION_DOWNLOAD_DICOM, ORGANIZATION_UPLOAD_DICOM, ORGANIZATION_WRITE_PATIENTS,
                    ORGANIZATION_CONTOUR_PATIENTS, ORGANIZATION_DELETE_PATIENTS, ORGANIZATION_READ_COLLECTIONS,
                    ORGANIZATION_WRITE_COLLECTIONS, ORGANIZATION_DELETE_COLLECTIONS, ORGANIZATION_COLLABORATOR)),
    PRIMARY_WORKSPACES("Primary Workspaces", PermissionScope.PRIMARY_WORKSPACES,
            List.of(WorkspacePermission.values())),
    OTHER_WORKSPACES("Other Workspaces", PermissionScope.OTHER_WORKSPACES,
            List.of(WorkspacePermission.values()));

    private final String title;
    private final PermissionScope scope;
    private final Map<String, LabelledPermission> permissionsByLabel;

    PermissionCategory(String title, PermissionScope scope, List<? extends LabelledPermission> permissions) {
        this.title = title;
        this.scope = scope;
        Map<String, LabelledPermission> byLabel = new LinkedHashMap<>();
        for (LabelledPermission permission : permissions) {
            byLabel.put(permission.label(), permission);
        }
        this.permissionsByLabel = Collections.unmodifiableMap(byLabel);
    }

    public String title() {
        return title;
    }

    public PermissionScope scope() {
        return scope;
    }

    public Collection<LabelledPermission> permissions() {
        return permissionsByLabel.values();
    }

    public Optional<LabelledPermission> findPermission(String label) {
        return Optional.ofNullable(permissionsByLabel.get(label));
    }

    /**
     * Dotted path of the permission behind {@code label}, e.g. {@code primary_workspaces.read_patients}.
     */
    public Optional<String> pathOf(String label) {
        return findPermission(label).map(scope::path);
    }

    public static Optional<PermissionCategory> fromTitle(String title) {
        if (title == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(category -> category.title.equals(title))
                .findFirst();
    }
}
