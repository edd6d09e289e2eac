package uk.gegc.accesssync.features.role.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Organization level flags. The {@code ORGANIZATION_*} flags apply to every workspace at once.
 */
public enum OrganizationPermission implements LabelledPermission {
    // Advanced user
    CREATE_API_KEYS("create_api_keys", "Create API Keys"),

    // Organization management
    MANAGE_ACCESS("manage_access", "Manage Users, Roles, and Workspaces"),
    MANAGE_CUSTOM_METRICS("manage_custom_metrics", "Manage Custom Metrics"),
    MANAGE_RENAMING_RULES("manage_renaming_rules", "Manage Renaming Rules"),
    MANAGE_TEMPLATE_METRIC_SETS("manage_template_metric_sets", "Manage Scorecard Templates"),
    MANAGE_TEMPLATE_CHECKLISTS("manage_template_checklists", "Manage Checklist Templates"),
    MANAGE_TEMPLATE_STRUCTURE_SETS("manage_template_structure_sets", "Manage Structure Set Templates"),
    MANAGE_WORKSPACE_ALGORITHMS("manage_workspace_algorithms", "Manage Workspace Algorithms"),

    // All workspaces
    ORGANIZATION_READ_PATIENTS(WorkspacePermission.READ_PATIENTS),
    ORGANIZATION_MANAGE_ACCESS_PATIENTS(WorkspacePermission.MANAGE_ACCESS_PATIENTS),
    ORGANIZATION_VIEW_PHI(WorkspacePermission.VIEW_PHI),
    ORGANIZATION_DOWNLOAD_DICOM(WorkspacePermission.DOWNLOAD_DICOM),
    ORGANIZATION_UPLOAD_DICOM(WorkspacePermission.UPLOAD_DICOM),
    ORGANIZATION_WRITE_PATIENTS(WorkspacePermission.WRITE_PATIENTS),
    ORGANIZATION_CONTOUR_PATIENTS(WorkspacePermission.CONTOUR_PATIENTS),
    ORGANIZATION_DELETE_PATIENTS(WorkspacePermission.DELETE_PATIENTS),
    ORGANIZATION_READ_COLLECTIONS(WorkspacePermission.READ_COLLECTIONS),
    ORGANIZATION_WRITE_COLLECTIONS(WorkspacePermission.WRITE_COLLECTIONS),
    ORGANIZATION_DELETE_COLLECTIONS(WorkspacePermission.DELETE_COLLECTIONS),
    ORGANIZATION_COLLABORATOR(WorkspacePermission.COLLABORATOR);

    private final String key;
    private final String label;

    OrganizationPermission(String key, String label) {
        this.key = key;
        this.label = label;
    }

    OrganizationPermission(WorkspacePermission allWorkspaces) {
        this("organization_" + allWorkspaces.key(), allWorkspaces.label());
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public String label() {
        return label;
    }

    public static Optional<OrganizationPermission> fromKey(String key) {
        return Arrays.stream(values()).filter(permission -> permission.key.equals(key)).findFirst();
    }
}
