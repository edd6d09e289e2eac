package uk.gegc.accesssync.features.role.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Flags granted on a single workspace.
 */
public enum WorkspacePermission implements LabelledPermission {
    READ_PATIENTS("read_patients", "Read Patients"),
    MANAGE_ACCESS_PATIENTS("manage_access_patients", "Manage Patient Access"),
    VIEW_PHI("view_phi", "View PHI"),
    DOWNLOAD_DICOM("download_dicom", "Download DICOM"),
    UPLOAD_DICOM("upload_dicom", "Upload DICOM"),
    WRITE_PATIENTS("write_patients", "Write Patients"),
    CONTOUR_PATIENTS("contour_patients", "Contour Patients"),
    DELETE_PATIENTS("delete_patients", "Delete Patients"),
    READ_COLLECTIONS("read_collections", "Read Collections"),
    WRITE_COLLECTIONS("write_collections", "Write Collections"),
    DELETE_COLLECTIONS("delete_collections", "Delete Collections"),
    COLLABORATOR("collaborator", "Collaborator");

    private final String key;
    private final String label;

    WorkspacePermission(String key, String label) {
        this.key = key;
        this.label = label;
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public String label() {
        return label;
    }

    public static Optional<WorkspacePermission> fromKey(String key) {
        return Arrays.stream(values()).filter(permission -> permission.key.equals(key)).findFirst();
    }
}
