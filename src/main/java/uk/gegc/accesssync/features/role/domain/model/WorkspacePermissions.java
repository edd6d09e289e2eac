package uk.gegc.accesssync.features.role.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Flags a role holds on one workspace, identified by its remote id.
 */
public record WorkspacePermissions(String workspaceId, Map<WorkspacePermission, Boolean> flags) {

    public WorkspacePermissions {
        Objects.requireNonNull(workspaceId, "workspaceId");
        flags = flags.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(flags));
    }
}
