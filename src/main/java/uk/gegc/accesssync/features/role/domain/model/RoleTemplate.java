package uk.gegc.accesssync.features.role.domain.model;

import java.util.*;

/**
 * A named permission profile before it is expanded against concrete workspaces.
 */
public record RoleTemplate(
        String name,
        Map<OrganizationPermission, Boolean> organization,
        Map<WorkspacePermission, Boolean> primaryWorkspaces,
        Map<WorkspacePermission, Boolean> otherWorkspaces
) {

    public RoleTemplate {
        Objects.requireNonNull(name, "name");
        organization = Collections.unmodifiableMap(new EnumMap<>(organization));
        primaryWorkspaces = Collections.unmodifiableMap(new EnumMap<>(primaryWorkspaces));
        otherWorkspaces = Collections.unmodifiableMap(new EnumMap<>(otherWorkspaces));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * True when any other-workspace flag is granted, which extends the role to every workspace
     * outside its primary set.
     */
    public boolean grantsOtherWorkspaces() {
        return otherWorkspaces.containsValue(Boolean.TRUE);
    }

    /**
     * Every flag keyed by its dotted path, e.g. {@code other_workspaces.view_phi}.
     */
    public Map<String, Boolean> permissionPaths() {
        Map<String, Boolean> paths = new LinkedHashMap<>();
        organization.forEach((permission, value) -> paths.put(PermissionScope.ORGANIZATION.path(permission), value));
        primaryWorkspaces.forEach((permission, value) -> paths.put(PermissionScope.PRIMARY_WORKSPACES.path(permission), value));
        otherWorkspaces.forEach((permission, value) -> paths.put(PermissionScope.OTHER_WORKSPACES.path(permission), value));
        return paths;
    }

    /**
     * Collects flags for a template. Every known flag starts out {@code false}.
     */
    public static final class Builder {

        private String name;
        private final Map<OrganizationPermission, Boolean> organization = new EnumMap<>(OrganizationPermission.class);
        private final Map<WorkspacePermission, Boolean> primaryWorkspaces = new EnumMap<>(WorkspacePermission.class);
        private final Map<WorkspacePermission, Boolean> otherWorkspaces = new EnumMap<>(WorkspacePermission.class);

        private Builder() {
            for (OrganizationPermission permission : OrganizationPermission.values()) {
                organization.put(permission, false);
            }
            for (WorkspacePermission permission : WorkspacePermission.values()) {
                primaryWorkspaces.put(permission, false);
                otherWorkspaces.put(permission, false);
            }
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public String name() {
            return name;
        }

        public Builder grant(PermissionCategory category, LabelledPermission permission, boolean value) {
            switch (category.scope()) {
                case ORGANIZATION -> organization.put((OrganizationPermission) permission, value);
                case PRIMARY_WORKSPACES -> primaryWorkspaces.put((WorkspacePermission) permission, value);
                case OTHER_WORKSPACES -> otherWorkspaces.put((WorkspacePermission) permission, value);
            }
            return this;
        }

        public RoleTemplate build() {
            return new RoleTemplate(name, organization, primaryWorkspaces, otherWorkspaces);
        }
    }
}
