package uk.gegc.accesssync.features.role.domain.model;

import java.util.*;

/**
 * Compiled roles and the role each user was given.
 *
 * @param roles           compiled roles keyed by name, in the order users induced them
 * @param roleNameByEmail role name per user email
 */
public record RoleAssignments(Map<String, CompiledRole> roles, Map<String, String> roleNameByEmail) {

    public RoleAssignments {
        roles = Collections.unmodifiableMap(new LinkedHashMap<>(roles));
        roleNameByEmail = Collections.unmodifiableMap(new LinkedHashMap<>(roleNameByEmail));
    }

    public CompiledRole roleOf(String email) {
        String roleName = roleNameByEmail.get(email);
        if (roleName == null) {
            throw new IllegalArgumentException("No role compiled for user " + email);
        }
        return roles.get(roleName);
    }

    public Collection<CompiledRole> compiledRoles() {
        return roles.values();
    }
}
