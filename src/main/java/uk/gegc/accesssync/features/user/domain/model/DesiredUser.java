package uk.gegc.accesssync.features.user.domain.model;

import java.util.*;

/**
 * A user as declared across all user workbooks, merged by email.
 *
 * @param assignments workspace assignments keyed by slug, in declaration order
 */
public record DesiredUser(String email, String name, boolean active, Map<String, WorkspaceAssignment> assignments) {

    public DesiredUser {
        Objects.requireNonNull(email, "email");
        if (assignments == null || assignments.isEmpty()) {
            throw new IllegalArgumentException("User " + email + " needs at least one workspace assignment");
        }
        assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
    }

    /**
     * Template shared by every assignment of this user.
     */
    public String roleTemplateName() {
        return assignments.values().iterator().next().roleTemplateName();
    }

    public List<String> workspaceSlugs() {
        return List.copyOf(assignments.keySet());
    }
}
