package uk.gegc.accesssync.features.role.domain.model;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * A role template expanded against the primary workspaces of a user group. Roles are identified
 * by name, so users sharing workspaces and template share one role.
 */
public record CompiledRole(
        String name,
        String templateName,
        List<String> workspaceSlugs,
        PermissionDocument permissions
) {

    public CompiledRole {
        workspaceSlugs = List.copyOf(workspaceSlugs);
    }

    /**
     * Role name for a template and its primary workspaces in declared order, e.g. {@code [B+A] Standard}.
     */
    public static String nameFor(List<String> workspaceSlugs, String templateName) {
        String slugs = workspaceSlugs.stream()
                .map(slug -> slug.toUpperCase(Locale.ROOT))
                .collect(Collectors.joining("+"));
        return "[" + slugs + "] " + templateName;
    }
}
