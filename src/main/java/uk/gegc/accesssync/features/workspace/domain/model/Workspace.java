package uk.gegc.accesssync.features.workspace.domain.model;

import java.util.Locale;

/**
 * A desired workspace.
 *
 * @param slug lowercase natural key
 * @param name plain name as declared, without the slug prefix
 */
public record Workspace(String slug, String name) {

    public Workspace {
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("Workspace slug must not be blank");
        }
        slug = slug.trim().toLowerCase(Locale.ROOT);
        name = name == null ? "" : name.trim();
    }

    /**
     * Name as stored remotely, e.g. {@code [MAIN] Main Campus}.
     */
    public String displayName() {
        return "[" + slug.toUpperCase(Locale.ROOT) + "] " + name;
    }
}
