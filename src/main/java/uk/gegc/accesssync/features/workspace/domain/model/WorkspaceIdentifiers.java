package uk.gegc.accesssync.features.workspace.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Remote identifiers of the desired workspaces, keyed by slug. Produced by the workspace pass and
 * consumed when roles are compiled.
 */
public final class WorkspaceIdentifiers {

    private final Map<String, String> idsBySlug;

    private WorkspaceIdentifiers(Map<String, String> idsBySlug) {
        this.idsBySlug = Collections.unmodifiableMap(new LinkedHashMap<>(idsBySlug));
    }

    public static WorkspaceIdentifiers of(Map<String, String> idsBySlug) {
        return new WorkspaceIdentifiers(idsBySlug);
    }

    public static WorkspaceIdentifiers fromRemote(Map<String, RemoteWorkspace> resolved) {
        Map<String, String> ids = new LinkedHashMap<>();
        resolved.forEach((slug, workspace) -> ids.put(slug, workspace.id()));
        return new WorkspaceIdentifiers(ids);
    }

    public Optional<String> find(String slug) {
        return Optional.ofNullable(idsBySlug.get(slug));
    }

    @Override
    public String toString() {
        return "WorkspaceIdentifiers" + idsBySlug;
    }
}
