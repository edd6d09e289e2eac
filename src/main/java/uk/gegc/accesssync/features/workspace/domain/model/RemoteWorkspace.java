package uk.gegc.accesssync.features.workspace.domain.model;

public record RemoteWorkspace(String id, String slug, String name, boolean protectedWorkspace) {

    public RemoteWorkspace withName(String newName) {
        return new RemoteWorkspace(id, slug, newName, protectedWorkspace);
    }
}
