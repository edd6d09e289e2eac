package uk.gegc.accesssync.features.sync.domain.model;

import uk.gegc.accesssync.features.role.domain.model.RoleTemplate;
import uk.gegc.accesssync.features.user.domain.model.DesiredUser;
import uk.gegc.accesssync.features.workspace.domain.model.Workspace;

import java.util.*;

/**
 * Everything the workbooks declare, validated.
 */
public record DesiredState(List<Workspace> workspaces, Map<String, RoleTemplate> roleTemplates, List<DesiredUser> users) {

    public DesiredState {
        workspaces = List.copyOf(workspaces);
        roleTemplates = Collections.unmodifiableMap(new LinkedHashMap<>(roleTemplates));
        users = List.copyOf(users);
    }

    public List<String> workspaceSlugs() {
        return workspaces.stream().map(Workspace::slug).toList();
    }
}
