package uk.gegc.accesssync.features.workspace.infra;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import uk.gegc.accesssync.features.workspace.domain.model.RemoteWorkspace;
import uk.gegc.accesssync.features.workspace.domain.repository.WorkspaceGateway;
import uk.gegc.accesssync.shared.exception.RemoteApiException;

import java.util.List;

@Component
@RequiredArgsConstructor
public class RestWorkspaceGateway implements WorkspaceGateway {

    private static final ParameterizedTypeReference<List<WorkspaceResource>> WORKSPACE_LIST =
            new ParameterizedTypeReference<>() {
            };

    private final RestClient accessManagementRestClient;

    @Override
    public List<RemoteWorkspace> query() {
        List<WorkspaceResource> body = accessManagementRestClient.get()
                .uri("/workspaces")
                .retrieve()
                .body(WORKSPACE_LIST);
        if (body == null) {
            return List.of();
        }
        return body.stream().map(WorkspaceResource::toDomain).toList();
    }

    @Override
    public RemoteWorkspace create(String slug, String name) {
        WorkspaceResource created = accessManagementRestClient.post()
                .uri("/workspaces")
                .contentType(MediaType.APPLICATION_JSON)
                .body(new WorkspaceResource(null, slug, name, false))
                .retrieve()
                .body(WorkspaceResource.class);
        if (created == null || created.id() == null) {
            throw RemoteApiException.invalidResponse("POST", "/workspaces",
                    "Workspace '" + slug + "' was created without an id");
        }
        return created.toDomain();
    }

    @Override
    public RemoteWorkspace save(RemoteWorkspace workspace) {
        accessManagementRestClient.put()
                .uri("/workspaces/{id}", workspace.id())
                .contentType(MediaType.APPLICATION_JSON)
                .body(new WorkspaceResource(null, workspace.slug(), workspace.name(), workspace.protectedWorkspace()))
                .retrieve()
                .toBodilessEntity();
        return workspace;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record WorkspaceResource(
            @JsonProperty("id") String id,
            @JsonProperty("slug") String slug,
            @JsonProperty("name") String name,
            @JsonProperty("protected") Boolean protectedWorkspace
    ) {

        RemoteWorkspace toDomain() {
            return new RemoteWorkspace(id, slug, name, Boolean.TRUE.equals(protectedWorkspace));
        }
    }
}
