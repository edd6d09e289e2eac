package uk.gegc.accesssync.features.role.infra;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import uk.gegc.accesssync.features.role.domain.model.PermissionDocument;
import uk.gegc.accesssync.features.role.domain.model.RemoteRole;
import uk.gegc.accesssync.features.role.domain.model.RoleSummary;
import uk.gegc.accesssync.features.role.domain.repository.RoleGateway;
import uk.gegc.accesssync.shared.exception.RemoteApiException;

import java.util.List;

@Component
@RequiredArgsConstructor
public class RestRoleGateway implements RoleGateway {

    private static final ParameterizedTypeReference<List<RoleSummaryResource>> ROLE_LIST =
            new ParameterizedTypeReference<>() {
            };

    private final RestClient accessManagementRestClient;
    private final PermissionDocumentMapper permissionDocumentMapper;

    @Override
    public List<RoleSummary> query() {
        List<RoleSummaryResource> body = accessManagementRestClient.get()
                .uri("/roles")
                .retrieve()
                .body(ROLE_LIST);
        if (body == null) {
            return List.of();
        }
        return body.stream()
                .map(resource -> new RoleSummary(resource.id(), resource.name()))
                .toList();
    }

    @Override
    public RemoteRole create(String name, PermissionDocument permissions) {
        ObjectNode request = JsonNodeFactory.instance.objectNode();
        request.put("name", name);
        request.set("permissions", permissionDocumentMapper.toJson(permissions));

        JsonNode created = accessManagementRestClient.post()
                .uri("/roles")
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(JsonNode.class);
        if (created == null || !created.hasNonNull("id")) {
            throw RemoteApiException.invalidResponse("POST", "/roles",
                    "Role '" + name + "' was created without an id");
        }
        PermissionDocument stored = created.has("permissions")
                ? permissionDocumentMapper.fromJson(created.get("permissions"))
                : permissions;
        return new RemoteRole(created.get("id").asText(), created.path("name").asText(name), stored);
    }

    @Override
    public RemoteRole get(String id) {
        JsonNode body = accessManagementRestClient.get()
                .uri("/roles/{id}", id)
                .retrieve()
                .body(JsonNode.class);
        if (body == null) {
            throw RemoteApiException.invalidResponse("GET", "/roles/" + id, "Response body is empty");
        }
        return new RemoteRole(body.path("id").asText(id), body.path("name").asText(),
                permissionDocumentMapper.fromJson(body.get("permissions")));
    }

    @Override
    public RemoteRole save(RemoteRole role) {
        ObjectNode request = JsonNodeFactory.instance.objectNode();
        request.put("name", role.name());
        request.set("permissions", permissionDocumentMapper.toUpdateJson(role.permissions()));

        accessManagementRestClient.put()
                .uri("/roles/{id}", role.id())
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .toBodilessEntity();
        return role;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RoleSummaryResource(String id, String name) {
    }
}
