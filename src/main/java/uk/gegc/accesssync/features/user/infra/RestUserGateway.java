package uk.gegc.accesssync.features.user.infra;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import uk.gegc.accesssync.features.user.domain.model.RemoteUser;
import uk.gegc.accesssync.features.user.domain.repository.UserGateway;
import uk.gegc.accesssync.shared.exception.RemoteApiException;

import java.util.List;
import java.util.Locale;

@Component
@RequiredArgsConstructor
public class RestUserGateway implements UserGateway {

    private static final ParameterizedTypeReference<List<UserResource>> USER_LIST =
            new ParameterizedTypeReference<>() {
            };

    private final RestClient accessManagementRestClient;

    @Override
    public List<RemoteUser> query() {
        List<UserResource> body = accessManagementRestClient.get()
                .uri("/users")
                .retrieve()
                .body(USER_LIST);
        if (body == null) {
            return List.of();
        }
        return body.stream().map(UserResource::toDomain).toList();
    }

    @Override
    public RemoteUser create(String email, String name, String roleId) {
        UserResource created = accessManagementRestClient.post()
                .uri("/users")
                .contentType(MediaType.APPLICATION_JSON)
                .body(new UserRequest(email, name, null, roleId))
                .retrieve()
                .body(UserResource.class);
        if (created == null || created.id() == null) {
            throw RemoteApiException.invalidResponse("POST", "/users",
                    "User '" + email + "' was created without an id");
        }
        return created.toDomain();
    }

    @Override
    public RemoteUser get(String id) {
        UserResource body = accessManagementRestClient.get()
                .uri("/users/{id}", id)
                .retrieve()
                .body(UserResource.class);
        if (body == null) {
            throw RemoteApiException.invalidResponse("GET", "/users/" + id, "Response body is empty");
        }
        return body.toDomain();
    }

    @Override
    public RemoteUser save(RemoteUser user) {
        accessManagementRestClient.put()
                .uri("/users/{id}", user.id())
                .contentType(MediaType.APPLICATION_JSON)
                .body(new UserRequest(user.email(), user.name(), user.active(), user.roleId()))
                .retrieve()
                .toBodilessEntity();
        return user;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record UserRequest(
            @JsonProperty("email") String email,
            @JsonProperty("name") String name,
            @JsonProperty("active") Boolean active,
            @JsonProperty("role_id") String roleId
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record UserResource(
            @JsonProperty("id") String id,
            @JsonProperty("email") String email,
            @JsonProperty("name") String name,
            @JsonProperty("active") Boolean active,
            @JsonProperty("role") RoleReference role,
            @JsonProperty("role_id") String roleId
    ) {

        RemoteUser toDomain() {
            String resolvedRoleId = roleId != null ? roleId : role != null ? role.id() : null;
            return new RemoteUser(id, email == null ? null : email.toLowerCase(Locale.ROOT), name,
                    !Boolean.FALSE.equals(active), resolvedRoleId);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RoleReference(@JsonProperty("id") String id, @JsonProperty("name") String name) {
    }
}
