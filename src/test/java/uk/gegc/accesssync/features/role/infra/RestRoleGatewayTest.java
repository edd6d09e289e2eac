package uk.gegc.accesssync.features.role.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.accesssync.features.role.domain.model.*;
import uk.gegc.accesssync.shared.exception.RemoteApiException;
import uk.gegc.accesssync.shared.remote.ApiCredentials;
import uk.gegc.accesssync.shared.remote.RemoteApiConfig;

import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RestRoleGateway")
class RestRoleGatewayTest {

    private WireMockServer wireMockServer;
    private RestRoleGateway gateway;

    private final PermissionDocument document = new PermissionDocument(
            Map.of(OrganizationPermission.MANAGE_ACCESS, true),
            List.of(new WorkspacePermissions("7", Map.of(WorkspacePermission.READ_PATIENTS, true))));

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(options().dynamicPort());
        wireMockServer.start();
        gateway = new RestRoleGateway(
                RemoteApiConfig.createRestClient(wireMockServer.baseUrl(), () -> new ApiCredentials("key", "secret")),
                new PermissionDocumentMapper(new ObjectMapper()));
    }

    @AfterEach
    void tearDown() {
        wireMockServer.stop();
    }

    @Test
    @DisplayName("query lists role ids and names")
    void query_mapsSummaries() {
        wireMockServer.stubFor(get("/api/roles").willReturn(okJson("""
                [{"id": "1", "name": "Admin", "user_count": 2}, {"id": "2", "name": "[A] Standard"}]
                """)));

        assertThat(gateway.query()).containsExactly(
                new RoleSummary("1", "Admin"),
                new RoleSummary("2", "[A] Standard"));
    }

    @Test
    @DisplayName("get reads the permission document without bookkeeping fields")
    void get_readsPermissions() {
        // Given
        wireMockServer.stubFor(get("/api/roles/2").willReturn(okJson("""
                {"id": "2", "name": "[A] Standard", "permissions": {
                    "manage_access": true,
                    "private": false,
                    "user": null,
                    "workspaces": [{"id": "7", "read_patients": true}]
                }}
                """)));

        // When
        RemoteRole role = gateway.get("2");

        // Then
        assertThat(role).isEqualTo(new RemoteRole("2", "[A] Standard", document));
    }

    @Test
    @DisplayName("create posts name and permissions")
    void create_postsRole() {
        wireMockServer.stubFor(post("/api/roles").willReturn(okJson("""
                {"id": "8", "name": "[A] Standard"}
                """)));

        RemoteRole created = gateway.create("[A] Standard", document);

        assertThat(created).isEqualTo(new RemoteRole("8", "[A] Standard", document));
        wireMockServer.verify(postRequestedFor(urlEqualTo("/api/roles"))
                .withRequestBody(equalToJson("""
                        {"name": "[A] Standard", "permissions": {
                            "manage_access": true,
                            "workspaces": [{"id": "7", "read_patients": true}]
                        }}
                        """)));
    }

    @Test
    @DisplayName("save puts the document with private reset and no user")
    void save_putsRole() {
        wireMockServer.stubFor(put("/api/roles/8").willReturn(ok()));
        RemoteRole role = new RemoteRole("8", "[A] Standard", document);

        gateway.save(role);

        wireMockServer.verify(putRequestedFor(urlEqualTo("/api/roles/8"))
                .withRequestBody(equalToJson("""
                        {"name": "[A] Standard", "permissions": {
                            "manage_access": true,
                            "private": false,
                            "user": null,
                            "workspaces": [{"id": "7", "read_patients": true}]
                        }}
                        """)));
    }

    @Test
    @DisplayName("create fails with a remote error when the response carries no id")
    void create_whenResponseHasNoId_thenRemoteApiException() {
        wireMockServer.stubFor(post("/api/roles").willReturn(okJson("""
                {"name": "[A] Standard"}
                """)));

        assertThatThrownBy(() -> gateway.create("[A] Standard", document))
                .isInstanceOf(RemoteApiException.class)
                .extracting(ex -> ((RemoteApiException) ex).getDetail())
                .isEqualTo("POST /roles returned an invalid response: Role '[A] Standard' was created without an id");
    }

    @Test
    @DisplayName("get fails with a remote error when the response body is empty")
    void get_whenResponseEmpty_thenRemoteApiException() {
        wireMockServer.stubFor(get("/api/roles/5").willReturn(aResponse().withStatus(200)));

        assertThatThrownBy(() -> gateway.get("5"))
                .isInstanceOf(RemoteApiException.class)
                .extracting(ex -> ((RemoteApiException) ex).getDetail())
                .isEqualTo("GET /roles/5 returned an invalid response: Response body is empty");
    }
}
