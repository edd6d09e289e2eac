package uk.gegc.accesssync.shared.remote;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import uk.gegc.accesssync.shared.config.AccessSyncProperties;
import uk.gegc.accesssync.shared.exception.RemoteApiException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.function.Supplier;

@Configuration
public class RemoteApiConfig {

    static final String API_PATH = "/api";

    @Bean
    public RestClient accessManagementRestClient(AccessSyncProperties properties, ObjectMapper objectMapper) {
        Path credentialsFile = Path.of(properties.getApi().getCredentials());
        return createRestClient(properties.getApi().getUrl(), () -> ApiCredentials.read(credentialsFile, objectMapper));
    }

    /**
     * REST client rooted at {@code baseUrl + /api}. Error responses raise {@link RemoteApiException}.
     */
    public static RestClient createRestClient(String baseUrl, Supplier<ApiCredentials> credentials) {
        String root = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return RestClient.builder()
                .baseUrl(root + API_PATH)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .requestInterceptor(new CredentialsInterceptor(credentials))
                .defaultStatusHandler(HttpStatusCode::isError, (request, response) -> {
                    String body = new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    throw new RemoteApiException(request.getMethod().name(), request.getURI().getPath(),
                            response.getStatusCode().value(), body);
                })
                .build();
    }
}
