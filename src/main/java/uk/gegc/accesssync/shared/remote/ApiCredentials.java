package uk.gegc.accesssync.shared.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import uk.gegc.accesssync.shared.exception.SyncException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * API key pair as stored in the credentials JSON file ({@code {"id": "...", "secret": "..."}}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiCredentials(String id, String secret) {

    public static ApiCredentials read(Path file, ObjectMapper objectMapper) {
        try {
            ApiCredentials credentials = objectMapper.readValue(Files.readAllBytes(file), ApiCredentials.class);
            if (credentials.id() == null || credentials.id().isBlank()
                    || credentials.secret() == null || credentials.secret().isBlank()) {
                throw new SyncException("Failed to read API credentials from '" + file + "'",
                        "Credentials file must contain 'id' and 'secret'");
            }
            return credentials;
        } catch (IOException ex) {
            throw new SyncException("Failed to read API credentials from '" + file + "'",
                    ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName(), ex);
        }
    }

    @Override
    public String toString() {
        return "ApiCredentials[id=" + id + ", secret=****]";
    }
}
