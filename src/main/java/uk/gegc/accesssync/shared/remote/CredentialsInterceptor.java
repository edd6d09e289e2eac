package uk.gegc.accesssync.shared.remote;

import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import uk.gegc.accesssync.shared.exception.RemoteApiException;

import java.io.IOException;
import java.util.function.Supplier;

/**
 * Adds basic authentication from lazily loaded credentials and turns transport failures into
 * {@link RemoteApiException}.
 */
class CredentialsInterceptor implements ClientHttpRequestInterceptor {

    private final Supplier<ApiCredentials> credentialsSource;
    private volatile ApiCredentials credentials;

    CredentialsInterceptor(Supplier<ApiCredentials> credentialsSource) {
        this.credentialsSource = credentialsSource;
    }

    @Override
    public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) {
        ApiCredentials current = credentials();
        request.getHeaders().setBasicAuth(current.id(), current.secret());
        try {
            return execution.execute(request, body);
        } catch (IOException ex) {
            throw new RemoteApiException(request.getMethod().name(), request.getURI().getPath(), ex);
        }
    }

    private ApiCredentials credentials() {
        ApiCredentials current = credentials;
        if (current == null) {
            synchronized (this) {
                current = credentials;
                if (current == null) {
                    current = credentialsSource.get();
                    credentials = current;
                }
            }
        }
        return current;
    }
}
