package uk.gegc.accesssync.shared.exception;

public class RemoteApiException extends SyncException {

    private final int statusCode;

    public RemoteApiException(String method, String uri, int statusCode, String body) {
        super("Remote API request failed",
                String.format("%s %s returned %d%s", method, uri, statusCode,
                        body == null || body.isBlank() ? "" : ": " + body.trim()));
        this.statusCode = statusCode;
    }

    public RemoteApiException(String method, String uri, Throwable cause) {
        super("Remote API request failed",
                String.format("%s %s: %s", method, uri,
                        cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()),
                cause);
        this.statusCode = -1;
    }

    private RemoteApiException(String detail, int statusCode) {
        super("Remote API request failed", detail);
        this.statusCode = statusCode;
    }

    /**
     * A successful response whose body cannot be used.
     */
    public static RemoteApiException invalidResponse(String method, String uri, String problem) {
        return new RemoteApiException(String.format("%s %s returned an invalid response: %s", method, uri, problem), -1);
    }

    /**
     * HTTP error status of the failed call, {@code -1} when the call failed without one.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
