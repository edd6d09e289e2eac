package uk.gegc.accesssync.shared.exception;

/**
 * Base class for every failure that stops a synchronization run.
 * <p>
 * The message is a short headline ("Failed to read 'roles.xlsx' role template definition"),
 * the detail names the offending row, column or value.
 */
public class SyncException extends RuntimeException {

    private final String detail;

    public SyncException(String message) {
        this(message, (String) null);
    }

    public SyncException(String message, String detail) {
        super(message);
        this.detail = detail;
    }

    public SyncException(String message, String detail, Throwable cause) {
        super(message, cause);
        this.detail = detail;
    }

    public String getDetail() {
        return detail;
    }
}
