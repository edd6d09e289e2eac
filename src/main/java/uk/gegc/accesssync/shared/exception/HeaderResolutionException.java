package uk.gegc.accesssync.shared.exception;

public class HeaderResolutionException extends SyncException {

    public enum Reason {
        MISSING,
        DUPLICATE
    }

    private final Reason reason;

    public HeaderResolutionException(String source, Reason reason, String detail) {
        super("Failed to resolve headers in '" + source + "' workbook", detail);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
