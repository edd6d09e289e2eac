package uk.gegc.accesssync.shared.exception;

public class UserRowException extends SyncException {

    public enum Reason {
        INCOMPLETE_ROW,
        UNKNOWN_WORKSPACE,
        DUPLICATE_ASSIGNMENT,
        CONFLICTING_ROLE
    }

    private final Reason reason;
    private final String sourceFile;
    private final int rowNumber;

    public UserRowException(Reason reason, String sourceFile, int rowNumber, String detail) {
        super("Failed to parse users from '" + sourceFile + "'", detail);
        this.reason = reason;
        this.sourceFile = sourceFile;
        this.rowNumber = rowNumber;
    }

    public Reason getReason() {
        return reason;
    }

    public String getSourceFile() {
        return sourceFile;
    }

    public int getRowNumber() {
        return rowNumber;
    }
}
