package uk.gegc.accesssync.shared.exception;

public class SheetNotFoundException extends SyncException {

    private final String sheetName;

    public SheetNotFoundException(String message, String sheetName) {
        super(message, "Workbook must contain '" + sheetName + "' sheet");
        this.sheetName = sheetName;
    }

    public String getSheetName() {
        return sheetName;
    }
}
