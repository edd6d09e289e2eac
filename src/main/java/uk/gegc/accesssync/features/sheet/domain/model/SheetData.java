package uk.gegc.accesssync.features.sheet.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Contents of a single worksheet.
 *
 * @param name   sheet name
 * @param header first row of the sheet
 * @param rows   every row after the first, including empty ones
 */
public record SheetData(String name, SheetRow header, List<SheetRow> rows) {

    public SheetData {
        header = header == null ? new SheetRow(1, List.of()) : header;
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    /**
     * Header row followed by the data rows, for sheets that have no header.
     */
    public List<SheetRow> allRows() {
        List<SheetRow> all = new ArrayList<>(rows.size() + 1);
        all.add(header);
        all.addAll(rows);
        return all;
    }
}
