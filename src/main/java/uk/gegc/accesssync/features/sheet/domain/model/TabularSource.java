package uk.gegc.accesssync.features.sheet.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * A workbook read into memory.
 *
 * @param location file the workbook was read from, used in diagnostics
 * @param sheets   sheets in workbook order
 */
public record TabularSource(String location, List<SheetData> sheets) {

    public TabularSource {
        sheets = sheets == null ? List.of() : List.copyOf(sheets);
    }

    public List<String> sheetNames() {
        return sheets.stream().map(SheetData::name).toList();
    }

    public Optional<SheetData> findSheet(String name) {
        return sheets.stream()
                .filter(sheet -> sheet.name().equals(name))
                .findFirst();
    }
}
