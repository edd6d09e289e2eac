package uk.gegc.accesssync.features.sheet.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.*;
import org.springframework.stereotype.Component;
import uk.gegc.accesssync.features.sheet.application.TabularSourceReader;
import uk.gegc.accesssync.features.sheet.domain.model.SheetData;
import uk.gegc.accesssync.features.sheet.domain.model.SheetRow;
import uk.gegc.accesssync.features.sheet.domain.model.TabularSource;
import uk.gegc.accesssync.shared.exception.SyncException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code .xlsx} workbooks with Apache POI. Formula cells contribute their cached result,
 * date cells their formatted text.
 */
@Component
@Slf4j
public class XlsxTabularSourceReader implements TabularSourceReader {

    private final DataFormatter formatter = new DataFormatter();

    @Override
    public TabularSource read(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("Workbook path is required");
        }
        log.debug("Reading workbook {}", path);
        try (InputStream input = Files.newInputStream(path);
             Workbook workbook = WorkbookFactory.create(input)) {
            List<SheetData> sheets = new ArrayList<>(workbook.getNumberOfSheets());
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                sheets.add(readSheet(workbook.getSheetAt(i)));
            }
            return new TabularSource(path.toString(), sheets);
        } catch (NoSuchFileException ex) {
            throw new SyncException("Failed to read '" + path + "' workbook", "File does not exist", ex);
        } catch (IOException | RuntimeException ex) {
            throw new SyncException("Failed to read '" + path + "' workbook",
                    ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName(), ex);
        }
    }

    private SheetData readSheet(Sheet sheet) {
        SheetRow header = readRow(sheet.getRow(0), 0);
        List<SheetRow> rows = new ArrayList<>();
        for (int rowIdx = 1; rowIdx <= sheet.getLastRowNum(); rowIdx++) {
            rows.add(readRow(sheet.getRow(rowIdx), rowIdx));
        }
        return new SheetData(sheet.getSheetName(), header, rows);
    }

    private SheetRow readRow(Row row, int rowIdx) {
        if (row == null || row.getLastCellNum() < 0) {
            return new SheetRow(rowIdx + 1, List.of());
        }
        List<Object> cells = new ArrayList<>(row.getLastCellNum());
        for (int i = 0; i < row.getLastCellNum(); i++) {
            cells.add(readCell(row.getCell(i)));
        }
        return new SheetRow(rowIdx + 1, cells);
    }

    private Object readCell(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        return switch (type) {
            case STRING -> {
                String value = cell.getStringCellValue();
                yield value == null || value.isBlank() ? null : value;
            }
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                    ? formatter.formatCellValue(cell)
                    : Double.valueOf(cell.getNumericCellValue());
            case BOOLEAN -> cell.getBooleanCellValue();
            default -> null;
        };
    }
}
