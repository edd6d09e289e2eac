package uk.gegc.accesssync.features.sheet.domain.model;

import java.math.BigDecimal;
import java.util.*;

/**
 * One worksheet row as typed cell values. Each value is a {@link String}, {@link Boolean},
 * {@link Double} or {@code null} for an absent cell.
 *
 * @param rowNumber 1-based row number as shown by spreadsheet applications
 * @param cells     cell values from column 0 up to the last populated column
 */
public record SheetRow(int rowNumber, List<Object> cells) {

    public SheetRow {
        cells = cells == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(cells));
    }

    public static SheetRow of(int rowNumber, Object... values) {
        return new SheetRow(rowNumber, Arrays.asList(values));
    }

    public Object value(int index) {
        if (index < 0 || index >= cells.size()) {
            return null;
        }
        return cells.get(index);
    }

    /**
     * Cell rendered as trimmed text, {@code null} when absent or blank.
     */
    public String text(int index) {
        Object value = value(index);
        if (value == null) {
            return null;
        }
        String text;
        if (value instanceof Double number) {
            text = renderNumber(number);
        } else {
            text = value.toString();
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public boolean isPresent(int index) {
        return text(index) != null;
    }

    /**
     * Lenient boolean: boolean cells as-is, text {@code true}/{@code yes} in any case, anything else false.
     */
    public boolean flag(int index) {
        Object value = value(index);
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = text(index);
        if (text == null) {
            return false;
        }
        String normalized = text.toLowerCase(Locale.ROOT);
        return normalized.equals("true") || normalized.equals("yes");
    }

    public boolean isEmpty() {
        return cells.stream().filter(Objects::nonNull).allMatch(value -> value.toString().isBlank());
    }

    private static String renderNumber(Double number) {
        if (!number.isInfinite() && !number.isNaN() && number == Math.rint(number)) {
            return BigDecimal.valueOf(number).toBigInteger().toString();
        }
        return number.toString();
    }
}
