package uk.gegc.accesssync.features.sheet.application;

import org.springframework.stereotype.Component;
import uk.gegc.accesssync.features.sheet.domain.model.SheetRow;
import uk.gegc.accesssync.shared.exception.HeaderResolutionException;
import uk.gegc.accesssync.shared.exception.HeaderResolutionException.Reason;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps logical column keys to physical column positions using the header row of a sheet.
 * <p>
 * Header text is compared trimmed and case-insensitively. Columns are scanned left to right and
 * each column binds to the first key whose expected text it matches; a second column for a key
 * that is already bound is a duplicate.
 */
@Component
public class HeaderResolver {

    public <K> Map<K, Integer> resolve(String source, SheetRow headerRow, Map<K, String> expectedHeaders) {
        Map<K, String> normalizedExpected = new LinkedHashMap<>();
        expectedHeaders.forEach((key, header) -> normalizedExpected.put(key, normalize(header)));

        Map<K, Integer> found = new HashMap<>();
        for (int index = 0; index < headerRow.cells().size(); index++) {
            if (!(headerRow.value(index) instanceof String text)) {
                continue;
            }
            String value = normalize(text);
            for (Map.Entry<K, String> expected : normalizedExpected.entrySet()) {
                if (!value.equals(expected.getValue())) {
                    continue;
                }
                if (found.containsKey(expected.getKey())) {
                    throw new HeaderResolutionException(source, Reason.DUPLICATE,
                            "Duplicate '" + value + "' columns");
                }
                found.put(expected.getKey(), index);
                break;
            }
        }

        Map<K, Integer> resolved = new LinkedHashMap<>();
        for (K key : normalizedExpected.keySet()) {
            Integer index = found.get(key);
            if (index == null) {
                throw new HeaderResolutionException(source, Reason.MISSING,
                        "Missing '" + key + "' column");
            }
            resolved.put(key, index);
        }
        return resolved;
    }

    private static String normalize(String header) {
        return header == null ? "" : header.trim().toLowerCase(Locale.ROOT);
    }
}
