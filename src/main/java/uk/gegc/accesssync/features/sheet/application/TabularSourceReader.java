package uk.gegc.accesssync.features.sheet.application;

import uk.gegc.accesssync.features.sheet.domain.model.TabularSource;

import java.nio.file.Path;

public interface TabularSourceReader {

    /**
     * Read every sheet of the workbook at {@code path}.
     *
     * @throws uk.gegc.accesssync.shared.exception.SyncException if the file cannot be read
     */
    TabularSource read(Path path);
}
