package uk.gegc.accesssync.features.workspace.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.accesssync.features.sheet.application.HeaderResolver;
import uk.gegc.accesssync.features.sheet.application.TabularSourceReader;
import uk.gegc.accesssync.features.sheet.domain.model.SheetData;
import uk.gegc.accesssync.features.sheet.domain.model.SheetRow;
import uk.gegc.accesssync.features.sheet.domain.model.TabularSource;
import uk.gegc.accesssync.features.workspace.domain.model.Workspace;
import uk.gegc.accesssync.features.workspace.domain.model.WorkspaceColumns;
import uk.gegc.accesssync.shared.exception.SheetNotFoundException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the desired workspaces from the {@value #WORKSPACES_SHEET} sheet.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkspaceLoader {

    public static final String WORKSPACES_SHEET = "Workspaces";

    private static final String SLUG = "slug";
    private static final String NAME = "name";

    private final TabularSourceReader tabularSourceReader;
    private final HeaderResolver headerResolver;

    /**
     * Load workspaces in declaration order. Rows without a slug or a name are skipped; a repeated
     * slug replaces the earlier declaration and keeps its position.
     */
    public List<Workspace> load(Path workbookPath, WorkspaceColumns columns) {
        TabularSource source = tabularSourceReader.read(workbookPath);
        SheetData sheet = source.findSheet(WORKSPACES_SHEET)
                .orElseThrow(() -> new SheetNotFoundException(
                        "Failed to read '" + source.location() + "' workspace workbook", WORKSPACES_SHEET));

        Map<String, String> expected = new LinkedHashMap<>();
        expected.put(SLUG, columns.slug());
        expected.put(NAME, columns.name());
        Map<String, Integer> headers = headerResolver.resolve(source.location(), sheet.header(), expected);

        Map<String, Workspace> workspaces = new LinkedHashMap<>();
        for (SheetRow row : sheet.rows()) {
            String slug = row.text(headers.get(SLUG));
            String name = row.text(headers.get(NAME));
            if (slug == null || name == null) {
                continue;
            }
            Workspace workspace = new Workspace(slug, name);
            Workspace previous = workspaces.put(workspace.slug(), workspace);
            if (previous != null) {
                log.warn("Workspace '{}' declared again at row {} of {}, replacing '{}' with '{}'",
                        workspace.slug(), row.rowNumber(), source.location(), previous.name(), workspace.name());
            }
        }

        log.debug("Loaded {} workspaces from {}", workspaces.size(), source.location());
        return new ArrayList<>(workspaces.values());
    }
}
