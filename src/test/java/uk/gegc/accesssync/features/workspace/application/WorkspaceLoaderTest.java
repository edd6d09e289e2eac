package uk.gegc.accesssync.features.workspace.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.gegc.accesssync.BaseUnitTest;
import uk.gegc.accesssync.features.sheet.application.HeaderResolver;
import uk.gegc.accesssync.features.sheet.infra.XlsxTabularSourceReader;
import uk.gegc.accesssync.features.workspace.domain.model.Workspace;
import uk.gegc.accesssync.features.workspace.domain.model.WorkspaceColumns;
import uk.gegc.accesssync.shared.exception.HeaderResolutionException;
import uk.gegc.accesssync.shared.exception.SheetNotFoundException;
import uk.gegc.accesssync.testsupport.Workbooks;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.gegc.accesssync.testsupport.Workbooks.row;

@DisplayName("WorkspaceLoader")
class WorkspaceLoaderTest extends BaseUnitTest {

    @TempDir
    Path tempDir;

    private final WorkspaceLoader loader = new WorkspaceLoader(new XlsxTabularSourceReader(), new HeaderResolver());

    @Test
    @DisplayName("load reads workspaces in declaration order with lowercase slugs")
    void load_whenValidSheet_thenWorkspacesInOrder() {
        // Given
        Path file = Workbooks.create()
                .sheet("Workspaces",
                        row("Name", "Slug", "Comment"),
                        row("Beta Site", "B", "second"),
                        row("Alpha Site", "a"))
                .writeTo(tempDir.resolve("workspaces.xlsx"));

        // When
        List<Workspace> workspaces = loader.load(file, WorkspaceColumns.defaults());

        // Then
        assertThat(workspaces).containsExactly(
                new Workspace("b", "Beta Site"),
                new Workspace("a", "Alpha Site"));
    }

    @Test
    @DisplayName("load skips rows missing a slug or a name")
    void load_whenIncompleteRows_thenSkipped() {
        Path file = Workbooks.create()
                .sheet("Workspaces",
                        row("Slug", "Name"),
                        row("a", "Alpha"),
                        row("b"),
                        row(null, "Nameless"),
                        null,
                        row("c", "Gamma"))
                .writeTo(tempDir.resolve("workspaces.xlsx"));

        List<Workspace> workspaces = loader.load(file, WorkspaceColumns.defaults());

        assertThat(workspaces).extracting(Workspace::slug).containsExactly("a", "c");
    }

    @Test
    @DisplayName("load lets a repeated slug replace the earlier declaration in place")
    void load_whenDuplicateSlug_thenLaterRowWins() {
        Path file = Workbooks.create()
                .sheet("Workspaces",
                        row("Slug", "Name"),
                        row("a", "First"),
                        row("b", "Beta"),
                        row("A", "Second"))
                .writeTo(tempDir.resolve("workspaces.xlsx"));

        List<Workspace> workspaces = loader.load(file, WorkspaceColumns.defaults());

        assertThat(workspaces).containsExactly(
                new Workspace("a", "Second"),
                new Workspace("b", "Beta"));
    }

    @Test
    @DisplayName("load honors configured column headers")
    void load_whenCustomColumns_thenResolved() {
        Path file = Workbooks.create()
                .sheet("Workspaces",
                        row("Code", "Title"),
                        row("x", "Extra"))
                .writeTo(tempDir.resolve("workspaces.xlsx"));

        List<Workspace> workspaces = loader.load(file, new WorkspaceColumns("Code", "Title"));

        assertThat(workspaces).containsExactly(new Workspace("x", "Extra"));
    }

    @Test
    @DisplayName("load requires the Workspaces sheet")
    void load_whenSheetMissing_thenThrows() {
        Path file = Workbooks.create()
                .sheet("Sheet1", row("Slug", "Name"))
                .writeTo(tempDir.resolve("workspaces.xlsx"));

        assertThatThrownBy(() -> loader.load(file, WorkspaceColumns.defaults()))
                .isInstanceOf(SheetNotFoundException.class)
                .hasMessageContaining("workspace workbook")
                .extracting("detail")
                .isEqualTo("Workbook must contain 'Workspaces' sheet");
    }

    @Test
    @DisplayName("load requires both header columns")
    void load_whenHeaderMissing_thenThrows() {
        Path file = Workbooks.create()
                .sheet("Workspaces", row("Slug"), row("a"))
                .writeTo(tempDir.resolve("workspaces.xlsx"));

        assertThatThrownBy(() -> loader.load(file, WorkspaceColumns.defaults()))
                .isInstanceOf(HeaderResolutionException.class)
                .extracting("detail")
                .isEqualTo("Missing 'name' column");
    }
}
