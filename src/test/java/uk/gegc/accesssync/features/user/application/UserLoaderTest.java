package uk.gegc.accesssync.features.user.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.gegc.accesssync.BaseUnitTest;
import uk.gegc.accesssync.features.sheet.application.HeaderResolver;
import uk.gegc.accesssync.features.sheet.infra.XlsxTabularSourceReader;
import uk.gegc.accesssync.features.user.domain.model.DesiredUser;
import uk.gegc.accesssync.features.user.domain.model.UserColumns;
import uk.gegc.accesssync.shared.exception.SheetNotFoundException;
import uk.gegc.accesssync.shared.exception.SyncException;
import uk.gegc.accesssync.shared.exception.UserRowException;
import uk.gegc.accesssync.shared.exception.UserRowException.Reason;
import uk.gegc.accesssync.testsupport.Workbooks;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.gegc.accesssync.testsupport.Workbooks.row;

@DisplayName("UserLoader")
class UserLoaderTest extends BaseUnitTest {

    private static final Object[] HEADER = row("Workspace", "Name", "Email", "Role", "Active");
    private static final Set<String> WORKSPACES = Set.of("a", "b", "c");

    @TempDir
    Path usersDir;

    private final UserLoader loader = new UserLoader(new XlsxTabularSourceReader(), new HeaderResolver());

    private Path workbook(String fileName, Object[]... rows) {
        Object[][] all = new Object[rows.length + 1][];
        all[0] = HEADER;
        System.arraycopy(rows, 0, all, 1, rows.length);
        return Workbooks.create().sheet("Users", all).writeTo(usersDir.resolve(fileName));
    }

    @Test
    @DisplayName("load merges users by email across workbooks in file order")
    void load_whenUserInSeveralWorkbooks_thenMerged() {
        // Given
        workbook("2-b.xlsx",
                row("B", "Ann", "ANN@example.com", "Standard", "yes"));
        workbook("1-a.xlsx",
                row("a", "Ann", "ann@example.com", "Standard", "yes"),
                row("a", "Bob", "bob@example.com", "Viewer", "no"));

        // When
        List<DesiredUser> users = loader.load(usersDir, WORKSPACES, UserColumns.defaults());

        // Then
        assertThat(users).extracting(DesiredUser::email).containsExactly("ann@example.com", "bob@example.com");
        DesiredUser ann = users.get(0);
        assertThat(ann.workspaceSlugs()).containsExactly("a", "b");
        assertThat(ann.roleTemplateName()).isEqualTo("Standard");
        assertThat(ann.active()).isTrue();
        assertThat(users.get(1).active()).isFalse();
        assertThat(ann.assignments().get("b").sourceFile()).endsWith("2-b.xlsx");
        assertThat(ann.assignments().get("b").rowNumber()).isEqualTo(2);
    }

    @Test
    @DisplayName("load keeps name and active flag from the first declaration")
    void load_whenLaterDeclarationDiffers_thenFirstWins() {
        workbook("users.xlsx",
                row("a", "Ann", "ann@example.com", "Standard", "yes"),
                row("b", "Annie", "ann@example.com", "Standard", "no"));

        DesiredUser ann = loader.load(usersDir, WORKSPACES, UserColumns.defaults()).get(0);

        assertThat(ann.name()).isEqualTo("Ann");
        assertThat(ann.active()).isTrue();
    }

    @Test
    @DisplayName("load skips empty rows and ignores lock and non-workbook files")
    void load_whenNoise_thenIgnored() throws IOException {
        workbook("users.xlsx",
                row("a", "Ann", "ann@example.com", "Standard", "yes"),
                row(null, null, null, null, null),
                row("b", "Bob", "bob@example.com", "Standard", "yes"));
        Files.writeString(usersDir.resolve("~$users.xlsx"), "lock");
        Files.writeString(usersDir.resolve("notes.txt"), "ignore me");

        List<DesiredUser> users = loader.load(usersDir, WORKSPACES, UserColumns.defaults());

        assertThat(users).hasSize(2);
        assertThat(loader.listWorkbooks(usersDir)).extracting(path -> path.getFileName().toString())
                .containsExactly("users.xlsx");
    }

    @Test
    @DisplayName("load skips hidden, temporary and dollar-prefixed workbooks")
    void load_whenHiddenOrTemporaryWorkbooks_thenSkipped() throws IOException {
        workbook("team.xlsx",
                row("a", "Ann", "ann@example.com", "Standard", "yes"));
        Files.writeString(usersDir.resolve("._team.xlsx"), "resource fork");
        Files.writeString(usersDir.resolve("~tmp.xlsx"), "temporary");
        Files.writeString(usersDir.resolve("$backup.xlsx"), "backup");

        List<DesiredUser> users = loader.load(usersDir, WORKSPACES, UserColumns.defaults());

        assertThat(users).extracting(DesiredUser::email).containsExactly("ann@example.com");
        assertThat(loader.listWorkbooks(usersDir)).extracting(path -> path.getFileName().toString())
                .containsExactly("team.xlsx");
    }

    @Test
    @DisplayName("load rejects a row with a missing value")
    void load_whenValueMissing_thenIncompleteRow() {
        workbook("users.xlsx",
                row("a", "Ann", null, "Standard", "yes"));

        assertThatThrownBy(() -> loader.load(usersDir, WORKSPACES, UserColumns.defaults()))
                .isInstanceOfSatisfying(UserRowException.class, ex -> {
                    assertThat(ex.getReason()).isEqualTo(Reason.INCOMPLETE_ROW);
                    assertThat(ex.getRowNumber()).isEqualTo(2);
                    assertThat(ex.getDetail()).isEqualTo("User is missing 'Email' value in row 2");
                });
    }

    @Test
    @DisplayName("load rejects a workspace that is not declared")
    void load_whenWorkspaceUnknown_thenThrows() {
        workbook("users.xlsx",
                row("zz", "Ann", "ann@example.com", "Standard", "yes"));

        assertThatThrownBy(() -> loader.load(usersDir, WORKSPACES, UserColumns.defaults()))
                .isInstanceOfSatisfying(UserRowException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(Reason.UNKNOWN_WORKSPACE));
    }

    @Test
    @DisplayName("load rejects a second assignment to the same workspace")
    void load_whenSameWorkspaceTwice_thenDuplicateAssignment() {
        workbook("1.xlsx", row("a", "Ann", "ann@example.com", "Standard", "yes"));
        workbook("2.xlsx", row("a", "Ann", "ann@example.com", "Standard", "yes"));

        assertThatThrownBy(() -> loader.load(usersDir, WORKSPACES, UserColumns.defaults()))
                .isInstanceOfSatisfying(UserRowException.class, ex -> {
                    assertThat(ex.getReason()).isEqualTo(Reason.DUPLICATE_ASSIGNMENT);
                    assertThat(ex.getSourceFile()).endsWith("2.xlsx");
                    assertThat(ex.getDetail()).contains("First assigned in '").contains("1.xlsx");
                });
    }

    @Test
    @DisplayName("load rejects different templates for the same user")
    void load_whenTemplatesDiffer_thenConflictingRole() {
        workbook("1.xlsx", row("a", "Ann", "ann@example.com", "Standard", "yes"));
        workbook("2.xlsx", row("a", "Ann", "ann@example.com", "Viewer", "yes"));

        assertThatThrownBy(() -> loader.load(usersDir, WORKSPACES, UserColumns.defaults()))
                .isInstanceOfSatisfying(UserRowException.class, ex -> {
                    assertThat(ex.getReason()).isEqualTo(Reason.CONFLICTING_ROLE);
                    assertThat(ex.getDetail()).contains("'Viewer' and 'Standard'").contains("1.xlsx");
                });
    }

    @Test
    @DisplayName("load requires the Users sheet in every workbook")
    void load_whenSheetMissing_thenThrows() {
        Workbooks.create().sheet("Sheet1", HEADER).writeTo(usersDir.resolve("users.xlsx"));

        assertThatThrownBy(() -> loader.load(usersDir, WORKSPACES, UserColumns.defaults()))
                .isInstanceOf(SheetNotFoundException.class)
                .hasMessageContaining("Failed to parse users from");
    }

    @Test
    @DisplayName("load requires the users directory to exist")
    void load_whenDirectoryMissing_thenThrows() {
        assertThatThrownBy(() -> loader.load(usersDir.resolve("absent"), WORKSPACES, UserColumns.defaults()))
                .isInstanceOf(SyncException.class)
                .hasMessage("Failed to read users");
    }
}
