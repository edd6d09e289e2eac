package uk.gegc.accesssync.features.user.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.accesssync.features.sheet.application.HeaderResolver;
import uk.gegc.accesssync.features.sheet.application.TabularSourceReader;
import uk.gegc.accesssync.features.sheet.domain.model.SheetData;
import uk.gegc.accesssync.features.sheet.domain.model.SheetRow;
import uk.gegc.accesssync.features.sheet.domain.model.TabularSource;
import uk.gegc.accesssync.features.user.domain.model.DesiredUser;
import uk.gegc.accesssync.features.user.domain.model.UserColumns;
import uk.gegc.accesssync.features.user.domain.model.WorkspaceAssignment;
import uk.gegc.accesssync.shared.exception.SheetNotFoundException;
import uk.gegc.accesssync.shared.exception.SyncException;
import uk.gegc.accesssync.shared.exception.UserRowException;
import uk.gegc.accesssync.shared.exception.UserRowException.Reason;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

/**
 * Reads users from every workbook of the users directory and merges them by email.
 * <p>
 * Workbooks are processed in lexical path order. Files whose name starts with {@code .}, {@code ~}
 * or {@code $} are hidden, lock or temporary files and are skipped. A user may appear in several workbooks, once per
 * workspace, but always with the same role template.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UserLoader {

    public static final String USERS_SHEET = "Users";

    private static final String WORKBOOK_SUFFIX = ".xlsx";
    private static final String SKIPPED_NAME_PREFIXES = ".~$";

    private final TabularSourceReader tabularSourceReader;
    private final HeaderResolver headerResolver;

    enum UserField {
        WORKSPACE("workspace"),
        NAME("name"),
        EMAIL("email"),
        ROLE("role"),
        ACTIVE("active");

        private final String key;

        UserField(String key) {
            this.key = key;
        }

        String title() {
            return Character.toUpperCase(key.charAt(0)) + key.substring(1);
        }

        @Override
        public String toString() {
            return key;
        }
    }

    public List<DesiredUser> load(Path usersDirectory, Set<String> workspaceSlugs, UserColumns columns) {
        Map<String, PendingUser> users = new LinkedHashMap<>();
        for (Path file : listWorkbooks(usersDirectory)) {
            readWorkbook(file, workspaceSlugs, columns, users);
        }
        return users.values().stream()
                .map(PendingUser::toDesiredUser)
                .toList();
    }

    List<Path> listWorkbooks(Path usersDirectory) {
        if (!Files.isDirectory(usersDirectory)) {
            throw new SyncException("Failed to read users", "Directory '" + usersDirectory + "' does not exist");
        }
        try (Stream<Path> files = Files.list(usersDirectory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(file -> {
                        String name = file.getFileName().toString();
                        return name.endsWith(WORKBOOK_SUFFIX)
                                && SKIPPED_NAME_PREFIXES.indexOf(name.charAt(0)) < 0;
                    })
                    .sorted()
                    .toList();
        } catch (IOException ex) {
            throw new SyncException("Failed to read users", "Cannot list directory '" + usersDirectory + "'", ex);
        }
    }

    private void readWorkbook(Path file, Set<String> workspaceSlugs, UserColumns columns, Map<String, PendingUser> users) {
        TabularSource source = tabularSourceReader.read(file);
        String sourceFile = source.location();
        SheetData sheet = source.findSheet(USERS_SHEET)
                .orElseThrow(() -> new SheetNotFoundException(
                        "Failed to parse users from '" + sourceFile + "'", USERS_SHEET));

        Map<UserField, String> expected = new LinkedHashMap<>();
        expected.put(UserField.WORKSPACE, columns.workspace());
        expected.put(UserField.NAME, columns.name());
        expected.put(UserField.EMAIL, columns.email());
        expected.put(UserField.ROLE, columns.role());
        expected.put(UserField.ACTIVE, columns.active());
        Map<UserField, Integer> headers = headerResolver.resolve(sourceFile, sheet.header(), expected);

        int rowsRead = 0;
        for (SheetRow row : sheet.rows()) {
            UserField missing = null;
            boolean empty = true;
            for (Map.Entry<UserField, Integer> header : headers.entrySet()) {
                if (row.isPresent(header.getValue())) {
                    empty = false;
                } else if (missing == null) {
                    missing = header.getKey();
                }
            }
            if (empty) {
                continue;
            }
            if (missing != null) {
                throw new UserRowException(Reason.INCOMPLETE_ROW, sourceFile, row.rowNumber(),
                        "User is missing '" + missing.title() + "' value in row " + row.rowNumber());
            }

            String workspace = row.text(headers.get(UserField.WORKSPACE)).toLowerCase(Locale.ROOT);
            String email = row.text(headers.get(UserField.EMAIL)).toLowerCase(Locale.ROOT);
            String name = row.text(headers.get(UserField.NAME));
            String role = row.text(headers.get(UserField.ROLE));
            boolean active = row.flag(headers.get(UserField.ACTIVE));

            if (!workspaceSlugs.contains(workspace)) {
                throw new UserRowException(Reason.UNKNOWN_WORKSPACE, sourceFile, row.rowNumber(),
                        "User at row " + row.rowNumber() + " references an unknown workspace '" + workspace + "'");
            }

            PendingUser user = users.computeIfAbsent(email, key -> new PendingUser(key, name, active));
            if (!user.name.equals(name) || user.active != active) {
                log.warn("User {} at row {} of {} declares name '{}' and active={}, keeping '{}' and active={}",
                        email, row.rowNumber(), sourceFile, name, active, user.name, user.active);
            }
            user.assign(new WorkspaceAssignment(workspace, role, sourceFile, row.rowNumber()));
            rowsRead++;
        }
        log.debug("Read {} user rows from {}", rowsRead, sourceFile);
    }

    private static final class PendingUser {

        private final String email;
        private final String name;
        private final boolean active;
        private final Map<String, WorkspaceAssignment> assignments = new LinkedHashMap<>();

        private PendingUser(String email, String name, boolean active) {
            this.email = email;
            this.name = name;
            this.active = active;
        }

        private void assign(WorkspaceAssignment assignment) {
            for (WorkspaceAssignment existing : assignments.values()) {
                if (!existing.roleTemplateName().equals(assignment.roleTemplateName())) {
                    throw new UserRowException(Reason.CONFLICTING_ROLE, assignment.sourceFile(), assignment.rowNumber(),
                            "User at row " + assignment.rowNumber() + " has conflicting role assignments of role '"
                                    + assignment.roleTemplateName() + "' and '" + existing.roleTemplateName() + "'"
                                    + System.lineSeparator() + "First assigned in '" + existing.sourceFile() + "'");
                }
            }
            WorkspaceAssignment first = assignments.get(assignment.workspaceSlug());
            if (first != null) {
                throw new UserRowException(Reason.DUPLICATE_ASSIGNMENT, assignment.sourceFile(), assignment.rowNumber(),
                        "User at row " + assignment.rowNumber() + " has multiple role assignments for workspace '"
                                + assignment.workspaceSlug() + "'"
                                + System.lineSeparator() + "First assigned in '" + first.sourceFile() + "'");
            }
            assignments.put(assignment.workspaceSlug(), assignment);
        }

        private DesiredUser toDesiredUser() {
            return new DesiredUser(email, name, active, assignments);
        }
    }
}
