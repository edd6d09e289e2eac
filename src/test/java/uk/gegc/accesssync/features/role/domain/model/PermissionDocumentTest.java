package uk.gegc.accesssync.features.role.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PermissionDocument")
class PermissionDocumentTest {

    private static WorkspacePermissions entry(String id, boolean readPatients) {
        return new WorkspacePermissions(id, Map.of(WorkspacePermission.READ_PATIENTS, readPatients));
    }

    @Test
    @DisplayName("workspace entries sort numerically when identifiers are numbers")
    void constructor_sortsNumericIdentifiersByValue() {
        PermissionDocument document = new PermissionDocument(Map.of(),
                List.of(entry("10", true), entry("9", false), entry("100", true)));

        assertThat(document.workspaces()).extracting(WorkspacePermissions::workspaceId)
                .containsExactly("9", "10", "100");
    }

    @Test
    @DisplayName("workspace entries sort lexically otherwise")
    void constructor_sortsOtherIdentifiersLexically() {
        PermissionDocument document = new PermissionDocument(Map.of(),
                List.of(entry("b7", true), entry("a9", false), entry("10", true)));

        assertThat(document.workspaces()).extracting(WorkspacePermissions::workspaceId)
                .containsExactly("10", "a9", "b7");
    }

    @Test
    @DisplayName("documents built in different orders are equal")
    void equals_ignoresInsertionOrder() {
        List<WorkspacePermissions> entries = new ArrayList<>(List.of(entry("1", true), entry("2", false)));
        PermissionDocument first = new PermissionDocument(Map.of(OrganizationPermission.MANAGE_ACCESS, true), entries);
        PermissionDocument second = new PermissionDocument(Map.of(OrganizationPermission.MANAGE_ACCESS, true),
                List.of(entry("2", false), entry("1", true)));

        assertThat(first).isEqualTo(second);
        assertThat(first.findWorkspace("2")).contains(entry("2", false));
    }

    @Test
    @DisplayName("a differing flag makes documents unequal")
    void equals_detectsFlagChange() {
        PermissionDocument first = new PermissionDocument(Map.of(), List.of(entry("1", true)));
        PermissionDocument second = new PermissionDocument(Map.of(), List.of(entry("1", false)));

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    @DisplayName("mixed numeric and alphanumeric identifiers sort the same for every input order")
    void constructor_mixedIdentifiersSortIdenticallyForEveryPermutation() {
        List<List<String>> permutations = List.of(
                List.of("2", "10", "1a"), List.of("2", "1a", "10"), List.of("10", "2", "1a"),
                List.of("10", "1a", "2"), List.of("1a", "2", "10"), List.of("1a", "10", "2"));

        Set<List<String>> sortedForms = new HashSet<>();
        for (List<String> ids : permutations) {
            PermissionDocument document = new PermissionDocument(Map.of(),
                    ids.stream().map(id -> entry(id, true)).toList());
            sortedForms.add(document.workspaces().stream().map(WorkspacePermissions::workspaceId).toList());
        }

        assertThat(sortedForms).containsExactly(List.of("2", "10", "1a"));
    }

    @Test
    @DisplayName("a compiled document equals the same entries received in another order")
    void equals_mixedIdentifiersIndependentOfOrder() {
        List<WorkspacePermissions> entries = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            entries.add(entry(String.valueOf(i * 7), i % 2 == 0));
            entries.add(entry("ws" + i, i % 3 == 0));
        }
        List<WorkspacePermissions> shuffled = new ArrayList<>(entries);
        Collections.shuffle(shuffled, new Random(42));

        PermissionDocument compiled = new PermissionDocument(Map.of(), entries);
        PermissionDocument received = new PermissionDocument(Map.of(), shuffled);

        assertThat(received).isEqualTo(compiled);
        assertThat(compiled.workspaces().get(0).workspaceId()).isEqualTo("0");
        assertThat(compiled.workspaces().get(40).workspaceId()).isEqualTo("ws0");
    }
}
