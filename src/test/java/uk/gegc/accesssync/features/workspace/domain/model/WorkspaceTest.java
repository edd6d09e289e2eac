package uk.gegc.accesssync.features.workspace.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Workspace")
class WorkspaceTest {

    @Test
    @DisplayName("slug is normalized to lowercase and the display name carries it uppercased")
    void displayName_prefixesUppercaseSlug() {
        Workspace workspace = new Workspace(" Main ", " Main Campus ");

        assertThat(workspace.slug()).isEqualTo("main");
        assertThat(workspace.name()).isEqualTo("Main Campus");
        assertThat(workspace.displayName()).isEqualTo("[MAIN] Main Campus");
    }

    @Test
    @DisplayName("a blank slug is rejected")
    void constructor_whenBlankSlug_thenThrows() {
        assertThatThrownBy(() -> new Workspace("  ", "Name"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
