package uk.gegc.accesssync.features.sync.infra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import uk.gegc.accesssync.features.sync.domain.model.ResourceKind;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConsoleApprovalGate")
class ConsoleApprovalGateTest {

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    private ConsoleApprovalGate gate(String input) {
        return new ConsoleApprovalGate(new BufferedReader(new StringReader(input)),
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @ParameterizedTest
    @ValueSource(strings = {"\n", "y\n", "Yes\n", "ye\n", " YES \n"})
    @DisplayName("approve accepts an empty answer and forms of yes")
    void approve_whenAffirmative_thenTrue(String input) {
        assertThat(gate(input).approve(ResourceKind.ROLES, 1, 0)).isTrue();
        assertThat(output()).startsWith("Are you sure you wish to synchronize roles? [Y/n] ");
    }

    @ParameterizedTest
    @ValueSource(strings = {"n\n", "No\n"})
    @DisplayName("approve declines on no")
    void approve_whenNegative_thenFalse(String input) {
        assertThat(gate(input).approve(ResourceKind.USERS, 0, 1)).isFalse();
    }

    @Test
    @DisplayName("approve asks again after an unrecognised answer")
    void approve_whenUnrecognised_thenAsksAgain() {
        boolean approved = gate("maybe\ny\n").approve(ResourceKind.WORKSPACES, 1, 1);

        assertThat(approved).isTrue();
        assertThat(output())
                .contains("Please respond with 'yes' or 'no' (or 'y' or 'n').")
                .containsOnlyOnce("Please respond");
        assertThat(output().split("synchronize workspaces\\?", -1)).hasSize(3);
    }

    @Test
    @DisplayName("approve declines when input ends")
    void approve_whenEndOfInput_thenFalse() {
        assertThat(gate("").approve(ResourceKind.WORKSPACES, 1, 0)).isFalse();
    }
}
