package io.storyarn.cli.ui;

import static org.assertj.core.api.Assertions.assertThat;

import io.storyarn.core.execution.log.LogKind;
import io.storyarn.core.state.ChoiceOption;
import io.storyarn.core.state.ExecutionStatus;
import io.storyarn.core.validation.Severity;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AnsiStylesTest {

    private static final String GREEN = "\033[0;32m";
    private static final String RED = "\033[38;5;167m";
    private static final String YELLOW = "\033[38;5;214m";
    private static final String RESET = "\033[0m";

    private final AnsiStyles colored = AnsiStyles.of(true);
    private final AnsiStyles plain = AnsiStyles.of(false);

    private static ChoiceOption option(String text, boolean valid) {
        return new ChoiceOption(text.toLowerCase(), text, valid, "next", List.of());
    }

    @Nested
    class Status {

        @Test
        void shouldColorStatusByOutcome() {
            assertThat(colored.status(ExecutionStatus.FINISHED))
                    .isEqualTo(GREEN + "FINISHED" + RESET);
            assertThat(colored.status(ExecutionStatus.FINISHED_WITH_ERROR)).startsWith(RED);
            assertThat(colored.status(ExecutionStatus.PAUSED)).startsWith(YELLOW);
        }

        @Test
        void shouldLeaveRunningStatusUnstyled() {
            // When
            String text = colored.forStatus(ExecutionStatus.RUNNING, "stepping");

            // Then
            assertThat(text).isEqualTo("stepping");
        }
    }

    @Nested
    class Log {

        @Test
        void shouldHighlightErrorsAndPauses() {
            assertThat(colored.forLog(LogKind.ERROR, "boom")).isEqualTo(RED + "boom" + RESET);
            assertThat(colored.forLog(LogKind.PAUSE, "limit")).startsWith(YELLOW);
            assertThat(colored.forLog(LogKind.WARNING, "odd")).startsWith(YELLOW);
            assertThat(colored.forLog(LogKind.ADVANCE, "a -> b")).doesNotStartWith(RED);
        }
    }

    @Nested
    class Choices {

        @Test
        void shouldNumberValidAndUnavailableResponses() {
            // Given
            ChoiceOption run = option("Run!", true);
            ChoiceOption bribe = option("Here's some gold.", false);

            // Then
            assertThat(plain.choice(2, run)).isEqualTo("✓ 2. Run!");
            assertThat(plain.choice(1, bribe)).isEqualTo("✗ 1. Here's some gold. (unavailable)");
            assertThat(plain.autoChoice(run)).isEqualTo("→ Run!");
        }

        @Test
        void shouldDimUnavailableResponse() {
            // When
            String line = colored.choice(1, option("Fly", false));

            // Then
            assertThat(line).startsWith(RED + "✗" + RESET).contains("\033[38;5;241m");
        }
    }

    @Nested
    class Validation {

        @Test
        void shouldTagIssuesBySeverity() {
            assertThat(plain.issueTag(Severity.ERROR)).isEqualTo("[ERROR]");
            assertThat(plain.issueTag(Severity.WARNING)).isEqualTo("[WARN]");
            assertThat(colored.issueTag(Severity.ERROR)).startsWith(RED);
            assertThat(colored.validTag()).isEqualTo(GREEN + "[OK]" + RESET);
        }
    }

    @Test
    void shouldRenderPlainTextWhenColorDisabled() {
        // When
        String position = plain.position(3, "gate/guard", "dialogue");
        String trace = plain.trace("scene", "square", "main, depth 0, step 4");

        // Then
        assertThat(plain.isColorEnabled()).isFalse();
        assertThat(position).isEqualTo("[step 3] gate/guard (dialogue)");
        assertThat(trace).isEqualTo("→ [scene] square  (main, depth 0, step 4)");
        assertThat(plain.variable("mc.gold", "3")).isEqualTo("• mc.gold = 3");
        assertThat(plain.speaker("guard")).isEqualTo("guard:");
        assertThat(plain.summaryTop()).startsWith("┌─").hasSize(62);
        assertThat(plain.summaryBottom()).startsWith("└─").hasSize(62);
    }
}
