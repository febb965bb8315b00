package io.storyarn.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PlayCommandTest extends BaseCommandTest {

    @Nested
    class AutoPlay {

        @Test
        void shouldPlayToTheEndTakingFirstChoice() throws Exception {
            // Given
            Path file = project("tavern.json");

            // When
            int exitCode = run("play", file.toString(), "--auto", "--no-color");

            // Then
            assertThat(exitCode).isZero();
            assertThat(out()).contains("keeper: What'll it be?");
            assertThat(out()).contains("1. An ale, please.");
            assertThat(out()).contains("→ An ale, please.");
            assertThat(out()).contains("Status: FINISHED");
        }

        @Test
        void shouldStopAtStepLimit() throws Exception {
            // Given
            Path file = project("loop.json");

            // When
            int exitCode =
                    run("play", file.toString(), "--auto", "--max-steps", "5", "--no-color");

            // Then
            assertThat(exitCode).isZero();
            assertThat(out()).contains("Paused after 5 steps");
            assertThat(out()).contains("Status: PAUSED");
        }

        @Test
        void shouldReadStepLimitFromConfigFile() throws Exception {
            // Given
            Path file = project("loop.json");
            Path config = tempDir.resolve("storyarn.properties");
            Files.writeString(config, "storyarn.max-steps=7\n");

            // When
            int exitCode =
                    run(
                            "play",
                            file.toString(),
                            "--auto",
                            "--config",
                            config.toString(),
                            "--no-color");

            // Then
            assertThat(exitCode).isZero();
            assertThat(out()).contains("Paused after 7 steps");
        }

        @Test
        void shouldExportFinalState() throws Exception {
            // Given
            Path file = project("tavern.json");
            Path export = tempDir.resolve("state.json");

            // When
            int exitCode =
                    run(
                            "play",
                            file.toString(),
                            "--auto",
                            "--export",
                            export.toString(),
                            "--no-color");

            // Then
            assertThat(exitCode).isZero();
            assertThat(Files.readString(export))
                    .contains("\"status\" : \"finished\"")
                    .contains("\"mc.jaime.gold\" : 8");
        }

        @Test
        void shouldTraceNodesWhenVerbose() throws Exception {
            // Given
            Path file = project("tavern.json");

            // When
            run("play", file.toString(), "--auto", "--verbose", "--no-color");

            // Then
            assertThat(out()).contains("[entry] entry").contains("[scene] dark");
        }
    }

    @Nested
    class Interactive {

        @Test
        void shouldSelectChoiceAndShowVariables() throws Exception {
            // Given
            Path file = project("tavern.json");
            input("r", "1", "r", "v", "q");

            // When
            int exitCode = run("play", file.toString(), "--no-color");

            // Then
            assertThat(exitCode).isZero();
            assertThat(out()).contains("Finished.");
            assertThat(out()).contains("mc.jaime.gold = 8");
            assertThat(out()).contains("quests.drinks = 1");
        }

        @Test
        void shouldStepBackAfterChoice() throws Exception {
            // Given
            Path file = project("tavern.json");
            input("r", "1", "b", "v", "q");

            // When
            run("play", file.toString(), "--no-color");

            // Then
            assertThat(out()).contains("mc.jaime.gold = 10");
        }

        @Test
        void shouldOverrideVariableBeforeChoosing() throws Exception {
            // Given
            Path file = project("tavern.json");
            Path config = tempDir.resolve("manual.properties");
            Files.writeString(config, "storyarn.auto-select-single-choice=false\n");
            input("set mc.jaime.gold 1", "r", "q");

            // When
            run("play", file.toString(), "--config", config.toString(), "--no-color");

            // Then
            assertThat(out()).contains("mc.jaime.gold = 1");
            assertThat(out()).contains("✗ 1. An ale, please. (unavailable)");
        }

        @Test
        void shouldStopAtBreakpoint() throws Exception {
            // Given
            Path file = project("loop.json");
            input("bp jump", "r", "q");

            // When
            run("play", file.toString(), "--no-color");

            // Then
            assertThat(out()).contains("Breakpoint set at jump");
            assertThat(out()).contains("loop/jump (jump)");
            assertThat(out()).contains("Status: RUNNING");
        }

        @Test
        void shouldReportInvalidCommandsWithoutExiting() throws Exception {
            // Given
            Path file = project("tavern.json");
            input("b", "dance", "7", "q");

            // When
            int exitCode = run("play", file.toString(), "--no-color");

            // Then
            assertThat(exitCode).isZero();
            assertThat(out()).contains("Already at the start");
            assertThat(out()).contains("Unknown command 'dance'");
            assertThat(out()).contains("No choice 7");
        }

        @Test
        void shouldEndOnEndOfInput() throws Exception {
            // Given
            Path file = project("tavern.json");
            input("s");

            // When
            int exitCode = run("play", file.toString(), "--no-color");

            // Then
            assertThat(exitCode).isZero();
            assertThat(out()).contains("tavern/greet (dialogue)");
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldFailOnUnknownFlow() throws Exception {
            // Given
            Path file = project("tavern.json");

            // When
            int exitCode = run("play", file.toString(), "--flow", "attic", "--auto");

            // Then
            assertThat(exitCode).isEqualTo(1);
            assertThat(err()).contains("[FAIL] Play failed: Flow not found: attic");
        }

        @Test
        void shouldFailOnFlowWithoutEntry() throws Exception {
            // Given
            Path file = project("broken.json");

            // When
            int exitCode = run("play", file.toString(), "--auto");

            // Then
            assertThat(exitCode).isEqualTo(1);
            assertThat(err()).contains("has no entry node");
        }

        @Test
        void shouldRejectInvalidStepLimit() throws Exception {
            // Given
            Path file = project("tavern.json");

            // When
            int exitCode = run("play", file.toString(), "--auto", "--max-steps", "0");

            // Then
            assertThat(exitCode).isEqualTo(1);
            assertThat(err()).contains("[FAIL]");
        }
    }
}
