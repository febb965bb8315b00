package io.storyarn.cli.execution;

import static org.assertj.core.api.Assertions.assertThat;

import io.storyarn.core.error.EvaluationError;
import io.storyarn.core.flow.node.SceneNode;
import io.storyarn.core.state.ExecutionState;
import io.storyarn.core.state.ExecutionStatus;
import io.storyarn.core.variable.VariableStore;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VerboseExecutionListenerTest {

    private ByteArrayOutputStream outputStream;
    private PrintStream printStream;

    @BeforeEach
    void setUp() {
        outputStream = new ByteArrayOutputStream();
        printStream = new PrintStream(outputStream, true, StandardCharsets.UTF_8);
    }

    @Test
    void shouldPrintNodeTypeIdAndPosition() {
        VerboseExecutionListener listener = new VerboseExecutionListener(printStream, false);
        ExecutionState state = state(ExecutionStatus.RUNNING).stepCount(3).build();

        listener.onNodeStart(SceneNode.builder().id("square").location("Square").build(), state);

        String output = output();
        assertThat(output).contains("[scene]");
        assertThat(output).contains("square");
        assertThat(output).contains("(main, depth 0, step 4)");
    }

    @Test
    void shouldPrintPause() {
        VerboseExecutionListener listener = new VerboseExecutionListener(printStream, false);

        listener.onPause(state(ExecutionStatus.PAUSED).stepCount(1000).build());

        assertThat(output()).contains("paused after 1000 steps");
    }

    @Test
    void shouldPrintFinishWithErrorInRed() {
        VerboseExecutionListener listener = new VerboseExecutionListener(printStream, true);
        ExecutionState state =
                state(ExecutionStatus.FINISHED_WITH_ERROR)
                        .stepCount(2)
                        .error(EvaluationError.missingTarget("j1", "Hub 'gate' not found"))
                        .build();

        listener.onFinish(state);

        assertThat(output()).contains("finished with error after 2 steps");
        assertThat(output()).contains("\033[38;5;167m");
    }

    @Test
    void shouldNotUseAnsiCodesWhenColorDisabled() {
        VerboseExecutionListener listener = new VerboseExecutionListener(printStream, false);

        listener.onFinish(state(ExecutionStatus.FINISHED).stepCount(5).build());

        assertThat(output()).contains("finished after 5 steps").doesNotContain("\033[");
    }

    private static ExecutionState.Builder state(ExecutionStatus status) {
        return ExecutionState.builder()
                .flowId("main")
                .currentNodeId("square")
                .variables(VariableStore.empty())
                .maxSteps(1000)
                .status(status);
    }

    private String output() {
        return outputStream.toString(StandardCharsets.UTF_8);
    }
}
