package io.storyarn.cli.execution;

import io.storyarn.cli.ui.AnsiStyles;
import io.storyarn.core.execution.ExecutionListener;
import io.storyarn.core.flow.node.Node;
import io.storyarn.core.state.ExecutionState;
import io.storyarn.core.state.ExecutionStatus;
import java.io.PrintStream;

/// Execution listener that traces every evaluated node to the terminal.
///
/// ### Output Format
/// ```
///   → [dialogue] greet  (tavern, depth 0, step 1)
///   ⏸ paused after 1000 steps
///   ■ finished after 12 steps
/// ```
///
/// @implNote **Not thread-safe**. Output may interleave if several sessions share a stream.
/// @see io.storyarn.core.execution.ExecutionListener
public class VerboseExecutionListener implements ExecutionListener {

    private final PrintStream out;
    private final AnsiStyles styles;

    /// Creates a verbose listener.
    ///
    /// @param out output stream for printing (typically System.out), not null
    /// @param useColor whether to apply ANSI color codes
    public VerboseExecutionListener(PrintStream out, boolean useColor) {
        this.out = out;
        this.styles = AnsiStyles.of(useColor);
    }

    @Override
    public void onNodeStart(Node node, ExecutionState state) {
        String detail =
                state.getFlowId()
                        + ", depth "
                        + state.getCallStackDepth()
                        + ", step "
                        + (state.getStepCount() + 1);
        out.println(
                "  " + styles.trace(node.getNodeType().wireName(), node.getId(), detail));
    }

    @Override
    public void onPause(ExecutionState state) {
        out.println(
                "  "
                        + styles.forStatus(
                                ExecutionStatus.PAUSED,
                                "⏸ paused after " + state.getStepCount() + " steps"));
    }

    @Override
    public void onFinish(ExecutionState state) {
        String message =
                "■ "
                        + state.getStatus().name().toLowerCase().replace('_', ' ')
                        + " after "
                        + state.getStepCount()
                        + " steps";
        out.println("  " + styles.forStatus(state.getStatus(), message));
    }
}
