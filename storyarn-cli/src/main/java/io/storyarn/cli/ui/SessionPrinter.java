package io.storyarn.cli.ui;

import io.storyarn.core.error.EvaluationError;
import io.storyarn.core.execution.FlowEngine;
import io.storyarn.core.execution.log.LogEntry;
import io.storyarn.core.flow.node.DialogueNode;
import io.storyarn.core.flow.node.Node;
import io.storyarn.core.state.ChoiceOption;
import io.storyarn.core.state.ExecutionState;
import io.storyarn.core.state.ExecutionStatus;
import io.storyarn.core.variable.Value;
import io.storyarn.core.variable.VariableKey;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Renders debugger sessions for the terminal: the current node, pending choices, status,
/// variables and the execution log.
///
/// Choices are numbered from 1 in the order they are pending, which is the order the
/// play command accepts them in.
public final class SessionPrinter {

    private final PrintStream out;
    private final AnsiStyles styles;
    private final FlowEngine engine;

    public SessionPrinter(PrintStream out, AnsiStyles styles, FlowEngine engine) {
        this.out = out;
        this.styles = styles;
        this.engine = engine;
    }

    /// Prints where the session is and what it is waiting for.
    ///
    /// @param state state to show, not null
    public void printState(ExecutionState state) {
        Optional<Node> node = engine.currentNode(state);
        String position = state.getFlowId() + "/" + state.getCurrentNodeId();
        String type = node.map(n -> n.getNodeType().wireName()).orElse("?");
        out.println(styles.position(state.getStepCount(), position, type));

        if (node.isPresent() && node.get() instanceof DialogueNode dialogue) {
            String speaker = dialogue.getSpeaker() != null ? dialogue.getSpeaker() : "Narrator";
            out.println("  " + styles.speaker(speaker) + " " + dialogue.getText());
        }

        switch (state.getStatus()) {
            case AWAITING_CHOICE -> printChoices(state.getPendingChoices());
            case PAUSED ->
                    out.println(
                            "  "
                                    + styles.forStatus(
                                            ExecutionStatus.PAUSED,
                                            "Paused after "
                                                    + state.getStepCount()
                                                    + " steps. Type 'c' to continue."));
            case FINISHED ->
                    out.println("  " + styles.forStatus(ExecutionStatus.FINISHED, "Finished."));
            case FINISHED_WITH_ERROR ->
                    out.println(
                            "  "
                                    + styles.forStatus(
                                            ExecutionStatus.FINISHED_WITH_ERROR,
                                            "Stopped: " + describe(state.getError())));
            case RUNNING -> {}
        }
    }

    public void printChoices(List<ChoiceOption> choices) {
        for (int i = 0; i < choices.size(); i++) {
            out.println("  " + styles.choice(i + 1, choices.get(i)));
        }
    }

    public void printVariables(ExecutionState state) {
        Map<VariableKey, Value> values = state.getVariablesSnapshot();
        if (values.isEmpty()) {
            out.println("  " + styles.note("(no variables)"));
            return;
        }
        values.forEach(
                (key, value) ->
                        out.println("  " + styles.variable(key.ref(), value.display())));
    }

    /// Prints the last `limit` execution log entries.
    ///
    /// @param state state whose log to show, not null
    /// @param limit maximum number of entries, positive
    public void printLog(ExecutionState state, int limit) {
        List<LogEntry> log = state.getLog();
        for (LogEntry entry : log.subList(Math.max(0, log.size() - limit), log.size())) {
            out.println("  " + styles.forLog(entry.kind(), entry.toString()));
        }
    }

    /// Prints the end-of-session summary box.
    ///
    /// @param state final state, not null
    public void printSummary(ExecutionState state) {
        out.println(styles.summaryTop());
        out.println("  Status: " + styles.status(state.getStatus()));
        out.println("  Steps: " + state.getStepCount());
        out.println("  Nodes visited: " + state.getPath().size());
        out.println("  Variable changes: " + state.getHistory().size());
        state.getError()
                .ifPresent(e -> out.println("  Error: " + styles.failure(e.toString())));
        out.println(styles.summaryBottom());
    }

    private static String describe(Optional<EvaluationError> error) {
        return error.map(EvaluationError::toString).orElse("unknown error");
    }
}
