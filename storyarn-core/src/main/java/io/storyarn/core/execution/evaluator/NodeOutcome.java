package io.storyarn.core.execution.evaluator;

import io.storyarn.core.execution.log.LogKind;
import io.storyarn.core.execution.transition.Transition;
import io.storyarn.core.instruction.VariableChange;
import io.storyarn.core.variable.VariableStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Result of evaluating one node: the transition plus everything the node changed.
///
/// @param transition what happens next, not null
/// @param variables variables after the node's assignments, not null
/// @param changes writes performed, in order, not null
/// @param notes log lines the node wants recorded, in order, not null
public record NodeOutcome(
        Transition transition,
        VariableStore variables,
        List<VariableChange> changes,
        List<Note> notes) {

    public NodeOutcome {
        Objects.requireNonNull(transition, "transition must not be null");
        Objects.requireNonNull(variables, "variables must not be null");
        changes = List.copyOf(changes);
        notes = List.copyOf(notes);
    }

    /// A log line produced during evaluation.
    ///
    /// @param kind category, not null
    /// @param message detail, not null
    public record Note(LogKind kind, String message) {}

    /// Outcome that leaves the variables untouched.
    public static NodeOutcome of(Transition transition, VariableStore variables) {
        return new NodeOutcome(transition, variables, List.of(), List.of());
    }

    public static Builder builder(VariableStore variables) {
        return new Builder(variables);
    }

    /// Accumulates changes and notes while an evaluator works through a node.
    public static final class Builder {
        private VariableStore variables;
        private final List<VariableChange> changes = new ArrayList<>();
        private final List<Note> notes = new ArrayList<>();

        private Builder(VariableStore variables) {
            this.variables = Objects.requireNonNull(variables, "variables must not be null");
        }

        public VariableStore variables() {
            return variables;
        }

        public Builder variables(VariableStore variables, List<VariableChange> changes) {
            this.variables = variables;
            this.changes.addAll(changes);
            return this;
        }

        public Builder note(LogKind kind, String message) {
            notes.add(new Note(kind, message));
            return this;
        }

        public NodeOutcome build(Transition transition) {
            return new NodeOutcome(transition, variables, changes, notes);
        }
    }
}
