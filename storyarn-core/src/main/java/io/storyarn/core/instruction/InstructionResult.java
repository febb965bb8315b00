package io.storyarn.core.instruction;

import io.storyarn.core.error.EvaluationError;
import io.storyarn.core.variable.VariableStore;
import java.util.List;

/// Outcome of executing an assignment list.
///
/// @param store variables after every successful assignment, not null
/// @param changes writes in execution order, not null
/// @param errors skipped assignments, not null
public record InstructionResult(
        VariableStore store, List<VariableChange> changes, List<EvaluationError> errors) {

    public InstructionResult {
        changes = List.copyOf(changes);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
