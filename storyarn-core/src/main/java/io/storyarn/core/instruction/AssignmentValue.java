package io.storyarn.core.instruction;

import io.storyarn.core.variable.VariableKey;
import java.util.Objects;

/// Right-hand side of an {@link Assignment}.
///
/// ### Permitted Subtypes
/// - {@link Literal} - authored text, parsed against the target variable's type
/// - {@link Reference} - another variable, read when the assignment executes
public sealed interface AssignmentValue {

    static Literal literal(String raw) {
        return new Literal(raw);
    }

    static Reference reference(String sheet, String variable) {
        return new Reference(sheet, variable);
    }

    /// @param raw literal as authored, may be null
    record Literal(String raw) implements AssignmentValue {}

    /// @param sheet sheet shortcut of the source variable, not null
    /// @param variable name of the source variable, not null
    record Reference(String sheet, String variable) implements AssignmentValue {
        public Reference {
            Objects.requireNonNull(sheet, "sheet must not be null");
            Objects.requireNonNull(variable, "variable must not be null");
        }

        public VariableKey key() {
            return VariableKey.of(sheet, variable);
        }
    }
}
