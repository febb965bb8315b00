package io.storyarn.core.instruction;

import io.storyarn.core.variable.VariableKey;
import java.util.Objects;

/// One mutation of one variable: `sheet.variable operator value`.
///
/// @param id authoring id, may be null
/// @param sheet target sheet shortcut, not null
/// @param variable target variable name, not null
/// @param operator mutation, not null
/// @param value right-hand side, not null (an empty literal for operators without value)
public record Assignment(
        String id,
        String sheet,
        String variable,
        AssignmentOperator operator,
        AssignmentValue value) {

    public Assignment {
        Objects.requireNonNull(sheet, "sheet must not be null");
        Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        value = value != null ? value : AssignmentValue.literal(null);
    }

    /// Creates an assignment from a dotted reference and a literal.
    ///
    /// @param reference target as `sheet.variable`, not null
    /// @param operator mutation, not null
    /// @param literal value as authored, may be null
    /// @return new assignment, never null
    public static Assignment of(String reference, AssignmentOperator operator, String literal) {
        VariableKey key = VariableKey.parse(reference);
        return new Assignment(
                null, key.sheet(), key.name(), operator, AssignmentValue.literal(literal));
    }

    /// Creates an assignment whose value is read from another variable.
    ///
    /// @param reference target as `sheet.variable`, not null
    /// @param operator mutation, not null
    /// @param source source variable as `sheet.variable`, not null
    /// @return new assignment, never null
    public static Assignment ofReference(
            String reference, AssignmentOperator operator, String source) {
        VariableKey key = VariableKey.parse(reference);
        VariableKey from = VariableKey.parse(source);
        return new Assignment(
                null,
                key.sheet(),
                key.name(),
                operator,
                AssignmentValue.reference(from.sheet(), from.name()));
    }

    public VariableKey key() {
        return VariableKey.of(sheet, variable);
    }
}
