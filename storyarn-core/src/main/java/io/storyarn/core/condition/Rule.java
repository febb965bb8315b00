package io.storyarn.core.condition;

import io.storyarn.core.variable.VariableKey;
import io.storyarn.core.variable.VariableType;
import java.util.Objects;

/// Leaf comparison: `sheet.variable operator value`.
///
/// A rule without operator means `is_true` on boolean variables and `equals` otherwise.
///
/// @param id authoring id, may be null
/// @param sheet sheet shortcut, not blank
/// @param variable variable name, not blank
/// @param operator comparison, may be null (see {@link #effectiveOperator(VariableType)})
/// @param value expected literal as authored, may be null for unary operators
public record Rule(
        String id, String sheet, String variable, ConditionOperator operator, String value)
        implements Condition {

    public Rule {
        Objects.requireNonNull(sheet, "sheet must not be null");
        Objects.requireNonNull(variable, "variable must not be null");
    }

    public static Rule of(String reference, ConditionOperator operator, String value) {
        VariableKey key = VariableKey.parse(reference);
        return new Rule(null, key.sheet(), key.name(), operator, value);
    }

    public VariableKey key() {
        return VariableKey.of(sheet, variable);
    }

    /// Resolves the operator to apply for a variable of `type`.
    ///
    /// @param type declared type of the referenced variable, not null
    /// @return the authored operator, or the type's default when none was given
    public ConditionOperator effectiveOperator(VariableType type) {
        if (operator != null) {
            return operator;
        }
        return type == VariableType.BOOLEAN ? ConditionOperator.IS_TRUE : ConditionOperator.EQUALS;
    }
}
