package io.storyarn.core.variable;

import java.math.BigDecimal;

/// Authoring-time limits applied to values written by instructions.
///
/// - `min` / `max` clamp number variables
/// - `maxLength` truncates text variables, counted in code points
///
/// Any bound may be null (unbounded).
///
/// @param min lower bound for numbers, may be null
/// @param max upper bound for numbers, may be null
/// @param maxLength maximum text length, may be null
public record VariableConstraints(BigDecimal min, BigDecimal max, Integer maxLength) {

    public static final VariableConstraints NONE = new VariableConstraints(null, null, null);

    public VariableConstraints {
        if ((min != null && !Values.isWithinLimits(min))
                || (max != null && !Values.isWithinLimits(max))) {
            throw new IllegalArgumentException(
                    "Bounds must not exceed " + Values.MAX_DIGITS + " digits");
        }
        if (min != null && max != null && min.compareTo(max) > 0) {
            throw new IllegalArgumentException("min " + min + " is greater than max " + max);
        }
        if (maxLength != null && maxLength < 0) {
            throw new IllegalArgumentException("maxLength must not be negative");
        }
    }

    public static VariableConstraints range(BigDecimal min, BigDecimal max) {
        return new VariableConstraints(min, max, null);
    }

    public static VariableConstraints maxLength(int maxLength) {
        return new VariableConstraints(null, null, maxLength);
    }

    /// Clamps or truncates `value` into these constraints.
    ///
    /// @param value the value about to be written, not null
    /// @return the constrained value, `value` itself when nothing applies
    public Value apply(Value value) {
        if (value instanceof Value.NumberValue n) {
            BigDecimal number = n.number();
            if (min != null && number.compareTo(min) < 0) {
                return Value.number(min);
            }
            if (max != null && number.compareTo(max) > 0) {
                return Value.number(max);
            }
            return value;
        }
        if (value instanceof Value.TextValue t && maxLength != null) {
            String text = t.text();
            if (text.codePointCount(0, text.length()) <= maxLength) {
                return value;
            }
            return Value.text(text.substring(0, text.offsetByCodePoints(0, maxLength)));
        }
        return value;
    }

    public boolean isEmpty() {
        return min == null && max == null && maxLength == null;
    }
}
