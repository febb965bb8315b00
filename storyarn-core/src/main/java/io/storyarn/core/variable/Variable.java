package io.storyarn.core.variable;

import java.util.Objects;

/// A declared sheet variable together with its current value.
///
/// @param key address of the variable, not null
/// @param type declared type, not null
/// @param value current value, not null (use {@link Value#UNDEFINED} for unset)
/// @param constraints write constraints, not null
public record Variable(
        VariableKey key, VariableType type, Value value, VariableConstraints constraints) {

    public Variable {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(type, "type must not be null");
        value = value != null ? value : Value.UNDEFINED;
        constraints = constraints != null ? constraints : VariableConstraints.NONE;
        if (!type.accepts(value)) {
            throw new IllegalArgumentException(
                    "Variable " + key + " of type " + type.wireName() + " cannot hold " + value);
        }
    }

    public static Variable of(VariableKey key, VariableType type, Value value) {
        return new Variable(key, type, value, VariableConstraints.NONE);
    }

    public static Variable of(String reference, VariableType type, Value value) {
        return of(VariableKey.parse(reference), type, value);
    }

    /// Returns a copy holding `newValue`.
    ///
    /// @param newValue the new value, not null, must be accepted by {@link #type()}
    /// @return updated variable, never null
    public Variable withValue(Value newValue) {
        return new Variable(key, type, newValue, constraints);
    }
}
