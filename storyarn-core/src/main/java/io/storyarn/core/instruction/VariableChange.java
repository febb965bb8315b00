package io.storyarn.core.instruction;

import io.storyarn.core.variable.Value;
import io.storyarn.core.variable.VariableKey;

/// A write performed by an assignment.
///
/// @param key variable written, not null
/// @param oldValue value before the write, not null
/// @param newValue value after the write (after constraints), not null
/// @param operator operator that produced the write, not null
public record VariableChange(
        VariableKey key, Value oldValue, Value newValue, AssignmentOperator operator) {}
