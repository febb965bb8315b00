package io.storyarn.core.execution.log;

import io.storyarn.core.instruction.AssignmentOperator;
import io.storyarn.core.variable.Value;
import io.storyarn.core.variable.VariableKey;
import java.util.Objects;

/// One variable write in the session's variable history.
///
/// @param step step count at which the write happened
/// @param nodeId node that caused it, null for user overrides
/// @param key variable written, not null
/// @param oldValue previous value, not null
/// @param newValue new value, not null
/// @param operator assignment operator, null for user overrides
/// @param source writer, not null
public record HistoryEntry(
        int step,
        String nodeId,
        VariableKey key,
        Value oldValue,
        Value newValue,
        AssignmentOperator operator,
        ChangeSource source) {

    public HistoryEntry {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(oldValue, "oldValue must not be null");
        Objects.requireNonNull(newValue, "newValue must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }
}
