package io.storyarn.core.execution.log;

import java.util.Objects;

/// One line of the human-readable execution trail.
///
/// @param step step count at which the entry was written
/// @param flowId flow being executed, may be null for session-level entries
/// @param nodeId node concerned, may be null for session-level entries
/// @param kind category, not null
/// @param message detail, not null
public record LogEntry(int step, String flowId, String nodeId, LogKind kind, String message) {

    public LogEntry {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        String node = nodeId != null ? " [" + nodeId + "]" : "";
        return "#" + step + " " + kind + node + " " + message;
    }
}
