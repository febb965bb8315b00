package io.storyarn.core.execution.log;

/// Category of an execution log entry.
public enum LogKind {
    ADVANCE,
    CHOICE,
    ERROR,
    PAUSE,
    INFO,
    WARNING
}
