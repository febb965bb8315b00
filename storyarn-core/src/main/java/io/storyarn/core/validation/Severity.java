package io.storyarn.core.validation;

public enum Severity {
    /// The flow cannot be played correctly.
    ERROR,
    /// Suspicious but playable.
    WARNING
}
