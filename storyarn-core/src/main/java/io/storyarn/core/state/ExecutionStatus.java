package io.storyarn.core.state;

/// Lifecycle status of an execution.
public enum ExecutionStatus {
    /// Ready for the next step.
    RUNNING,
    /// A dialogue offers responses; waiting for a selection.
    AWAITING_CHOICE,
    /// Step budget exhausted; resume with a raised limit.
    PAUSED,
    /// Reached an end.
    FINISHED,
    /// Halted by a structural error.
    FINISHED_WITH_ERROR;

    /// @return true for the two finished states
    public boolean isTerminal() {
        return this == FINISHED || this == FINISHED_WITH_ERROR;
    }
}
