package io.storyarn.core.error;

/// Classification of problems found while evaluating a flow.
///
/// Recoverable kinds are handled where they occur (the rule or assignment is skipped and the
/// problem logged). Structural kinds end the current execution branch.
public enum ErrorKind {
    /// Read of a `sheet.variable` that no sheet declares. Recoverable, reads as undefined.
    UNDEFINED_VARIABLE_REFERENCE(false),
    /// Operator or value incompatible with the variable's type. Recoverable.
    TYPE_MISMATCH(false),
    /// Jump, exit, subflow or edge target that does not exist. Structural.
    MISSING_TARGET_NODE(true),
    /// Subflow nesting deeper than the configured maximum. Structural.
    CALL_STACK_OVERFLOW(true),
    /// Step budget exhausted. Recoverable, the session pauses.
    STEP_LIMIT_REACHED(false);

    private final boolean fatal;

    ErrorKind(boolean fatal) {
        this.fatal = fatal;
    }

    /// Returns whether this kind halts the execution branch.
    ///
    /// @return true for structural errors
    public boolean isFatal() {
        return fatal;
    }
}
