package io.storyarn.core.execution.log;

/// Who wrote a variable.
public enum ChangeSource {
    /// An instruction node, dialogue output instruction or response assignment.
    INSTRUCTION,
    /// A manual override from the debugger.
    USER_OVERRIDE
}
