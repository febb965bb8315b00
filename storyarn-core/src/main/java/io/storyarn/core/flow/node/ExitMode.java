package io.storyarn.core.flow.node;

import java.util.Arrays;
import java.util.Optional;

/// What an {@link ExitNode} does when reached.
public enum ExitMode {
    /// End the whole playthrough.
    TERMINAL,
    /// Continue in another flow (a call, not a return).
    FLOW,
    /// Return to the caller recorded on the call stack.
    RETURN;

    public String wireName() {
        return name().toLowerCase();
    }

    public static Optional<ExitMode> fromWireName(String name) {
        return Arrays.stream(values()).filter(m -> m.wireName().equals(name)).findFirst();
    }
}
