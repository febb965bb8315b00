package io.storyarn.core.state;

import io.storyarn.core.util.PersistentStack;
import java.util.Objects;
import java.util.Optional;

/// Undo history of execution states.
///
/// Each entry is a complete {@link ExecutionState}. Because states are persistent structures,
/// consecutive entries share everything a step did not change, so keeping the full history is
/// proportional to the sum of changes rather than the number of steps times the state size.
///
/// @implNote Immutable. Stored states are never modified.
public final class SnapshotStack {

    private static final SnapshotStack EMPTY = new SnapshotStack(PersistentStack.empty());

    private final PersistentStack<ExecutionState> snapshots;

    private SnapshotStack(PersistentStack<ExecutionState> snapshots) {
        this.snapshots = snapshots;
    }

    public static SnapshotStack empty() {
        return EMPTY;
    }

    /// Records `state` as the most recent undo point.
    ///
    /// @param state state before a step, not null
    /// @return new stack, never null
    public SnapshotStack push(ExecutionState state) {
        Objects.requireNonNull(state, "state must not be null");
        return new SnapshotStack(snapshots.push(state));
    }

    /// @return the most recent undo point, or empty at the start of the session
    public Optional<ExecutionState> peek() {
        return snapshots.isEmpty() ? Optional.empty() : Optional.of(snapshots.peek());
    }

    /// Drops the most recent undo point.
    ///
    /// @return new stack, never null
    /// @throws java.util.NoSuchElementException if the stack is empty
    public SnapshotStack pop() {
        return new SnapshotStack(snapshots.pop());
    }

    public int size() {
        return snapshots.size();
    }

    public boolean isEmpty() {
        return snapshots.isEmpty();
    }
}
