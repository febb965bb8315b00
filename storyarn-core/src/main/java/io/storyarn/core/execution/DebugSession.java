package io.storyarn.core.execution;

import io.storyarn.core.state.ExecutionState;
import io.storyarn.core.state.SnapshotStack;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/// One debugging or preview session: the current state, its undo history, the state it
/// started from, and the breakpoints set by the user.
///
/// Sessions are values. Every {@link FlowEngine} operation returns a new session and leaves
/// the one passed in untouched, so independent sessions share nothing mutable.
///
/// @param state current execution state, not null
/// @param snapshots undo history, not null
/// @param initialState state at session start, used by reset, not null
/// @param breakpoints node ids that stop {@link FlowEngine#run(DebugSession)}, not null
public record DebugSession(
        ExecutionState state,
        SnapshotStack snapshots,
        ExecutionState initialState,
        Set<String> breakpoints) {

    public DebugSession {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(snapshots, "snapshots must not be null");
        Objects.requireNonNull(initialState, "initialState must not be null");
        breakpoints = Collections.unmodifiableSet(new TreeSet<>(breakpoints));
    }

    /// Starts a session at `initialState` with no history and no breakpoints.
    ///
    /// @param initialState starting state, not null
    /// @return new session, never null
    public static DebugSession start(ExecutionState initialState) {
        return new DebugSession(initialState, SnapshotStack.empty(), initialState, Set.of());
    }

    public DebugSession withState(ExecutionState newState) {
        return new DebugSession(newState, snapshots, initialState, breakpoints);
    }

    /// Adds the breakpoint if absent, removes it if present.
    ///
    /// @param nodeId node id, not null
    /// @return new session, never null
    public DebugSession toggleBreakpoint(String nodeId) {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Set<String> updated = new TreeSet<>(breakpoints);
        if (!updated.remove(nodeId)) {
            updated.add(nodeId);
        }
        return new DebugSession(state, snapshots, initialState, updated);
    }

    /// @return true if the current node has a breakpoint
    public boolean isAtBreakpoint() {
        return state.getCurrentNodeId() != null && breakpoints.contains(state.getCurrentNodeId());
    }

    /// @return true if there is a state to step back to
    public boolean canStepBack() {
        return !snapshots.isEmpty();
    }
}
