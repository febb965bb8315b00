package io.storyarn.core.execution;

import io.storyarn.core.flow.node.Node;
import io.storyarn.core.state.ExecutionState;

/// Listener for session lifecycle events.
///
/// All methods have default no-op implementations, allowing listeners to override only the
/// events they care about.
///
/// ### Callback Lifecycle
/// Each step triggers callbacks in this order:
///
/// ```
/// onNodeStart(node, state)      — about to evaluate node
/// onNodeComplete(node, state)   — transition applied, state is the new state
/// onPause(state)                — only when the step limit was reached
/// onFinish(state)               — only when the session reached a finished status
/// ```
///
/// Selecting a response fires `onNodeComplete` for the dialogue, then `onPause` or
/// `onFinish` when applicable.
///
/// @implNote Sessions are single-threaded; callbacks arrive on the caller's thread.
public interface ExecutionListener {

    /// Called before a node is evaluated.
    ///
    /// @param node the node about to be evaluated, not null
    /// @param state state before evaluation, not null
    default void onNodeStart(Node node, ExecutionState state) {}

    /// Called after a node's transition has been applied.
    ///
    /// @param node the node that was evaluated, not null
    /// @param state resulting state, not null
    default void onNodeComplete(Node node, ExecutionState state) {}

    /// Called when a session pauses at its step limit.
    ///
    /// @param state the paused state, not null
    default void onPause(ExecutionState state) {}

    /// Called when a session finishes, with or without error.
    ///
    /// @param state the final state, not null
    default void onFinish(ExecutionState state) {}

    /// No-op listener instance that ignores all events.
    ExecutionListener NOOP = new ExecutionListener() {};
}
