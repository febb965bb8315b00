package io.storyarn.core.state;

import io.storyarn.core.util.PersistentStack;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// LIFO stack of {@link CallFrame}s for cross-flow navigation.
///
/// Calls are data, not host recursion, so the stack can be inspected, exported and restored
/// by step-back like any other part of the execution state.
///
/// @implNote Immutable; push and pop return new stacks sharing frames with this one.
public final class CallStack {

    private static final CallStack EMPTY = new CallStack(PersistentStack.empty());

    private final PersistentStack<CallFrame> frames;

    private CallStack(PersistentStack<CallFrame> frames) {
        this.frames = frames;
    }

    public static CallStack empty() {
        return EMPTY;
    }

    /// Rebuilds a stack from frames listed bottom (outermost call) first.
    ///
    /// @param framesOldestFirst frames, not null
    /// @return new stack, never null
    public static CallStack of(List<CallFrame> framesOldestFirst) {
        return new CallStack(PersistentStack.ofOldestFirst(framesOldestFirst));
    }

    public CallStack push(CallFrame frame) {
        Objects.requireNonNull(frame, "frame must not be null");
        return new CallStack(frames.push(frame));
    }

    /// @return the innermost frame, or empty at top level
    public Optional<CallFrame> peek() {
        return frames.isEmpty() ? Optional.empty() : Optional.of(frames.peek());
    }

    /// Removes the innermost frame.
    ///
    /// @return the remaining stack, never null
    /// @throws java.util.NoSuchElementException if the stack is empty
    public CallStack pop() {
        return new CallStack(frames.pop());
    }

    public int depth() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    /// @return frames innermost first, never null
    public List<CallFrame> frames() {
        return frames.toList();
    }

    /// @return frames outermost first, never null
    public List<CallFrame> framesOldestFirst() {
        return frames.toListOldestFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallStack other)) return false;
        return frames.equals(other.frames);
    }

    @Override
    public int hashCode() {
        return frames.hashCode();
    }

    @Override
    public String toString() {
        return "CallStack" + frames;
    }
}
