package io.storyarn.core.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Consumer;

/// Immutable singly-linked stack with structural sharing.
///
/// Every `push` allocates exactly one cell and shares the rest of the chain with the
/// previous version, so keeping many versions alive (undo history, execution logs)
/// costs memory proportional to the number of pushes, not to the number of versions.
///
/// ### Ordering
/// - {@link #iterator()} and {@link #toList()} walk from the top (most recent) down
/// - {@link #toListOldestFirst()} returns insertion order
///
/// @implNote Immutable and thread-safe.
///
/// @param <T> element type, elements must not be null
public final class PersistentStack<T> implements Iterable<T> {

    private static final PersistentStack<?> EMPTY = new PersistentStack<>(null, null, 0);

    private final T head;
    private final PersistentStack<T> tail;
    private final int size;

    private PersistentStack(T head, PersistentStack<T> tail, int size) {
        this.head = head;
        this.tail = tail;
        this.size = size;
    }

    /// Returns the shared empty stack.
    ///
    /// @param <T> element type
    /// @return empty stack, never null
    @SuppressWarnings("unchecked")
    public static <T> PersistentStack<T> empty() {
        return (PersistentStack<T>) EMPTY;
    }

    /// Builds a stack whose top is the last element of `elements`.
    ///
    /// @param elements elements in insertion order, not null
    /// @param <T> element type
    /// @return new stack, never null
    public static <T> PersistentStack<T> ofOldestFirst(List<T> elements) {
        PersistentStack<T> stack = empty();
        for (T element : elements) {
            stack = stack.push(element);
        }
        return stack;
    }

    /// Returns a new stack with `element` on top. This stack is unchanged.
    ///
    /// @param element the element to push, not null
    /// @return new stack sharing this one as its tail, never null
    public PersistentStack<T> push(T element) {
        Objects.requireNonNull(element, "element must not be null");
        return new PersistentStack<>(element, this, size + 1);
    }

    /// Returns the top element.
    ///
    /// @return the most recently pushed element, never null
    /// @throws NoSuchElementException if the stack is empty
    public T peek() {
        if (isEmpty()) {
            throw new NoSuchElementException("stack is empty");
        }
        return head;
    }

    /// Returns the stack below the top element.
    ///
    /// @return the tail, never null
    /// @throws NoSuchElementException if the stack is empty
    public PersistentStack<T> pop() {
        if (isEmpty()) {
            throw new NoSuchElementException("stack is empty");
        }
        return tail;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int size() {
        return size;
    }

    /// Returns the elements from top to bottom.
    ///
    /// @return unmodifiable list, never null
    public List<T> toList() {
        List<T> list = new ArrayList<>(size);
        forEach(list::add);
        return Collections.unmodifiableList(list);
    }

    /// Returns the elements in the order they were pushed.
    ///
    /// @return unmodifiable list, never null
    public List<T> toListOldestFirst() {
        List<T> list = new ArrayList<>(size);
        forEach(list::add);
        Collections.reverse(list);
        return Collections.unmodifiableList(list);
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private PersistentStack<T> current = PersistentStack.this;

            @Override
            public boolean hasNext() {
                return !current.isEmpty();
            }

            @Override
            public T next() {
                if (current.isEmpty()) {
                    throw new NoSuchElementException();
                }
                T value = current.head;
                current = current.tail;
                return value;
            }
        };
    }

    @Override
    public void forEach(Consumer<? super T> action) {
        for (PersistentStack<T> cell = this; !cell.isEmpty(); cell = cell.tail) {
            action.accept(cell.head);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistentStack<?> other)) return false;
        if (size != other.size) return false;
        PersistentStack<?> a = this;
        PersistentStack<?> b = other;
        while (!a.isEmpty()) {
            if (a == b) return true;
            if (!a.head.equals(b.head)) return false;
            a = a.tail;
            b = b.tail;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (T element : this) {
            hash = 31 * hash + element.hashCode();
        }
        return hash;
    }

    @Override
    public String toString() {
        return toList().toString();
    }
}
