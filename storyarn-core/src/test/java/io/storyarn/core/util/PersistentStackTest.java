package io.storyarn.core.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class PersistentStackTest {

    @Test
    void shouldKeepOlderVersionsIntact() {
        // Given
        PersistentStack<String> one = PersistentStack.<String>empty().push("a");

        // When
        PersistentStack<String> two = one.push("b");

        // Then
        assertThat(one.toList()).containsExactly("a");
        assertThat(two.toList()).containsExactly("b", "a");
        assertThat(two.pop()).isSameAs(one);
    }

    @Test
    void shouldListInBothOrders() {
        PersistentStack<Integer> stack = PersistentStack.ofOldestFirst(List.of(1, 2, 3));

        assertThat(stack.peek()).isEqualTo(3);
        assertThat(stack.toListOldestFirst()).containsExactly(1, 2, 3);
        assertThat(stack).containsExactly(3, 2, 1);
    }

    @Test
    void shouldFailOnEmptyPop() {
        assertThatThrownBy(() -> PersistentStack.empty().pop())
                .isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void shouldCompareByContent() {
        assertThat(PersistentStack.ofOldestFirst(List.of("x", "y")))
                .isEqualTo(PersistentStack.<String>empty().push("x").push("y"));
    }
}
