package io.storyarn.core.variable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class VariableStoreTest {

    private final VariableStore store =
            VariableStore.of(
                    Variable.of("mc.jaime.health", VariableType.NUMBER, Value.number(100)),
                    Variable.of("mc.jaime.name", VariableType.TEXT, Value.text("Jaime")),
                    Variable.of("global.quest", VariableType.NUMBER, Value.number(0)));

    @Nested
    class Reads {

        @Test
        void shouldSplitReferenceAtLastDot() {
            assertThat(store.get("mc.jaime", "health")).isEqualTo(Value.number(100));
            assertThat(store.get(VariableKey.parse("mc.jaime.health")))
                    .isEqualTo(Value.number(100));
        }

        @Test
        void shouldReturnUndefinedForUnknownVariable() {
            assertThat(store.get("mc.jaime", "mana")).isEqualTo(Value.UNDEFINED);
            assertThat(store.contains(VariableKey.of("mc.jaime", "mana"))).isFalse();
            assertThat(store.find(VariableKey.of("nowhere", "x"))).isEmpty();
        }

        @Test
        void shouldListVariablesSortedByAddress() {
            assertThat(store.variables())
                    .extracting(v -> v.key().ref())
                    .containsExactly("global.quest", "mc.jaime.health", "mc.jaime.name");
            assertThat(store.snapshot().firstKey()).isEqualTo(VariableKey.of("global", "quest"));
            assertThat(store.size()).isEqualTo(3);
        }
    }

    @Nested
    class Writes {

        @Test
        void shouldLeaveOriginalUntouched() {
            // When
            VariableStore updated = store.set("mc.jaime", "health", Value.number(30));

            // Then
            assertThat(updated.get("mc.jaime", "health")).isEqualTo(Value.number(30));
            assertThat(store.get("mc.jaime", "health")).isEqualTo(Value.number(100));
            assertThat(updated).isNotEqualTo(store);
        }

        @Test
        void shouldShareUntouchedSheets() {
            // When
            VariableStore updated = store.set("global", "quest", Value.number(1));

            // Then
            assertThat(updated.sharesSheetWith(store, "mc.jaime")).isTrue();
            assertThat(updated.sharesSheetWith(store, "global")).isFalse();
        }

        @Test
        void shouldDeclareUnknownVariableWithInferredType() {
            // When
            VariableStore updated = store.set("flags", "met", Value.bool(true));

            // Then
            assertThat(updated.find(VariableKey.of("flags", "met")))
                    .get()
                    .extracting(Variable::type)
                    .isEqualTo(VariableType.BOOLEAN);
            assertThat(updated.size()).isEqualTo(4);
        }

        @Test
        void shouldRejectValueOfWrongType() {
            assertThatThrownBy(() -> store.set("mc.jaime", "health", Value.text("lots")))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldAllowUnsettingDeclaredVariable() {
            VariableStore updated = store.set("mc.jaime", "name", Value.UNDEFINED);

            assertThat(updated.get("mc.jaime", "name").isDefined()).isFalse();
            assertThat(updated.contains(VariableKey.of("mc.jaime", "name"))).isTrue();
        }

        @Test
        void shouldBeEqualAfterWritingSameValues() {
            VariableStore a = store.set("global", "quest", Value.number(2));
            VariableStore b = store.set("global", "quest", Value.number(2));

            assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        }
    }
}
