package io.storyarn.core.variable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ValuesTest {

    @Nested
    class Parsing {

        @Test
        void shouldParseLiteralsOfEveryType() {
            // When
            Optional<Value> number = Values.parse("42.50", VariableType.NUMBER);
            Optional<Value> flag = Values.parse("TRUE", VariableType.BOOLEAN);
            Optional<Value> keys = Values.parse("a, b", VariableType.MULTI_SELECT);
            Optional<Value> date = Values.parse("2024-03-01", VariableType.DATE);

            // Then
            assertThat(number).contains(Value.number(new BigDecimal("42.5")));
            assertThat(flag).contains(Value.bool(true));
            assertThat(Values.parse("hello", VariableType.TEXT)).contains(Value.text("hello"));
            assertThat(Values.parse("warrior", VariableType.SELECT))
                    .contains(Value.select("warrior"));
            assertThat(keys).contains(Value.multiSelect("a", "b"));
            assertThat(date).contains(Value.date(LocalDate.of(2024, 3, 1)));
        }

        @Test
        void shouldTreatNullLiteralAsUndefined() {
            assertThat(Values.parse(null, VariableType.NUMBER)).contains(Value.UNDEFINED);
        }

        @Test
        void shouldRejectUnreadableLiterals() {
            assertThat(Values.parse("many", VariableType.NUMBER)).isEmpty();
            assertThat(Values.parse("yes please", VariableType.BOOLEAN)).isEmpty();
            assertThat(Values.parse("01/03/2024", VariableType.DATE)).isEmpty();
        }

        @Test
        void shouldRejectNumbersWithTooManyDigits() {
            // When
            Optional<BigDecimal> hugeExponent = Values.parseNumber("1e1000000");
            Optional<BigDecimal> tinyFraction = Values.parseNumber("1e-1001");
            Optional<BigDecimal> largestAccepted = Values.parseNumber("5e999");

            // Then
            assertThat(hugeExponent).isEmpty();
            assertThat(tinyFraction).isEmpty();
            assertThat(largestAccepted).isPresent();
        }
    }

    @Nested
    class Numbers {

        @Test
        void shouldCompareNumbersIgnoringScale() {
            // Given
            Value withFraction = Value.number(new BigDecimal("1.0"));
            Value withExponent = Value.number(new BigDecimal("1E+2"));

            // Then
            assertThat(withFraction).isEqualTo(Value.number(1));
            assertThat(withFraction.hashCode()).isEqualTo(Value.number(1).hashCode());
            assertThat(withExponent).isEqualTo(Value.number(100));
            assertThat(withExponent.hashCode()).isEqualTo(Value.number(100).hashCode());
        }

        @Test
        void shouldDisplayWithoutTrailingFractionZeros() {
            assertThat(Value.number(new BigDecimal("12.50")).display()).isEqualTo("12.5");
            assertThat(Value.number(new BigDecimal("1E+3")).display()).isEqualTo("1000");
            assertThat(Value.number(new BigDecimal("0.000")).display()).isEqualTo("0");
        }

        @Test
        void shouldRefuseOversizedNumberValues() {
            assertThatThrownBy(() -> Value.number(new BigDecimal("1e5000")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("digits");
        }
    }

    @Nested
    class Constraints {

        @Test
        void shouldClampNumbersIntoRange() {
            // Given
            VariableConstraints range = VariableConstraints.range(BigDecimal.ZERO, BigDecimal.TEN);

            // Then
            assertThat(range.apply(Value.number(15))).isEqualTo(Value.number(10));
            assertThat(range.apply(Value.number(-3))).isEqualTo(Value.number(0));
        }

        @Test
        void shouldTruncateTextToMaxLength() {
            // When
            Value truncated = VariableConstraints.maxLength(3).apply(Value.text("abcdef"));

            // Then
            assertThat(truncated).isEqualTo(Value.text("abc"));
        }

        @Test
        void shouldTruncateTextWithoutSplittingSurrogatePairs() {
            // Given
            String sword = new String(Character.toChars(0x1F5E1));
            Value text = Value.text("a" + sword + "b");

            // When
            Value truncated = VariableConstraints.maxLength(2).apply(text);

            // Then
            assertThat(truncated).isEqualTo(Value.text("a" + sword));
        }

        @Test
        void shouldKeepTextCountedInCodePoints() {
            // Given
            String sword = new String(Character.toChars(0x1F5E1));
            Value text = Value.text(sword + sword);

            // Then
            assertThat(VariableConstraints.maxLength(2).apply(text)).isSameAs(text);
        }

        @Test
        void shouldRejectOversizedBounds() {
            assertThatThrownBy(
                            () -> VariableConstraints.range(null, new BigDecimal("1e2000")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
