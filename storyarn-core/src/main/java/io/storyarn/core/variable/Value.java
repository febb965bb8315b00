package io.storyarn.core.variable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/// Typed value held by a sheet variable.
///
/// Closed set of variants so that operator dispatch in the condition evaluator and the
/// instruction executor stays exhaustive.
///
/// ### Permitted Subtypes
/// - {@link NumberValue} - exact decimal
/// - {@link TextValue} - plain text
/// - {@link BooleanValue} - true/false
/// - {@link SelectValue} - a single option key
/// - {@link MultiSelectValue} - a set of option keys
/// - {@link DateValue} - calendar date without time zone
/// - {@link Undefined} - never assigned, or not present in the store
///
/// @see VariableType for the declared type of a variable
/// @see Values for parsing and coercion helpers
public sealed interface Value {

    /// Shared instance of the undefined value.
    Undefined UNDEFINED = new Undefined();

    /// Returns whether this value carries data.
    ///
    /// @return false only for {@link Undefined}
    default boolean isDefined() {
        return true;
    }

    /// Returns a short human-readable rendering used by the execution log.
    ///
    /// @return display text, never null
    String display();

    static NumberValue number(BigDecimal number) {
        return new NumberValue(number);
    }

    static NumberValue number(long number) {
        return new NumberValue(BigDecimal.valueOf(number));
    }

    static TextValue text(String text) {
        return new TextValue(text);
    }

    static BooleanValue bool(boolean value) {
        return value ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    static SelectValue select(String key) {
        return new SelectValue(key);
    }

    static MultiSelectValue multiSelect(Set<String> keys) {
        return new MultiSelectValue(keys);
    }

    static MultiSelectValue multiSelect(String... keys) {
        return new MultiSelectValue(Set.of(keys));
    }

    static DateValue date(LocalDate date) {
        return new DateValue(date);
    }

    /// Exact decimal number. The scale is kept as given; equality is numeric, so `1.0`
    /// equals `1`.
    ///
    /// @param number the numeric value, not null, within {@link Values#isWithinLimits}
    /// @throws IllegalArgumentException if `number` has too many digits
    record NumberValue(BigDecimal number) implements Value {
        public NumberValue {
            Objects.requireNonNull(number, "number must not be null");
            if (!Values.isWithinLimits(number)) {
                throw new IllegalArgumentException(
                        "Number exceeds " + Values.MAX_DIGITS + " digits: " + number);
            }
        }

        @Override
        public String display() {
            if (number.signum() == 0) {
                return "0";
            }
            return number.scale() > 0
                    ? number.stripTrailingZeros().toPlainString()
                    : number.toPlainString();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            return o instanceof NumberValue other && number.compareTo(other.number) == 0;
        }

        @Override
        public int hashCode() {
            // numerically equal decimals round to the same double
            return Double.hashCode(number.doubleValue());
        }
    }

    /// @param text the text, not null (use an empty string for cleared text)
    record TextValue(String text) implements Value {
        public TextValue {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public String display() {
            return "\"" + text + "\"";
        }
    }

    /// @param value the boolean
    record BooleanValue(boolean value) implements Value {
        static final BooleanValue TRUE = new BooleanValue(true);
        static final BooleanValue FALSE = new BooleanValue(false);

        @Override
        public String display() {
            return Boolean.toString(value);
        }
    }

    /// @param key the selected option key, not null
    record SelectValue(String key) implements Value {
        public SelectValue {
            Objects.requireNonNull(key, "key must not be null");
        }

        @Override
        public String display() {
            return key;
        }
    }

    /// @param keys the selected option keys, not null, kept sorted for stable display
    record MultiSelectValue(Set<String> keys) implements Value {
        public MultiSelectValue {
            Objects.requireNonNull(keys, "keys must not be null");
            keys = Collections.unmodifiableSet(new TreeSet<>(keys));
        }

        @Override
        public String display() {
            return keys.toString();
        }
    }

    /// @param date the calendar date, not null
    record DateValue(LocalDate date) implements Value {
        public DateValue {
            Objects.requireNonNull(date, "date must not be null");
        }

        @Override
        public String display() {
            return date.toString();
        }
    }

    /// Absence of a value. Use {@link Value#UNDEFINED} rather than constructing new instances.
    record Undefined() implements Value {
        @Override
        public boolean isDefined() {
            return false;
        }

        @Override
        public String display() {
            return "nil";
        }
    }
}
