package io.storyarn.core.variable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/// Parsing and coercion between authored literals and typed {@link Value}s.
///
/// Literals arrive as text from condition rules and assignments; their meaning depends on
/// the declared type of the variable they are compared with or written to.
public final class Values {

    /// Largest number of integer or fractional digits a number value may carry.
    public static final int MAX_DIGITS = 1000;

    private static final double LOG10_2 = 0.30103;

    private Values() {}

    /// Parses an authored literal as a value of `type`.
    ///
    /// - number: decimal notation (`42`, `-3.5`), at most {@link #MAX_DIGITS} digits on
    ///   either side of the point
    /// - boolean: `true` / `false`, case-insensitive
    /// - multi_select: comma-separated keys
    /// - date: ISO-8601 (`2024-05-01`)
    /// - text and select: taken verbatim
    ///
    /// @param literal raw literal, may be null
    /// @param type target type, not null
    /// @return parsed value, {@link Value#UNDEFINED} for a null literal, empty if unparseable
    public static Optional<Value> parse(String literal, VariableType type) {
        if (literal == null) {
            return Optional.of(Value.UNDEFINED);
        }
        switch (type) {
            case NUMBER:
                return parseNumber(literal).map(Value::number);
            case BOOLEAN:
                if ("true".equalsIgnoreCase(literal.trim())) return Optional.of(Value.bool(true));
                if ("false".equalsIgnoreCase(literal.trim())) return Optional.of(Value.bool(false));
                return Optional.empty();
            case SELECT:
                return literal.isEmpty()
                        ? Optional.of(Value.UNDEFINED)
                        : Optional.of(Value.select(literal));
            case MULTI_SELECT:
                return Optional.of(Value.multiSelect(splitKeys(literal)));
            case DATE:
                return parseDate(literal).map(Value::date);
            case TEXT:
            default:
                return Optional.of(Value.text(literal));
        }
    }

    /// Converts a value read from one variable so it can be written into another of `type`.
    ///
    /// @param value source value, not null
    /// @param type target type, not null
    /// @return converted value, empty if no sensible conversion exists
    public static Optional<Value> coerce(Value value, VariableType type) {
        if (!value.isDefined() || type.accepts(value)) {
            return Optional.of(value);
        }
        if (type == VariableType.TEXT) {
            return Optional.of(Value.text(asText(value)));
        }
        if (type == VariableType.MULTI_SELECT && value instanceof Value.SelectValue s) {
            return Optional.of(Value.multiSelect(Set.of(s.key())));
        }
        return parse(asText(value), type);
    }

    /// Reads a value as a number where that is meaningful.
    ///
    /// @param value any value, not null
    /// @return the number; empty for non-numeric values
    public static Optional<BigDecimal> toNumber(Value value) {
        if (value instanceof Value.NumberValue n) {
            return Optional.of(n.number());
        }
        if (value instanceof Value.TextValue t) {
            return parseNumber(t.text());
        }
        return Optional.empty();
    }

    /// Renders a value as plain text without quoting (used for text comparisons).
    ///
    /// @param value any value, not null
    /// @return text form, empty string for undefined
    public static String asText(Value value) {
        if (value instanceof Value.TextValue t) return t.text();
        if (value instanceof Value.NumberValue n) return n.display();
        if (value instanceof Value.BooleanValue b) return Boolean.toString(b.value());
        if (value instanceof Value.SelectValue s) return s.key();
        if (value instanceof Value.MultiSelectValue m) return String.join(",", m.keys());
        if (value instanceof Value.DateValue d) return d.date().toString();
        return "";
    }

    /// Parses a decimal literal, rejecting numbers outside {@link #isWithinLimits}.
    ///
    /// @param literal raw literal, may be null
    /// @return the number, empty if unreadable or too large
    public static Optional<BigDecimal> parseNumber(String literal) {
        if (literal == null || literal.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(literal.trim())).filter(Values::isWithinLimits);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /// Returns whether `number` has at most {@link #MAX_DIGITS} integer digits and at most
    /// {@link #MAX_DIGITS} fractional digits.
    ///
    /// Runs in time linear in the unscaled value, so literals such as `1e1000000` are
    /// rejected before any arithmetic expands them.
    ///
    /// @param number candidate, not null
    /// @return true if arithmetic and display on `number` stay cheap
    public static boolean isWithinLimits(BigDecimal number) {
        int scale = number.scale();
        if (scale > MAX_DIGITS || scale < -MAX_DIGITS) {
            return false;
        }
        long unscaledDigits = (long) (number.unscaledValue().bitLength() * LOG10_2) + 1;
        return unscaledDigits - scale <= MAX_DIGITS;
    }

    public static Optional<LocalDate> parseDate(String literal) {
        if (literal == null || literal.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(literal.trim()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Set<String> splitKeys(String literal) {
        return Arrays.stream(literal.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
