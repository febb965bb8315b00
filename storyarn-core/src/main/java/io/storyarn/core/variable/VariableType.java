package io.storyarn.core.variable;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

/// Declared type of a sheet variable.
///
/// The declared type, not the current value, decides which condition and assignment
/// operators apply. A variable holding {@link Value#UNDEFINED} still has a type.
public enum VariableType {
    NUMBER("number"),
    TEXT("text"),
    BOOLEAN("boolean"),
    SELECT("select"),
    MULTI_SELECT("multi_select"),
    DATE("date");

    private final String wireName;

    VariableType(String wireName) {
        this.wireName = wireName;
    }

    /// Returns the lower-case name used in flow documents.
    ///
    /// @return wire name, never null
    public String wireName() {
        return wireName;
    }

    /// Resolves a wire name. `rich_text` is read as {@link #TEXT}.
    ///
    /// @param name wire name, may be null
    /// @return the matching type, or empty if unknown
    public static Optional<VariableType> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        if ("rich_text".equals(name)) {
            return Optional.of(TEXT);
        }
        return Arrays.stream(values()).filter(t -> t.wireName.equals(name)).findFirst();
    }

    /// Returns the value a freshly created variable of this type holds.
    ///
    /// `set_if_unset` treats this value the same as {@link Value#UNDEFINED}.
    ///
    /// @return default value, never null
    public Value defaultValue() {
        switch (this) {
            case NUMBER:
                return Value.number(BigDecimal.ZERO);
            case TEXT:
                return Value.text("");
            case BOOLEAN:
                return Value.bool(false);
            case MULTI_SELECT:
                return Value.multiSelect(Set.of());
            default:
                return Value.UNDEFINED;
        }
    }

    /// Returns whether a value can be stored in a variable of this type.
    ///
    /// @param value candidate value, not null
    /// @return true if `value` is undefined or matches this type
    public boolean accepts(Value value) {
        if (!value.isDefined()) {
            return true;
        }
        switch (this) {
            case NUMBER:
                return value instanceof Value.NumberValue;
            case TEXT:
                return value instanceof Value.TextValue;
            case BOOLEAN:
                return value instanceof Value.BooleanValue;
            case SELECT:
                return value instanceof Value.SelectValue;
            case MULTI_SELECT:
                return value instanceof Value.MultiSelectValue;
            case DATE:
                return value instanceof Value.DateValue;
            default:
                return false;
        }
    }

    /// Infers the type of a defined value.
    ///
    /// @param value a defined value, not null
    /// @return the matching type
    /// @throws IllegalArgumentException if `value` is undefined
    public static VariableType of(Value value) {
        if (value instanceof Value.NumberValue) return NUMBER;
        if (value instanceof Value.TextValue) return TEXT;
        if (value instanceof Value.BooleanValue) return BOOLEAN;
        if (value instanceof Value.SelectValue) return SELECT;
        if (value instanceof Value.MultiSelectValue) return MULTI_SELECT;
        if (value instanceof Value.DateValue) return DATE;
        throw new IllegalArgumentException("Cannot infer a type from an undefined value");
    }
}
