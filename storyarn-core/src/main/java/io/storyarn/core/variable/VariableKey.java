package io.storyarn.core.variable;

import java.util.Objects;

/// Address of a variable: the sheet shortcut plus the variable name.
///
/// Sheet shortcuts may themselves contain dots (`mc.jaime`), so the textual form
/// `mc.jaime.health` is split at the last dot.
///
/// @param sheet sheet shortcut, not blank
/// @param name variable name within the sheet, not blank
public record VariableKey(String sheet, String name) implements Comparable<VariableKey> {

    public VariableKey {
        if (sheet == null || sheet.isBlank()) {
            throw new IllegalArgumentException("sheet must not be blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public static VariableKey of(String sheet, String name) {
        return new VariableKey(sheet, name);
    }

    /// Parses `sheet.variable` notation.
    ///
    /// @param reference dotted reference, not null
    /// @return parsed key, never null
    /// @throws IllegalArgumentException if the reference has no dot
    public static VariableKey parse(String reference) {
        Objects.requireNonNull(reference, "reference must not be null");
        int dot = reference.lastIndexOf('.');
        if (dot <= 0 || dot == reference.length() - 1) {
            throw new IllegalArgumentException(
                    "Variable reference must look like sheet.variable: " + reference);
        }
        return new VariableKey(reference.substring(0, dot), reference.substring(dot + 1));
    }

    /// Returns the dotted reference, e.g. `mc.jaime.health`.
    public String ref() {
        return sheet + "." + name;
    }

    @Override
    public int compareTo(VariableKey other) {
        int bySheet = sheet.compareTo(other.sheet);
        return bySheet != 0 ? bySheet : name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return ref();
    }
}
