package io.storyarn.core.condition;

import java.util.Optional;

/// Combinator tag carried by every block, group and top-level condition.
public enum Logic {
    /// Logical AND. An empty list is true.
    ALL("all"),
    /// Logical OR. An empty list is true (nothing to evaluate passes).
    ANY("any");

    private final String wireName;

    Logic(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /// Resolves a wire name, case-insensitively.
    ///
    /// @param name `all` or `any`, may be null
    /// @return the logic, or empty if unknown
    public static Optional<Logic> fromWireName(String name) {
        if (name == null) return Optional.empty();
        for (Logic logic : values()) {
            if (logic.wireName.equalsIgnoreCase(name)) return Optional.of(logic);
        }
        return Optional.empty();
    }
}
