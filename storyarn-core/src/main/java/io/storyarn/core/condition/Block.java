package io.storyarn.core.condition;

import java.util.List;
import java.util.Objects;

/// Logic over a list of rules.
///
/// @param id authoring id, may be null
/// @param logic combinator, not null
/// @param rules rules in evaluation order, not null
public record Block(String id, Logic logic, List<Rule> rules) implements Condition {

    public Block {
        Objects.requireNonNull(logic, "logic must not be null");
        rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
    }

    public static Block of(Logic logic, Rule... rules) {
        return new Block(null, logic, List.of(rules));
    }
}
