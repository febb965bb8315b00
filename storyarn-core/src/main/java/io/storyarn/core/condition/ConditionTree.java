package io.storyarn.core.condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Top-level condition: logic over blocks and groups.
///
/// A tree with no children, or whose blocks hold no rules, always passes.
///
/// @param logic combinator, not null
/// @param children blocks and groups in evaluation order, not null; rules are not allowed here
public record ConditionTree(Logic logic, List<Condition> children) {

    /// Condition that always passes.
    public static final ConditionTree EMPTY = new ConditionTree(Logic.ALL, List.of());

    public ConditionTree {
        Objects.requireNonNull(logic, "logic must not be null");
        children = List.copyOf(Objects.requireNonNull(children, "children must not be null"));
        for (Condition child : children) {
            if (child instanceof Rule) {
                throw new IllegalArgumentException(
                        "Rules must be wrapped in a block at the top level of a condition");
            }
        }
    }

    public static ConditionTree of(Logic logic, Condition... children) {
        return new ConditionTree(logic, List.of(children));
    }

    /// Wraps a single rule in a one-block tree.
    ///
    /// @param rule the rule, not null
    /// @return tree containing only `rule`, never null
    public static ConditionTree single(Rule rule) {
        return new ConditionTree(Logic.ALL, List.of(Block.of(Logic.ALL, rule)));
    }

    /// Upgrades a flat rule list (the older document shape) into a one-block tree.
    ///
    /// @param logic combinator of the flat list, not null
    /// @param rules rules, not null
    /// @return equivalent tree, {@link #EMPTY} if `rules` is empty
    public static ConditionTree ofRules(Logic logic, List<Rule> rules) {
        if (rules.isEmpty()) {
            return EMPTY;
        }
        return new ConditionTree(logic, List.of(new Block(null, logic, rules)));
    }

    public boolean isEmpty() {
        return rules().isEmpty();
    }

    /// Returns every rule in the tree, depth first.
    ///
    /// @return unmodifiable list, never null
    public List<Rule> rules() {
        List<Rule> rules = new ArrayList<>();
        for (Condition child : children) {
            if (child instanceof Block block) {
                rules.addAll(block.rules());
            } else if (child instanceof Group group) {
                group.blocks().forEach(b -> rules.addAll(b.rules()));
            }
        }
        return List.copyOf(rules);
    }
}
