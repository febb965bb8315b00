package io.storyarn.core.condition;

import io.storyarn.core.variable.VariableType;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Comparison applied by a {@link Rule}.
///
/// Each variable type accepts its own subset; see {@link #supportedBy(VariableType)}.
/// `is_nil` is accepted for every type.
public enum ConditionOperator {
    EQUALS("equals", true),
    NOT_EQUALS("not_equals", true),
    GREATER_THAN("greater_than", true),
    GREATER_THAN_OR_EQUAL("greater_than_or_equal", true),
    LESS_THAN("less_than", true),
    LESS_THAN_OR_EQUAL("less_than_or_equal", true),
    CONTAINS("contains", true),
    NOT_CONTAINS("not_contains", true),
    STARTS_WITH("starts_with", true),
    ENDS_WITH("ends_with", true),
    BEFORE("before", true),
    AFTER("after", true),
    IS_TRUE("is_true", false),
    IS_FALSE("is_false", false),
    IS_EMPTY("is_empty", false),
    IS_NIL("is_nil", false);

    private static final Map<VariableType, Set<ConditionOperator>> BY_TYPE =
            Map.of(
                    VariableType.NUMBER,
                    EnumSet.of(
                            EQUALS,
                            NOT_EQUALS,
                            GREATER_THAN,
                            GREATER_THAN_OR_EQUAL,
                            LESS_THAN,
                            LESS_THAN_OR_EQUAL,
                            IS_NIL),
                    VariableType.TEXT,
                    EnumSet.of(
                            EQUALS, NOT_EQUALS, CONTAINS, STARTS_WITH, ENDS_WITH, IS_EMPTY, IS_NIL),
                    VariableType.BOOLEAN,
                    EnumSet.of(IS_TRUE, IS_FALSE, IS_NIL),
                    VariableType.SELECT,
                    EnumSet.of(EQUALS, NOT_EQUALS, IS_NIL),
                    VariableType.MULTI_SELECT,
                    EnumSet.of(CONTAINS, NOT_CONTAINS, IS_EMPTY, IS_NIL),
                    VariableType.DATE,
                    EnumSet.of(EQUALS, NOT_EQUALS, BEFORE, AFTER, IS_NIL));

    private final String wireName;
    private final boolean needsValue;

    ConditionOperator(String wireName, boolean needsValue) {
        this.wireName = wireName;
        this.needsValue = needsValue;
    }

    public String wireName() {
        return wireName;
    }

    /// Returns whether the operator compares against the rule's literal value.
    ///
    /// @return false for unary operators such as `is_true` or `is_empty`
    public boolean needsValue() {
        return needsValue;
    }

    /// Returns whether variables of `type` accept this operator.
    ///
    /// @param type declared variable type, not null
    /// @return true if the pair is valid
    public boolean isSupportedBy(VariableType type) {
        return BY_TYPE.get(type).contains(this);
    }

    /// Returns the operators valid for `type`.
    ///
    /// @param type declared variable type, not null
    /// @return unmodifiable set, never null
    public static Set<ConditionOperator> supportedBy(VariableType type) {
        return Set.copyOf(BY_TYPE.get(type));
    }

    public static Optional<ConditionOperator> fromWireName(String name) {
        return Arrays.stream(values()).filter(o -> o.wireName.equals(name)).findFirst();
    }
}
