package io.storyarn.core.instruction;

import io.storyarn.core.variable.VariableType;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Mutation applied by an {@link Assignment}.
///
/// Operators are partitioned by variable type; see {@link #isSupportedBy(VariableType)}.
public enum AssignmentOperator {
    SET("set", true),
    ADD("add", true),
    SUBTRACT("subtract", true),
    SET_IF_UNSET("set_if_unset", true),
    SET_TRUE("set_true", false),
    SET_FALSE("set_false", false),
    TOGGLE("toggle", false),
    CLEAR("clear", false);

    private static final Map<VariableType, Set<AssignmentOperator>> BY_TYPE =
            Map.of(
                    VariableType.NUMBER, EnumSet.of(SET, ADD, SUBTRACT, SET_IF_UNSET),
                    VariableType.BOOLEAN,
                            EnumSet.of(SET, SET_TRUE, SET_FALSE, TOGGLE, SET_IF_UNSET),
                    VariableType.TEXT, EnumSet.of(SET, CLEAR, SET_IF_UNSET),
                    VariableType.SELECT, EnumSet.of(SET, SET_IF_UNSET),
                    VariableType.MULTI_SELECT, EnumSet.of(SET, SET_IF_UNSET),
                    VariableType.DATE, EnumSet.of(SET, SET_IF_UNSET));

    private final String wireName;
    private final boolean needsValue;

    AssignmentOperator(String wireName, boolean needsValue) {
        this.wireName = wireName;
        this.needsValue = needsValue;
    }

    public String wireName() {
        return wireName;
    }

    /// Returns whether the operator reads the assignment's value.
    ///
    /// @return false for `set_true`, `set_false`, `toggle` and `clear`
    public boolean needsValue() {
        return needsValue;
    }

    public boolean isSupportedBy(VariableType type) {
        return BY_TYPE.get(type).contains(this);
    }

    public static Set<AssignmentOperator> supportedBy(VariableType type) {
        return Set.copyOf(BY_TYPE.get(type));
    }

    public static Optional<AssignmentOperator> fromWireName(String name) {
        return Arrays.stream(values()).filter(o -> o.wireName.equals(name)).findFirst();
    }
}
