package io.storyarn.core.flow.node;

import io.storyarn.core.condition.ConditionTree;
import java.util.ArrayList;
import java.util.List;

/// Branch on variable state.
///
/// - **Boolean mode**: evaluates `condition` and follows `trueTarget` or `falseTarget`
/// - **Switch mode**: tries `cases` in order and follows the first one whose condition
///   passes; falls back to `defaultTarget` when none does
///
/// @implNote Immutable and thread-safe after construction.
public final class ConditionNode extends Node {

    private final boolean switchMode;
    private final ConditionTree condition;
    private final String trueTarget;
    private final String falseTarget;
    private final List<SwitchCase> cases;
    private final String defaultTarget;

    private ConditionNode(Builder builder) {
        super(builder.id);
        this.switchMode = builder.switchMode;
        this.condition = builder.condition;
        this.trueTarget = builder.trueTarget;
        this.falseTarget = builder.falseTarget;
        this.cases = List.copyOf(builder.cases);
        this.defaultTarget = builder.defaultTarget;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isSwitchMode() {
        return switchMode;
    }

    /// @return condition evaluated in boolean mode, never null
    public ConditionTree getCondition() {
        return condition;
    }

    public String getTrueTarget() {
        return trueTarget;
    }

    public String getFalseTarget() {
        return falseTarget;
    }

    /// @return switch cases in evaluation order, never null
    public List<SwitchCase> getCases() {
        return cases;
    }

    /// @return node followed when no switch case passes, may be null
    public String getDefaultTarget() {
        return defaultTarget;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.CONDITION;
    }

    @Override
    public List<String> getTargets() {
        List<String> targets = new ArrayList<>();
        if (switchMode) {
            cases.forEach(c -> targets.add(c.target()));
            targets.add(defaultTarget);
        } else {
            targets.add(trueTarget);
            targets.add(falseTarget);
        }
        return targetsOf(targets.toArray(new String[0]));
    }

    public static final class Builder {
        private String id;
        private boolean switchMode;
        private ConditionTree condition = ConditionTree.EMPTY;
        private String trueTarget;
        private String falseTarget;
        private final List<SwitchCase> cases = new ArrayList<>();
        private String defaultTarget;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder switchMode(boolean switchMode) {
            this.switchMode = switchMode;
            return this;
        }

        public Builder condition(ConditionTree condition) {
            this.condition = condition != null ? condition : ConditionTree.EMPTY;
            return this;
        }

        public Builder trueTarget(String trueTarget) {
            this.trueTarget = trueTarget;
            return this;
        }

        public Builder falseTarget(String falseTarget) {
            this.falseTarget = falseTarget;
            return this;
        }

        /// Appends a switch case. Also turns switch mode on.
        ///
        /// @param switchCase the case, not null
        /// @return this builder for chaining
        public Builder switchCase(SwitchCase switchCase) {
            this.cases.add(switchCase);
            this.switchMode = true;
            return this;
        }

        public Builder cases(List<SwitchCase> cases) {
            this.cases.clear();
            this.cases.addAll(cases);
            return this;
        }

        public Builder defaultTarget(String defaultTarget) {
            this.defaultTarget = defaultTarget;
            return this;
        }

        /// Builds the immutable condition node.
        ///
        /// @return new ConditionNode instance, never null
        /// @throws IllegalStateException if `id` is missing
        public ConditionNode build() {
            requireId(id, "ConditionNode");
            return new ConditionNode(this);
        }
    }
}
