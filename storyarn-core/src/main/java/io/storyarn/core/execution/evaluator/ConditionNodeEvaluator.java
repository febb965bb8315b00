package io.storyarn.core.execution.evaluator;

import io.storyarn.core.condition.ConditionEvaluator;
import io.storyarn.core.condition.ConditionResult;
import io.storyarn.core.error.EvaluationError;
import io.storyarn.core.execution.log.LogKind;
import io.storyarn.core.execution.transition.Transition;
import io.storyarn.core.flow.node.ConditionNode;
import io.storyarn.core.flow.node.SwitchCase;
import io.storyarn.core.variable.VariableStore;

/// Branches on variable state.
///
/// In boolean mode the node follows its true or false edge. In switch mode the cases are
/// tried in declaration order and the first passing case wins, even when later cases would
/// pass too; the default edge is taken only when no case passes. A branch with no connected
/// edge fails with `MISSING_TARGET_NODE`.
public class ConditionNodeEvaluator implements NodeEvaluator<ConditionNode> {

    @Override
    public Class<ConditionNode> getNodeType() {
        return ConditionNode.class;
    }

    @Override
    public NodeOutcome evaluate(ConditionNode node, EvaluationContext context) {
        VariableStore variables = context.getState().getVariables();
        NodeOutcome.Builder outcome = NodeOutcome.builder(variables);
        ConditionEvaluator evaluator = context.getConditionEvaluator();

        if (node.isSwitchMode()) {
            for (SwitchCase switchCase : node.getCases()) {
                ConditionResult result = evaluator.evaluate(switchCase.condition(), variables);
                warn(outcome, result);
                if (result.passed()) {
                    outcome.note(LogKind.INFO, "Case '" + label(switchCase) + "' matched");
                    return outcome.build(branch(node, switchCase.target(), label(switchCase)));
                }
            }
            if (node.getDefaultTarget() == null) {
                return outcome.build(
                        Transition.failed(
                                EvaluationError.missingTarget(
                                        node.getId(),
                                        "No case matched in condition "
                                                + node.getId()
                                                + " and there is no default")));
            }
            outcome.note(LogKind.INFO, "No case matched, taking default");
            return outcome.build(Transition.advance(node.getDefaultTarget()));
        }

        ConditionResult result = evaluator.evaluate(node.getCondition(), variables);
        warn(outcome, result);
        outcome.note(LogKind.INFO, "Condition evaluated to " + result.passed());
        return outcome.build(
                branch(
                        node,
                        result.passed() ? node.getTrueTarget() : node.getFalseTarget(),
                        Boolean.toString(result.passed())));
    }

    private static Transition branch(ConditionNode node, String target, String label) {
        if (target == null || target.isBlank()) {
            return Transition.failed(
                    EvaluationError.missingTarget(
                            node.getId(),
                            "Branch '"
                                    + label
                                    + "' of condition "
                                    + node.getId()
                                    + " is not connected"));
        }
        return Transition.advance(target);
    }

    private static String label(SwitchCase switchCase) {
        return switchCase.label() != null ? switchCase.label() : switchCase.id();
    }

    private static void warn(NodeOutcome.Builder outcome, ConditionResult result) {
        for (EvaluationError error : result.errors()) {
            outcome.note(LogKind.WARNING, error.toString());
        }
    }
}
