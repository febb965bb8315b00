package io.storyarn.core.execution.evaluator;

import io.storyarn.core.error.EvaluationError;
import io.storyarn.core.execution.transition.Transition;
import io.storyarn.core.flow.node.ExitNode;
import io.storyarn.core.state.CallFrame;

/// Ends a flow path according to the exit mode.
///
/// - `terminal` finishes the playthrough
/// - `flow` enters the target flow; the pushed frame has no return node, so a later return
///   from that flow unwinds to whoever called the current flow
/// - `return` resumes the caller, or finishes when there is none
public class ExitNodeEvaluator implements NodeEvaluator<ExitNode> {

    @Override
    public Class<ExitNode> getNodeType() {
        return ExitNode.class;
    }

    @Override
    public NodeOutcome evaluate(ExitNode node, EvaluationContext context) {
        Transition transition;
        switch (node.getMode()) {
            case FLOW:
                String target = node.getTargetFlowId();
                if (target == null || target.isBlank()) {
                    transition =
                            Transition.failed(
                                    EvaluationError.missingTarget(
                                            node.getId(),
                                            "Exit " + node.getId() + " has no target flow"));
                } else {
                    CallFrame frame =
                            new CallFrame(context.getFlow().getId(), null, node.getId());
                    transition = new Transition.EnterFlow(target, frame);
                }
                break;
            case RETURN:
                transition = new Transition.ReturnFromFlow();
                break;
            case TERMINAL:
            default:
                transition = Transition.finished("Reached exit " + node.getId());
                break;
        }
        return NodeOutcome.of(transition, context.getState().getVariables());
    }
}
