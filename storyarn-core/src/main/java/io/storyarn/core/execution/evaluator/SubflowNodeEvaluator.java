package io.storyarn.core.execution.evaluator;

import io.storyarn.core.error.EvaluationError;
import io.storyarn.core.execution.transition.Transition;
import io.storyarn.core.flow.node.SubflowNode;
import io.storyarn.core.state.CallFrame;

/// Calls the target flow, recording the node's outgoing edge as the return point.
public class SubflowNodeEvaluator implements NodeEvaluator<SubflowNode> {

    @Override
    public Class<SubflowNode> getNodeType() {
        return SubflowNode.class;
    }

    @Override
    public NodeOutcome evaluate(SubflowNode node, EvaluationContext context) {
        String target = node.getTargetFlowId();
        if (target == null || target.isBlank()) {
            return NodeOutcome.of(
                    Transition.failed(
                            EvaluationError.missingTarget(
                                    node.getId(),
                                    "Subflow " + node.getId() + " has no target flow")),
                    context.getState().getVariables());
        }
        CallFrame frame = new CallFrame(context.getFlow().getId(), node.getNext(), node.getId());
        return NodeOutcome.of(
                new Transition.EnterFlow(target, frame), context.getState().getVariables());
    }
}
