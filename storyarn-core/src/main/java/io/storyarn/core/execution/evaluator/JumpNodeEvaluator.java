package io.storyarn.core.execution.evaluator;

import io.storyarn.core.error.EvaluationError;
import io.storyarn.core.execution.transition.Transition;
import io.storyarn.core.flow.node.HubNode;
import io.storyarn.core.flow.node.JumpNode;
import java.util.Optional;

/// Jumps to the hub named by the node, within the current flow.
///
/// A hub that no longer exists fails the branch with `MISSING_TARGET_NODE`.
public class JumpNodeEvaluator implements NodeEvaluator<JumpNode> {

    @Override
    public Class<JumpNode> getNodeType() {
        return JumpNode.class;
    }

    @Override
    public NodeOutcome evaluate(JumpNode node, EvaluationContext context) {
        Optional<HubNode> hub = context.getFlow().findHub(node.getTargetHubId());
        Transition transition =
                hub.<Transition>map(h -> Transition.advance(h.getId()))
                        .orElseGet(
                                () ->
                                        Transition.failed(
                                                EvaluationError.missingTarget(
                                                        node.getId(),
                                                        "Jump "
                                                                + node.getId()
                                                                + " targets hub '"
                                                                + node.getTargetHubId()
                                                                + "' which does not exist")));
        return NodeOutcome.of(transition, context.getState().getVariables());
    }
}
