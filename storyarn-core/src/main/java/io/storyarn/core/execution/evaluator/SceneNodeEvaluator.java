package io.storyarn.core.execution.evaluator;

import io.storyarn.core.execution.log.LogKind;
import io.storyarn.core.flow.node.SceneNode;

/// Records the scene location and passes through.
public class SceneNodeEvaluator implements NodeEvaluator<SceneNode> {

    @Override
    public Class<SceneNode> getNodeType() {
        return SceneNode.class;
    }

    @Override
    public NodeOutcome evaluate(SceneNode node, EvaluationContext context) {
        NodeOutcome.Builder outcome = NodeOutcome.builder(context.getState().getVariables());
        if (node.getLocation() != null && !node.getLocation().isBlank()) {
            outcome.note(LogKind.INFO, "Scene: " + node.getLocation());
        }
        return outcome.build(Edges.follow(node, node.getNext()));
    }
}
