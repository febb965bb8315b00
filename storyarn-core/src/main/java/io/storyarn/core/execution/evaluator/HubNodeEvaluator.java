package io.storyarn.core.execution.evaluator;

import io.storyarn.core.flow.node.HubNode;

/// Passes through a hub to its outgoing edge.
public class HubNodeEvaluator implements NodeEvaluator<HubNode> {

    @Override
    public Class<HubNode> getNodeType() {
        return HubNode.class;
    }

    @Override
    public NodeOutcome evaluate(HubNode node, EvaluationContext context) {
        return NodeOutcome.of(
                Edges.follow(node, node.getNext()), context.getState().getVariables());
    }
}
