package io.storyarn.core.execution.evaluator;

import io.storyarn.core.flow.node.EntryNode;

/// Advances from the entry node to its single outgoing edge.
public class EntryNodeEvaluator implements NodeEvaluator<EntryNode> {

    @Override
    public Class<EntryNode> getNodeType() {
        return EntryNode.class;
    }

    @Override
    public NodeOutcome evaluate(EntryNode node, EvaluationContext context) {
        return NodeOutcome.of(
                Edges.follow(node, node.getNext()), context.getState().getVariables());
    }
}
