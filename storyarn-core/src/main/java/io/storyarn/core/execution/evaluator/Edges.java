package io.storyarn.core.execution.evaluator;

import io.storyarn.core.error.EvaluationError;
import io.storyarn.core.execution.transition.Transition;
import io.storyarn.core.flow.node.Node;

final class Edges {

    private Edges() {}

    /// Follows a single outgoing edge, failing when the node is not connected.
    static Transition follow(Node node, String next) {
        if (next == null || next.isBlank()) {
            return Transition.failed(
                    EvaluationError.missingTarget(
                            node.getId(),
                            node.getNodeType().wireName()
                                    + " node "
                                    + node.getId()
                                    + " has no outgoing connection"));
        }
        return Transition.advance(next);
    }
}
