package io.storyarn.core.execution.evaluator;

import java.io.Serial;

public class NodeEvaluatorNotFound extends RuntimeException {
    @Serial private static final long serialVersionUID = 3390275518742265015L;

    public NodeEvaluatorNotFound(String message) {
        super(message);
    }
}
