package io.storyarn.core.execution.evaluator;

import io.storyarn.core.flow.node.Node;
import java.util.Optional;

/// Registry for node evaluators.
///
/// Provides type-safe lookup of evaluators by node class. Registering an evaluator for a node
/// class that already has one replaces it.
public interface NodeEvaluatorRegistry {

    /// Get evaluator for the given node type.
    ///
    /// @param nodeType The node class
    /// @param <T> The node type
    /// @return Optional containing the evaluator if found
    <T extends Node> Optional<NodeEvaluator<T>> getEvaluator(Class<T> nodeType);

    /// Get evaluator for the given node type, throwing if not found.
    ///
    /// @param nodeType The node class
    /// @param <T> The node type
    /// @return The evaluator
    /// @throws NodeEvaluatorNotFound if no evaluator is registered
    <T extends Node> NodeEvaluator<T> getEvaluatorOrThrow(Class<T> nodeType);

    /// Get evaluator for the given node instance.
    ///
    /// @param node The node instance
    /// @param <T> The node type
    /// @return The evaluator
    /// @throws NodeEvaluatorNotFound if no evaluator is registered
    @SuppressWarnings("unchecked")
    default <T extends Node> NodeEvaluator<T> getEvaluatorFor(T node) {
        return (NodeEvaluator<T>) getEvaluatorOrThrow(node.getClass());
    }

    <T extends Node> void register(NodeEvaluator<T> evaluator);

    boolean hasEvaluator(Class<? extends Node> nodeType);
}
