package io.storyarn.core.execution.evaluator;

import io.storyarn.core.flow.node.Node;

/// Transition function for one node type.
///
/// Each node type has a corresponding evaluator. Evaluators are pure: they read the
/// {@link EvaluationContext}, compute new variables and a {@link
/// io.storyarn.core.execution.transition.Transition}, and leave the execution state to the
/// engine.
///
/// Implementations should be stateless and thread-safe.
///
/// @param <T> the specific node type this evaluator handles
public interface NodeEvaluator<T extends Node> {

    /// Returns the node type this evaluator handles. Used for type-safe registry lookups.
    ///
    /// @return the Class of the node type
    Class<T> getNodeType();

    /// Evaluates `node` in `context`.
    ///
    /// Recoverable problems are reported as notes on the outcome; structural ones as a
    /// {@link io.storyarn.core.execution.transition.Transition.Failed} transition.
    ///
    /// @param node the node to evaluate
    /// @param context state and services
    /// @return the outcome, never null
    NodeOutcome evaluate(T node, EvaluationContext context);
}
