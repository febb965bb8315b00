package io.storyarn.core.condition;

/// Element of a condition tree.
///
/// The tree is at most three levels deep: top level, then {@link Group}, then {@link Block},
/// then {@link Rule}. Groups cannot contain groups.
///
/// ### Permitted Subtypes
/// - {@link Rule} - leaf comparison of one variable
/// - {@link Block} - logic over rules
/// - {@link Group} - logic over blocks
///
/// @see ConditionTree for the top-level container
/// @see ConditionEvaluator for evaluation
public sealed interface Condition permits Rule, Block, Group {

    /// Returns the authoring id, used to attribute evaluation results.
    ///
    /// @return id, may be null for documents that carry none
    String id();
}
