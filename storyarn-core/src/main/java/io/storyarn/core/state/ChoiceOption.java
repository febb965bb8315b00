package io.storyarn.core.state;

import io.storyarn.core.condition.RuleResult;
import java.util.List;
import java.util.Objects;

/// A response as offered to the player, with the outcome of its condition.
///
/// Invalid options are kept so a debugger can show why they are unavailable.
///
/// @param id response id, not null
/// @param text response text, not null
/// @param valid whether the response's condition passed
/// @param targetNodeId node reached when selected, may be null
/// @param ruleResults how the condition was evaluated, not null
public record ChoiceOption(
        String id, String text, boolean valid, String targetNodeId, List<RuleResult> ruleResults) {

    public ChoiceOption {
        Objects.requireNonNull(id, "id must not be null");
        text = text != null ? text : "";
        ruleResults = ruleResults != null ? List.copyOf(ruleResults) : List.of();
    }
}
