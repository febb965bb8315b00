package io.storyarn.core.condition;

import io.storyarn.core.error.EvaluationError;
import java.util.List;

/// Outcome of evaluating a {@link ConditionTree}.
///
/// `ruleResults` lists the rules in the order they were evaluated; rules skipped by
/// short-circuiting are absent.
///
/// @param passed overall result
/// @param ruleResults per-rule detail, not null
/// @param errors recoverable problems met during evaluation, not null
public record ConditionResult(
        boolean passed, List<RuleResult> ruleResults, List<EvaluationError> errors) {

    public ConditionResult {
        ruleResults = List.copyOf(ruleResults);
        errors = List.copyOf(errors);
    }

    public static ConditionResult pass() {
        return new ConditionResult(true, List.of(), List.of());
    }
}
