package io.storyarn.core.condition;

import io.storyarn.core.variable.Value;

/// What a single rule compared and whether it passed.
///
/// @param ruleId authoring id of the rule, may be null
/// @param reference `sheet.variable` reference, not null
/// @param operator operator actually applied, not null
/// @param expected authored literal, may be null
/// @param actual value read from the store, {@link Value#UNDEFINED} if missing
/// @param passed comparison outcome
public record RuleResult(
        String ruleId,
        String reference,
        ConditionOperator operator,
        String expected,
        Value actual,
        boolean passed) {}
