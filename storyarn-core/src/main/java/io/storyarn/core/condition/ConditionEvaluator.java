package io.storyarn.core.condition;

import io.storyarn.core.error.EvaluationError;
import io.storyarn.core.variable.Value;
import io.storyarn.core.variable.Values;
import io.storyarn.core.variable.Variable;
import io.storyarn.core.variable.VariableStore;
import io.storyarn.core.variable.VariableType;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Evaluates condition trees against a {@link VariableStore}.
///
/// Groups and blocks fold their children with their {@link Logic}, stopping at the first
/// conclusive child. Children with nothing to evaluate (an empty block or group) are ignored,
/// so a tree without any rule passes.
///
/// ### Rule semantics
/// - Undeclared variables read as undefined and are reported as
///   {@link io.storyarn.core.error.ErrorKind#UNDEFINED_VARIABLE_REFERENCE}
/// - Undefined values satisfy only `is_empty` and `is_nil`
/// - An operator the variable's type does not support, or a literal that cannot be read as
///   that type, is reported as {@link io.storyarn.core.error.ErrorKind#TYPE_MISMATCH} and
///   the rule evaluates to false
///
/// None of these problems stop evaluation.
///
/// @implNote Stateless and thread-safe. Evaluation never modifies the store.
public class ConditionEvaluator {

    private static final Logger logger = Logger.getLogger(ConditionEvaluator.class.getName());

    /// Evaluates `tree` and returns per-rule detail.
    ///
    /// @param tree condition to evaluate, null is treated as {@link ConditionTree#EMPTY}
    /// @param store variables to read, not null
    /// @return result with overall outcome, rule detail and errors, never null
    public ConditionResult evaluate(ConditionTree tree, VariableStore store) {
        if (tree == null || tree.isEmpty()) {
            return ConditionResult.pass();
        }
        Evaluation evaluation = new Evaluation(store);
        boolean passed = evaluation.fold(tree.logic(), tree.children());
        return new ConditionResult(passed, evaluation.ruleResults, evaluation.errors);
    }

    /// Evaluates `tree` and returns only the outcome.
    ///
    /// @param tree condition to evaluate, may be null
    /// @param store variables to read, not null
    /// @return true if the condition holds
    public boolean test(ConditionTree tree, VariableStore store) {
        return evaluate(tree, store).passed();
    }

    private static final class Evaluation {
        private final VariableStore store;
        private final List<RuleResult> ruleResults = new ArrayList<>();
        private final List<EvaluationError> errors = new ArrayList<>();

        Evaluation(VariableStore store) {
            this.store = store;
        }

        boolean fold(Logic logic, List<? extends Condition> children) {
            boolean evaluatedAny = false;
            for (Condition child : children) {
                if (isVacuous(child)) {
                    continue;
                }
                evaluatedAny = true;
                boolean result = evaluate(child);
                if (logic == Logic.ALL && !result) return false;
                if (logic == Logic.ANY && result) return true;
            }
            return logic == Logic.ALL || !evaluatedAny;
        }

        private boolean evaluate(Condition condition) {
            if (condition instanceof Rule rule) {
                return evaluateRule(rule);
            }
            if (condition instanceof Block block) {
                return fold(block.logic(), block.rules());
            }
            Group group = (Group) condition;
            return fold(group.logic(), group.blocks());
        }

        private static boolean isVacuous(Condition condition) {
            if (condition instanceof Block block) {
                return block.rules().isEmpty();
            }
            if (condition instanceof Group group) {
                return group.blocks().stream().allMatch(b -> b.rules().isEmpty());
            }
            return false;
        }

        private boolean evaluateRule(Rule rule) {
            String reference = rule.key().ref();
            Optional<Variable> declared = store.find(rule.key());

            if (declared.isEmpty()) {
                ConditionOperator operator =
                        rule.operator() != null ? rule.operator() : ConditionOperator.EQUALS;
                report(EvaluationError.undefinedVariable(reference));
                return record(rule, reference, operator, Value.UNDEFINED, isNilCheck(operator));
            }

            Variable variable = declared.get();
            VariableType type = variable.type();
            ConditionOperator operator = rule.effectiveOperator(type);
            Value actual = variable.value();

            if (!operator.isSupportedBy(type)) {
                report(
                        EvaluationError.typeMismatch(
                                reference,
                                "Operator "
                                        + operator.wireName()
                                        + " is not supported for "
                                        + type.wireName()
                                        + " variables"));
                return record(rule, reference, operator, actual, false);
            }
            if (!actual.isDefined()) {
                return record(rule, reference, operator, actual, isNilCheck(operator));
            }
            if (operator == ConditionOperator.IS_NIL) {
                return record(rule, reference, operator, actual, false);
            }

            Optional<Boolean> outcome = compare(type, operator, actual, rule.value());
            if (outcome.isEmpty()) {
                report(
                        EvaluationError.typeMismatch(
                                reference,
                                "Cannot compare "
                                        + type.wireName()
                                        + " variable with '"
                                        + rule.value()
                                        + "'"));
                return record(rule, reference, operator, actual, false);
            }
            return record(rule, reference, operator, actual, outcome.get());
        }

        private boolean record(
                Rule rule,
                String reference,
                ConditionOperator operator,
                Value actual,
                boolean passed) {
            ruleResults.add(
                    new RuleResult(rule.id(), reference, operator, rule.value(), actual, passed));
            return passed;
        }

        private void report(EvaluationError error) {
            logger.warning("Condition evaluation: " + error);
            errors.add(error);
        }

        private static boolean isNilCheck(ConditionOperator operator) {
            return operator == ConditionOperator.IS_NIL || operator == ConditionOperator.IS_EMPTY;
        }
    }

    /// Applies a supported operator to a defined value.
    ///
    /// @return the outcome, or empty when the literal cannot be read for this type
    private static Optional<Boolean> compare(
            VariableType type, ConditionOperator operator, Value actual, String literal) {
        switch (type) {
            case NUMBER:
                return compareNumber(operator, ((Value.NumberValue) actual).number(), literal);
            case TEXT:
                String text = ((Value.TextValue) actual).text();
                return Optional.of(compareText(operator, text, literal));
            case BOOLEAN:
                boolean flag = ((Value.BooleanValue) actual).value();
                return Optional.of(operator == ConditionOperator.IS_TRUE ? flag : !flag);
            case SELECT:
                if (literal == null) return Optional.empty();
                boolean same = ((Value.SelectValue) actual).key().equals(literal);
                return Optional.of(operator == ConditionOperator.EQUALS ? same : !same);
            case MULTI_SELECT:
                return compareMultiSelect(
                        operator, ((Value.MultiSelectValue) actual).keys(), literal);
            case DATE:
                return Values.parseDate(literal)
                        .map(
                                expected -> {
                                    int cmp =
                                            ((Value.DateValue) actual).date().compareTo(expected);
                                    switch (operator) {
                                        case EQUALS:
                                            return cmp == 0;
                                        case NOT_EQUALS:
                                            return cmp != 0;
                                        case BEFORE:
                                            return cmp < 0;
                                        default:
                                            return cmp > 0;
                                    }
                                });
            default:
                return Optional.empty();
        }
    }

    private static Optional<Boolean> compareNumber(
            ConditionOperator operator, BigDecimal actual, String literal) {
        return Values.parseNumber(literal)
                .map(
                        expected -> {
                            int cmp = actual.compareTo(expected);
                            switch (operator) {
                                case EQUALS:
                                    return cmp == 0;
                                case NOT_EQUALS:
                                    return cmp != 0;
                                case GREATER_THAN:
                                    return cmp > 0;
                                case GREATER_THAN_OR_EQUAL:
                                    return cmp >= 0;
                                case LESS_THAN:
                                    return cmp < 0;
                                default:
                                    return cmp <= 0;
                            }
                        });
    }

    private static boolean compareText(ConditionOperator operator, String actual, String literal) {
        String expected = literal != null ? literal : "";
        switch (operator) {
            case EQUALS:
                return actual.equals(expected);
            case NOT_EQUALS:
                return !actual.equals(expected);
            case CONTAINS:
                return !expected.isEmpty() && actual.contains(expected);
            case STARTS_WITH:
                return actual.startsWith(expected);
            case ENDS_WITH:
                return actual.endsWith(expected);
            default:
                return actual.isEmpty();
        }
    }

    private static Optional<Boolean> compareMultiSelect(
            ConditionOperator operator, Set<String> keys, String literal) {
        if (operator == ConditionOperator.IS_EMPTY) {
            return Optional.of(keys.isEmpty());
        }
        if (literal == null) {
            return Optional.empty();
        }
        boolean present = keys.contains(literal.trim());
        return Optional.of(operator == ConditionOperator.CONTAINS ? present : !present);
    }
}
