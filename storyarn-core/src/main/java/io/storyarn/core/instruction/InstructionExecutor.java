package io.storyarn.core.instruction;

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
import java.util.logging.Logger;

/// Applies ordered assignment lists to a {@link VariableStore}.
///
/// Assignments run strictly in list order and each one sees the writes of those before it,
/// including when it reads another variable by reference. An assignment that cannot be
/// applied (unknown variable, unsupported operator, unreadable value) is skipped and
/// reported; the remaining assignments still run.
///
/// ### Operator semantics
/// - `set` overwrites unconditionally
/// - `add` / `subtract` treat an unset number, or a missing operand, as `0`
/// - `set_if_unset` writes only when the current value is undefined or the type's default
/// - `toggle` flips a boolean
/// - `clear` sets text to the empty string
///
/// Results are clamped or truncated by the variable's
/// {@link io.storyarn.core.variable.VariableConstraints}.
///
/// @implNote Stateless and thread-safe. The input store is never modified.
public class InstructionExecutor {

    private static final Logger logger = Logger.getLogger(InstructionExecutor.class.getName());

    /// Executes `assignments` against `store`.
    ///
    /// @param assignments assignments in execution order, null is treated as empty
    /// @param store variables before the first assignment, not null
    /// @return the updated store with changes and errors, never null
    public InstructionResult execute(List<Assignment> assignments, VariableStore store) {
        VariableStore current = store;
        List<VariableChange> changes = new ArrayList<>();
        List<EvaluationError> errors = new ArrayList<>();
        if (assignments == null) {
            return new InstructionResult(current, changes, errors);
        }

        for (Assignment assignment : assignments) {
            Optional<Variable> target = current.find(assignment.key());
            if (target.isEmpty()) {
                skip(errors, EvaluationError.undefinedVariable(assignment.key().ref()));
                continue;
            }
            Variable variable = target.get();
            try {
                Value written = apply(assignment, variable, current);
                Value constrained = variable.constraints().apply(written);
                current = current.set(assignment.key(), constrained);
                changes.add(
                        new VariableChange(
                                assignment.key(),
                                variable.value(),
                                constrained,
                                assignment.operator()));
            } catch (AssignmentException e) {
                skip(errors, e.error);
            }
        }
        return new InstructionResult(current, changes, errors);
    }

    private static Value apply(Assignment assignment, Variable variable, VariableStore store)
            throws AssignmentException {
        VariableType type = variable.type();
        AssignmentOperator operator = assignment.operator();
        String reference = assignment.key().ref();
        Value old = variable.value();

        if (!operator.isSupportedBy(type)) {
            throw new AssignmentException(
                    EvaluationError.typeMismatch(
                            reference,
                            "Operator "
                                    + operator.wireName()
                                    + " cannot be applied to "
                                    + type.wireName()
                                    + " variables"));
        }

        switch (operator) {
            case SET_TRUE:
                return Value.bool(true);
            case SET_FALSE:
                return Value.bool(false);
            case TOGGLE:
                return Value.bool(!(old instanceof Value.BooleanValue b) || !b.value());
            case CLEAR:
                return Value.text("");
            case ADD:
            case SUBTRACT:
                BigDecimal base =
                        old.isDefined() ? ((Value.NumberValue) old).number() : BigDecimal.ZERO;
                Value resolved = resolve(assignment, type, store);
                BigDecimal operand =
                        !resolved.isDefined()
                                ? BigDecimal.ZERO
                                : Values.toNumber(resolved)
                                        .orElseThrow(
                                                () ->
                                                        new AssignmentException(
                                                                EvaluationError.typeMismatch(
                                                                        reference,
                                                                        "Value is not a number")));
                BigDecimal sum =
                        operator == AssignmentOperator.ADD
                                ? base.add(operand)
                                : base.subtract(operand);
                if (!Values.isWithinLimits(sum)) {
                    throw new AssignmentException(
                            EvaluationError.typeMismatch(
                                    reference,
                                    "Result exceeds " + Values.MAX_DIGITS + " digits"));
                }
                return Value.number(sum);
            case SET_IF_UNSET:
                if (old.isDefined() && !old.equals(type.defaultValue())) {
                    return old;
                }
                return resolve(assignment, type, store);
            case SET:
            default:
                return resolve(assignment, type, store);
        }
    }

    /// Reads the right-hand side as a value of `type`.
    private static Value resolve(Assignment assignment, VariableType type, VariableStore store)
            throws AssignmentException {
        String reference = assignment.key().ref();
        AssignmentValue value = assignment.value();

        if (value instanceof AssignmentValue.Reference ref) {
            Optional<Variable> source = store.find(ref.key());
            if (source.isEmpty()) {
                throw new AssignmentException(EvaluationError.undefinedVariable(ref.key().ref()));
            }
            return Values.coerce(source.get().value(), type)
                    .orElseThrow(
                            () ->
                                    new AssignmentException(
                                            EvaluationError.typeMismatch(
                                                    reference,
                                                    "Cannot assign "
                                                            + ref.key().ref()
                                                            + " to a "
                                                            + type.wireName()
                                                            + " variable")));
        }

        String raw = ((AssignmentValue.Literal) value).raw();
        return Values.parse(raw, type)
                .orElseThrow(
                        () ->
                                new AssignmentException(
                                        EvaluationError.typeMismatch(
                                                reference,
                                                "'"
                                                        + raw
                                                        + "' is not a valid "
                                                        + type.wireName()
                                                        + " value")));
    }

    private static void skip(List<EvaluationError> errors, EvaluationError error) {
        logger.warning("Assignment skipped: " + error);
        errors.add(error);
    }

    private static final class AssignmentException extends Exception {
        private static final long serialVersionUID = 1L;

        private final transient EvaluationError error;

        AssignmentException(EvaluationError error) {
            super(error.message(), null, false, false);
            this.error = error;
        }
    }
}
