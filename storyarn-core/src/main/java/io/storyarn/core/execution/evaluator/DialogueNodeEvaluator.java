package io.storyarn.core.execution.evaluator;

import io.storyarn.core.condition.ConditionResult;
import io.storyarn.core.error.EvaluationError;
import io.storyarn.core.execution.log.LogKind;
import io.storyarn.core.execution.transition.Transition;
import io.storyarn.core.flow.node.DialogueNode;
import io.storyarn.core.flow.node.Response;
import io.storyarn.core.instruction.InstructionResult;
import io.storyarn.core.state.ChoiceOption;
import io.storyarn.core.variable.VariableStore;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/// Shows a dialogue line and offers its responses.
///
/// ### Evaluation order
/// 1. The input condition is checked; failing it is logged but does not block
/// 2. The output instruction runs
/// 3. Each response's condition is evaluated against the updated variables
///
/// A dialogue without responses follows its `next` edge, or finishes when it has none.
/// With exactly one valid response and auto-selection enabled, that response is taken
/// at once; otherwise the evaluator returns {@link Transition.AwaitChoice} with every
/// response, valid or not.
///
/// @see #select(DialogueNode, Response, EvaluationContext, VariableStore) for what happens
/// when a response is chosen
public class DialogueNodeEvaluator implements NodeEvaluator<DialogueNode> {

    private static final Logger logger = Logger.getLogger(DialogueNodeEvaluator.class.getName());

    @Override
    public Class<DialogueNode> getNodeType() {
        return DialogueNode.class;
    }

    @Override
    public NodeOutcome evaluate(DialogueNode node, EvaluationContext context) {
        NodeOutcome.Builder outcome = NodeOutcome.builder(context.getState().getVariables());
        outcome.note(LogKind.INFO, describe(node));

        if (!node.getInputCondition().isEmpty()) {
            ConditionResult input =
                    context.getConditionEvaluator()
                            .evaluate(node.getInputCondition(), outcome.variables());
            warn(outcome, input.errors());
            if (!input.passed()) {
                outcome.note(LogKind.WARNING, "Input condition of " + node.getId() + " not met");
            }
        }

        if (!node.getOutputInstruction().isEmpty()) {
            InstructionResult result =
                    context.getInstructionExecutor()
                            .execute(node.getOutputInstruction(), outcome.variables());
            outcome.variables(result.store(), result.changes());
            warn(outcome, result.errors());
        }

        if (node.getResponses().isEmpty()) {
            if (node.getNext() == null || node.getNext().isBlank()) {
                outcome.note(LogKind.WARNING, "Dialogue " + node.getId() + " is a dead end");
                return outcome.build(
                        Transition.finished("Dialogue " + node.getId() + " has no way out"));
            }
            return outcome.build(Transition.advance(node.getNext()));
        }

        List<ChoiceOption> options = new ArrayList<>();
        for (Response response : node.getResponses()) {
            ConditionResult result =
                    context.getConditionEvaluator()
                            .evaluate(response.condition(), outcome.variables());
            warn(outcome, result.errors());
            options.add(
                    new ChoiceOption(
                            response.id(),
                            response.text(),
                            result.passed(),
                            response.target(),
                            result.ruleResults()));
        }

        List<ChoiceOption> valid = options.stream().filter(ChoiceOption::valid).toList();
        if (valid.size() == 1 && context.getConfig().isAutoSelectSingleChoice()) {
            Response only = node.findResponse(valid.get(0).id()).orElseThrow();
            outcome.note(LogKind.CHOICE, "Auto-selected \"" + only.text() + "\"");
            NodeOutcome selected = select(node, only, context, outcome.variables());
            outcome.variables(selected.variables(), selected.changes());
            selected.notes().forEach(n -> outcome.note(n.kind(), n.message()));
            return outcome.build(selected.transition());
        }
        return outcome.build(new Transition.AwaitChoice(options));
    }

    /// Applies a chosen response: runs its assignments, then advances along its edge.
    ///
    /// @param node the dialogue, not null
    /// @param response the chosen response, not null
    /// @param context evaluation services, not null
    /// @param variables variables before the response's assignments, not null
    /// @return the outcome, never null
    public NodeOutcome select(
            DialogueNode node,
            Response response,
            EvaluationContext context,
            VariableStore variables) {
        NodeOutcome.Builder outcome = NodeOutcome.builder(variables);
        if (!response.assignments().isEmpty()) {
            InstructionResult result =
                    context.getInstructionExecutor()
                            .execute(response.assignments(), outcome.variables());
            outcome.variables(result.store(), result.changes());
            warn(outcome, result.errors());
        }
        if (response.target() == null || response.target().isBlank()) {
            logger.fine("Response " + response.id() + " of " + node.getId() + " is not connected");
            outcome.note(
                    LogKind.WARNING,
                    "Response '" + response.id() + "' of " + node.getId() + " is not connected");
            return outcome.build(
                    Transition.finished("Response '" + response.id() + "' leads nowhere"));
        }
        return outcome.build(Transition.advance(response.target()));
    }

    private static String describe(DialogueNode node) {
        String speaker = node.getSpeaker() != null ? node.getSpeaker() + ": " : "";
        return speaker + "\"" + node.getText() + "\"";
    }

    private static void warn(NodeOutcome.Builder outcome, List<EvaluationError> errors) {
        for (EvaluationError error : errors) {
            outcome.note(LogKind.WARNING, error.toString());
        }
    }
}
