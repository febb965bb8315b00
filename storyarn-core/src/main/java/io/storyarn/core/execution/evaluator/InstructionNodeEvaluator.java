package io.storyarn.core.execution.evaluator;

import io.storyarn.core.error.EvaluationError;
import io.storyarn.core.execution.log.LogKind;
import io.storyarn.core.flow.node.InstructionNode;
import io.storyarn.core.instruction.InstructionResult;

/// Runs the node's assignments, then advances to its outgoing edge.
///
/// Skipped assignments are logged as warnings; the node still advances.
public class InstructionNodeEvaluator implements NodeEvaluator<InstructionNode> {

    @Override
    public Class<InstructionNode> getNodeType() {
        return InstructionNode.class;
    }

    @Override
    public NodeOutcome evaluate(InstructionNode node, EvaluationContext context) {
        NodeOutcome.Builder outcome = NodeOutcome.builder(context.getState().getVariables());
        InstructionResult result =
                context.getInstructionExecutor()
                        .execute(node.getAssignments(), outcome.variables());
        outcome.variables(result.store(), result.changes());
        for (EvaluationError error : result.errors()) {
            outcome.note(LogKind.WARNING, error.toString());
        }
        return outcome.build(Edges.follow(node, node.getNext()));
    }
}
