package io.storyarn.core.execution.evaluator;

import static org.assertj.core.api.Assertions.assertThat;

import io.storyarn.core.condition.ConditionOperator;
import io.storyarn.core.condition.ConditionTree;
import io.storyarn.core.condition.Rule;
import io.storyarn.core.error.ErrorKind;
import io.storyarn.core.execution.transition.Transition;
import io.storyarn.core.flow.Flow;
import io.storyarn.core.flow.node.ConditionNode;
import io.storyarn.core.flow.node.SwitchCase;
import io.storyarn.core.state.ExecutionState;
import io.storyarn.core.variable.Value;
import io.storyarn.core.variable.Variable;
import io.storyarn.core.variable.VariableStore;
import io.storyarn.core.variable.VariableType;
import org.junit.jupiter.api.Test;

class ConditionNodeEvaluatorTest {

    private final ConditionNodeEvaluator evaluator = new ConditionNodeEvaluator();

    private final EvaluationContext context =
            EvaluationContext.builder()
                    .state(
                            ExecutionState.builder()
                                    .flowId("f")
                                    .currentNodeId("c")
                                    .variables(
                                            VariableStore.of(
                                                    Variable.of(
                                                            "mc.jaime.class",
                                                            VariableType.SELECT,
                                                            Value.select("rogue"))))
                                    .build())
                    .flow(Flow.builder().id("f").build())
                    .build();

    private static ConditionTree classIs(String value) {
        return ConditionTree.single(Rule.of("mc.jaime.class", ConditionOperator.EQUALS, value));
    }

    @Test
    void shouldTakeDefaultWhenNoCaseMatches() {
        // Given
        ConditionNode node =
                ConditionNode.builder()
                        .id("c")
                        .switchCase(SwitchCase.of("warrior", classIs("warrior"), "w"))
                        .switchCase(SwitchCase.of("mage", classIs("mage"), "m"))
                        .defaultTarget("other")
                        .build();

        // When
        Transition transition = evaluator.evaluate(node, context).transition();

        // Then
        assertThat(transition).isEqualTo(Transition.advance("other"));
    }

    @Test
    void shouldFailWhenNoCaseMatchesAndNoDefault() {
        // Given
        ConditionNode node =
                ConditionNode.builder()
                        .id("c")
                        .switchCase(SwitchCase.of("warrior", classIs("warrior"), "w"))
                        .build();

        // When
        Transition transition = evaluator.evaluate(node, context).transition();

        // Then
        assertThat(transition).isInstanceOf(Transition.Failed.class);
        assertThat(((Transition.Failed) transition).error().kind())
                .isEqualTo(ErrorKind.MISSING_TARGET_NODE);
    }

    @Test
    void shouldFailUnconnectedBooleanBranch() {
        // Given
        ConditionNode node =
                ConditionNode.builder()
                        .id("c")
                        .condition(classIs("rogue"))
                        .falseTarget("f")
                        .build();

        // When
        Transition transition = evaluator.evaluate(node, context).transition();

        // Then
        assertThat(transition).isInstanceOf(Transition.Failed.class);
    }
}
