package io.storyarn.core.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.storyarn.core.condition.ConditionOperator;
import io.storyarn.core.condition.ConditionTree;
import io.storyarn.core.condition.Rule;
import io.storyarn.core.flow.Flow;
import io.storyarn.core.flow.InMemoryFlowRepository;
import io.storyarn.core.flow.node.ConditionNode;
import io.storyarn.core.flow.node.DialogueNode;
import io.storyarn.core.flow.node.EntryNode;
import io.storyarn.core.flow.node.ExitNode;
import io.storyarn.core.flow.node.InstructionNode;
import io.storyarn.core.flow.node.JumpNode;
import io.storyarn.core.flow.node.SceneNode;
import io.storyarn.core.flow.node.SubflowNode;
import io.storyarn.core.instruction.Assignment;
import io.storyarn.core.instruction.AssignmentOperator;
import io.storyarn.core.variable.Value;
import io.storyarn.core.variable.Variable;
import io.storyarn.core.variable.VariableStore;
import io.storyarn.core.variable.VariableType;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FlowValidatorTest {

    private final FlowValidator validator = new FlowValidator();

    private static Flow.Builder withEntry(String id, String next) {
        return Flow.builder().id(id).node(EntryNode.builder().id("entry").next(next).build());
    }

    private static SubflowNode call(String targetFlowId) {
        return SubflowNode.builder().id("call").targetFlowId(targetFlowId).next("end").build();
    }

    private static ExitNode end() {
        return ExitNode.builder().id("end").build();
    }

    @Test
    void shouldAcceptWellFormedFlow() {
        // Given
        Flow flow =
                withEntry("f", "scene")
                        .node(SceneNode.builder().id("scene").location("Inn").next("end").build())
                        .node(end())
                        .build();

        // Then
        assertThat(validator.validate(InMemoryFlowRepository.of(flow))).isEmpty();
    }

    @Nested
    class Errors {

        @Test
        void shouldReportMissingAndDuplicateEntries() {
            // Given
            Flow none = Flow.builder().id("a").node(end()).build();
            Flow two =
                    withEntry("b", "end")
                            .node(EntryNode.builder().id("entry2").next("end").build())
                            .node(end())
                            .build();

            // When
            List<ValidationIssue> issues =
                    validator.validate(InMemoryFlowRepository.of(none, two));

            // Then
            assertThat(issues)
                    .filteredOn(ValidationIssue::isError)
                    .extracting(ValidationIssue::flowId, ValidationIssue::message)
                    .containsExactly(
                            tuple("a", "Flow \"a\" has no entry node"),
                            tuple("b", "Flow \"b\" has 2 entry nodes"));
        }

        @Test
        void shouldReportBrokenEdgesHubsAndFlows() {
            // Given
            Flow flow =
                    withEntry("f", "branch")
                            .node(
                                    ConditionNode.builder()
                                            .id("branch")
                                            .condition(ConditionTree.EMPTY)
                                            .trueTarget("jump")
                                            .falseTarget("ghost")
                                            .build())
                            .node(JumpNode.builder().id("jump").targetHubId("camp").build())
                            .node(SubflowNode.builder().id("call").targetFlowId("missing").build())
                            .build();

            // When
            List<ValidationIssue> issues = validator.validate(InMemoryFlowRepository.of(flow));

            // Then
            assertThat(issues)
                    .filteredOn(ValidationIssue::isError)
                    .extracting(ValidationIssue::nodeId, ValidationIssue::message)
                    .containsExactly(
                            tuple("branch", "Connects to unknown node ghost"),
                            tuple("jump", "Jump targets unknown hub 'camp'"),
                            tuple("call", "Calls unknown flow missing"));
        }
    }

    @Nested
    class Warnings {

        @Test
        void shouldReportUnreachableNodesAndEmptyDialogue() {
            // Given
            Flow flow =
                    withEntry("f", "talk")
                            .node(DialogueNode.builder().id("talk").next("end").build())
                            .node(end())
                            .node(SceneNode.builder().id("island").next("end").build())
                            .build();

            // When
            List<ValidationIssue> issues = validator.validate(InMemoryFlowRepository.of(flow));

            // Then
            assertThat(issues).allMatch(i -> i.severity() == Severity.WARNING);
            assertThat(issues)
                    .extracting(ValidationIssue::nodeId, ValidationIssue::message)
                    .containsExactly(
                            tuple("island", "Not reachable from the entry node"),
                            tuple("talk", "Dialogue has no text"));
        }

        @Test
        void shouldReportCircularSubflows() {
            // Given
            Flow a = withEntry("a", "call").node(call("b")).node(end()).build();
            Flow b = withEntry("b", "call").node(call("a")).node(end()).build();

            // When
            List<ValidationIssue> issues = validator.validate(InMemoryFlowRepository.of(a, b));

            // Then
            assertThat(issues)
                    .extracting(ValidationIssue::message)
                    .containsExactly(
                            "Circular subflow chain: a -> b -> a",
                            "Circular subflow chain: b -> a -> b");
        }

        @Test
        void shouldReportUnknownVariablesWhenStoreGiven() {
            // Given
            InstructionNode set =
                    InstructionNode.builder()
                            .id("set")
                            .assignment(
                                    Assignment.of("mc.jaime.health", AssignmentOperator.SET, "10"))
                            .assignment(
                                    Assignment.ofReference(
                                            "mc.jaime.health",
                                            AssignmentOperator.SET,
                                            "mc.jaime.mana"))
                            .next("check")
                            .build();
            ConditionNode check =
                    ConditionNode.builder()
                            .id("check")
                            .condition(
                                    ConditionTree.single(
                                            Rule.of(
                                                    "global.quest",
                                                    ConditionOperator.IS_NIL,
                                                    null)))
                            .trueTarget("end")
                            .falseTarget("end")
                            .build();
            Flow flow = withEntry("f", "set").node(set).node(check).node(end()).build();
            VariableStore variables =
                    VariableStore.of(
                            Variable.of("mc.jaime.health", VariableType.NUMBER, Value.number(1)));

            // When
            List<ValidationIssue> issues =
                    validator.validate(InMemoryFlowRepository.of(flow), variables);

            // Then
            assertThat(issues)
                    .extracting(ValidationIssue::message)
                    .containsExactly(
                            "References unknown variable mc.jaime.mana",
                            "References unknown variable global.quest");
            assertThat(validator.validate(InMemoryFlowRepository.of(flow))).isEmpty();
        }
    }
}
