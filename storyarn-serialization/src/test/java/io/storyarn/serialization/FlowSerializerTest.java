package io.storyarn.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.storyarn.core.condition.Block;
import io.storyarn.core.condition.ConditionOperator;
import io.storyarn.core.condition.ConditionTree;
import io.storyarn.core.condition.Group;
import io.storyarn.core.condition.Logic;
import io.storyarn.core.condition.Rule;
import io.storyarn.core.flow.Flow;
import io.storyarn.core.flow.node.ConditionNode;
import io.storyarn.core.flow.node.DialogueNode;
import io.storyarn.core.flow.node.EntryNode;
import io.storyarn.core.flow.node.ExitMode;
import io.storyarn.core.flow.node.ExitNode;
import io.storyarn.core.flow.node.HubNode;
import io.storyarn.core.flow.node.InstructionNode;
import io.storyarn.core.flow.node.JumpNode;
import io.storyarn.core.flow.node.Response;
import io.storyarn.core.flow.node.SceneNode;
import io.storyarn.core.flow.node.SubflowNode;
import io.storyarn.core.flow.node.SwitchCase;
import io.storyarn.core.instruction.Assignment;
import io.storyarn.core.instruction.AssignmentOperator;
import io.storyarn.core.instruction.AssignmentValue;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FlowSerializerTest {

    @Nested
    class RoundTrip {

        @Test
        void shouldKeepNodeOrderAndTypes() {
            // Given
            Flow original = fullFlow();

            // When
            Flow restored = FlowSerializer.fromJson(FlowSerializer.toJson(original));

            // Then
            assertThat(restored.getId()).isEqualTo("main");
            assertThat(restored.getName()).isEqualTo("Main Flow");
            assertThat(restored.getNodes().keySet())
                    .containsExactly(
                            "entry", "intro", "branch", "reward", "hub", "jump", "scene", "call",
                            "end");
            assertThat(FlowSerializer.toJson(restored))
                    .isEqualTo(FlowSerializer.toJson(original));
        }

        @Test
        void shouldRestoreDialogueResponses() {
            // Given
            Flow restored = FlowSerializer.fromJson(FlowSerializer.toJson(fullFlow()));

            // When
            DialogueNode intro = (DialogueNode) restored.getNodes().get("intro");

            // Then
            assertThat(intro.getSpeaker()).isEqualTo("mc.jaime");
            assertThat(intro.getResponses()).hasSize(2);
            Response brave = intro.getResponses().get(0);
            assertThat(brave.condition().rules())
                    .extracting(Rule::operator)
                    .containsExactly(ConditionOperator.GREATER_THAN);
            assertThat(brave.assignments()).hasSize(1);
            assertThat(intro.getOutputInstruction().get(0).value())
                    .isInstanceOf(AssignmentValue.Reference.class);
        }

        @Test
        void shouldRestoreSwitchCasesAndGroups() {
            // Given
            Flow restored = FlowSerializer.fromJson(FlowSerializer.toJson(fullFlow()));

            // When
            ConditionNode branch = (ConditionNode) restored.getNodes().get("branch");

            // Then
            assertThat(branch.isSwitchMode()).isTrue();
            assertThat(branch.getCases()).extracting(SwitchCase::id).containsExactly("c1", "c2");
            assertThat(branch.getCases().get(1).condition().children().get(0))
                    .isInstanceOf(Group.class);
            assertThat(branch.getDefaultTarget()).isEqualTo("end");
        }

        @Test
        void shouldOmitEmptyConditionsAndNullTargets() {
            // Given
            Flow flow =
                    Flow.builder()
                            .id("tiny")
                            .node(EntryNode.builder().id("entry").build())
                            .build();

            // When
            String json = FlowSerializer.toJson(flow);

            // Then
            assertThat(json).contains("\"type\" : \"entry\"");
            assertThat(json).doesNotContain("next").doesNotContain("entryNodes");
        }
    }

    @Nested
    class AuthoredDocuments {

        @Test
        void shouldUpgradeLegacyRuleListCondition() {
            // Given
            String json =
                    """
                    {"id": "f", "nodes": [
                      {"id": "entry", "type": "entry", "next": "check"},
                      {"id": "check", "type": "condition",
                       "condition": {"logic": "any", "rules": [
                         {"sheet": "mc.jaime", "variable": "health",
                          "operator": "less_than", "value": "10"},
                         {"sheet": "mc.jaime", "variable": "poisoned",
                          "operator": "is_true"}
                       ]},
                       "true_target": "entry", "false_target": "entry"}
                    ]}
                    """;

            // When
            Flow flow = FlowSerializer.fromJson(json);

            // Then
            ConditionNode check = (ConditionNode) flow.getNodes().get("check");
            assertThat(check.isSwitchMode()).isFalse();
            assertThat(check.getCondition().logic()).isEqualTo(Logic.ANY);
            assertThat(check.getCondition().rules()).hasSize(2);
        }

        @Test
        void shouldReadConditionStoredAsString() {
            // Given
            String condition =
                    "{\\\"logic\\\":\\\"all\\\",\\\"rules\\\":[{\\\"sheet\\\":\\\"a\\\","
                            + "\\\"variable\\\":\\\"b\\\",\\\"operator\\\":\\\"is_true\\\"}]}";
            String json =
                    "{\"id\": \"f\", \"nodes\": [{\"id\": \"check\", \"type\": \"condition\","
                            + " \"condition\": \""
                            + condition
                            + "\"}]}";

            // When
            Flow flow = FlowSerializer.fromJson(json);

            // Then
            ConditionNode check = (ConditionNode) flow.getNodes().get("check");
            assertThat(check.getCondition().rules()).singleElement().isEqualTo(rule("a.b"));
        }

        @Test
        void shouldDropIncompleteRules() {
            // Given
            String json =
                    """
                    {"id": "f", "nodes": [
                      {"id": "check", "type": "condition",
                       "condition": {"logic": "all", "rules": [
                         {"sheet": "a", "operator": "is_true"},
                         {"sheet": "a", "variable": "b", "operator": "is_true"}
                       ]}}
                    ]}
                    """;

            // When
            Flow flow = FlowSerializer.fromJson(json);

            // Then
            ConditionNode check = (ConditionNode) flow.getNodes().get("check");
            assertThat(check.getCondition().rules()).hasSize(1);
        }

        @Test
        void shouldIgnoreEditorOnlyFields() {
            // Given
            String json =
                    """
                    {"id": "f", "position": {"x": 10}, "nodes": [
                      {"id": "entry", "type": "entry", "color": "#fff"}
                    ]}
                    """;

            // When
            Flow flow = FlowSerializer.fromJson(json);

            // Then
            assertThat(flow.getNodes()).containsOnlyKeys("entry");
        }

        @Test
        void shouldDefaultExitModeToTerminal() {
            // Given
            String json = "{\"id\": \"f\", \"nodes\": [{\"id\": \"x\", \"type\": \"exit\"}]}";

            // When
            Flow flow = FlowSerializer.fromJson(json);

            // Then
            assertThat(((ExitNode) flow.getNodes().get("x")).getMode())
                    .isEqualTo(ExitMode.TERMINAL);
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldRejectUnknownNodeType() {
            String json = "{\"id\": \"f\", \"nodes\": [{\"id\": \"x\", \"type\": \"teleport\"}]}";

            assertThatThrownBy(() -> FlowSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unknown node type: teleport");
        }

        @Test
        void shouldRejectUnknownOperator() {
            String json =
                    """
                    {"id": "f", "nodes": [
                      {"id": "i", "type": "instruction", "assignments": [
                        {"sheet": "a", "variable": "b", "operator": "multiply", "value": "2"}
                      ]}
                    ]}
                    """;

            assertThatThrownBy(() -> FlowSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("multiply");
        }

        @Test
        void shouldRejectDuplicateNodeIds() {
            String json =
                    """
                    {"id": "f", "nodes": [
                      {"id": "x", "type": "entry"},
                      {"id": "x", "type": "scene"}
                    ]}
                    """;

            assertThatThrownBy(() -> FlowSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Duplicate node id");
        }

        @Test
        void shouldRejectNodeWithoutId() {
            String json = "{\"id\": \"f\", \"nodes\": [{\"type\": \"entry\"}]}";

            assertThatThrownBy(() -> FlowSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("\"id\"");
        }
    }

    private static Rule rule(String reference) {
        return Rule.of(reference, ConditionOperator.IS_TRUE, null);
    }

    private static Assignment gold(int amount) {
        return Assignment.of("mc.jaime.gold", AssignmentOperator.ADD, String.valueOf(amount));
    }

    private static Flow fullFlow() {
        ConditionTree braveEnough =
                ConditionTree.single(
                        Rule.of("mc.jaime.courage", ConditionOperator.GREATER_THAN, "5"));
        ConditionTree nested =
                ConditionTree.of(
                        Logic.ANY,
                        new Group(
                                "g1",
                                Logic.ALL,
                                List.of(
                                        Block.of(Logic.ALL, rule("flags.met_guard")),
                                        Block.of(
                                                Logic.ANY,
                                                Rule.of(
                                                        "mc.jaime.class",
                                                        ConditionOperator.EQUALS,
                                                        "rogue")))));

        return Flow.builder()
                .id("main")
                .name("Main Flow")
                .node(EntryNode.builder().id("entry").next("intro").build())
                .node(
                        DialogueNode.builder()
                                .id("intro")
                                .speaker("mc.jaime")
                                .text("Who goes there?")
                                .outputInstruction(
                                        List.of(
                                                Assignment.ofReference(
                                                        "mc.jaime.mood",
                                                        AssignmentOperator.SET,
                                                        "world.default_mood")))
                                .response(
                                        new Response(
                                                "r1",
                                                "A friend.",
                                                braveEnough,
                                                List.of(
                                                        Assignment.of(
                                                                "quests.trust",
                                                                AssignmentOperator.ADD,
                                                                "1")),
                                                "branch"))
                                .response(Response.of("r2", "Nobody.", "end"))
                                .build())
                .node(
                        ConditionNode.builder()
                                .id("branch")
                                .switchCase(new SwitchCase("c1", "Brave", braveEnough, "reward"))
                                .switchCase(new SwitchCase("c2", "Sneaky", nested, "hub"))
                                .defaultTarget("end")
                                .build())
                .node(
                        InstructionNode.builder()
                                .id("reward")
                                .assignment(gold(50))
                                .assignment(
                                        Assignment.of(
                                                "flags.rewarded",
                                                AssignmentOperator.SET_TRUE,
                                                null))
                                .next("scene")
                                .build())
                .node(HubNode.builder().id("hub").hubId("gate").next("scene").build())
                .node(JumpNode.builder().id("jump").targetHubId("gate").build())
                .node(SceneNode.builder().id("scene").location("Castle gate").next("call").build())
                .node(
                        SubflowNode.builder()
                                .id("call")
                                .targetFlowId("shop")
                                .next("end")
                                .build())
                .node(ExitNode.builder().id("end").mode(ExitMode.TERMINAL).build())
                .build();
    }
}
