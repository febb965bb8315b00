package io.storyarn.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.storyarn.core.condition.ConditionTree;
import io.storyarn.core.flow.node.ConditionNode;
import io.storyarn.core.flow.node.DialogueNode;
import io.storyarn.core.flow.node.EntryNode;
import io.storyarn.core.flow.node.ExitMode;
import io.storyarn.core.flow.node.ExitNode;
import io.storyarn.core.flow.node.HubNode;
import io.storyarn.core.flow.node.InstructionNode;
import io.storyarn.core.flow.node.JumpNode;
import io.storyarn.core.flow.node.Node;
import io.storyarn.core.flow.node.NodeType;
import io.storyarn.core.flow.node.Response;
import io.storyarn.core.flow.node.SceneNode;
import io.storyarn.core.flow.node.SubflowNode;
import io.storyarn.core.flow.node.SwitchCase;
import java.io.IOException;
import java.io.Serial;

/// Deserializes JSON into the correct `Node` subtype by reading the `"type"` discriminator.
///
/// Builder validation failures (missing id, duplicate response ids) surface as
/// {@link IOException} so that Jackson reports them with the offending input.
///
/// @implNote Package-private. Registered by {@link StoryarnJacksonModule}.
/// @see NodeSerializer for the inverse operation
class NodeDeserializer extends StdDeserializer<Node> {

    @Serial private static final long serialVersionUID = -6034251897361045527L;

    NodeDeserializer() {
        super(Node.class);
    }

    @Override
    public Node deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String typeName = Json.requireText(root, "type", "Node");
        NodeType type =
                NodeType.fromWireName(typeName)
                        .orElseThrow(() -> new IOException("Unknown node type: " + typeName));
        String id = Json.requireText(root, "id", "Node");

        try {
            return switch (type) {
                case ENTRY ->
                        EntryNode.builder().id(id).next(Json.textOrNull(root, "next")).build();
                case DIALOGUE -> readDialogueNode(id, root, mapper);
                case CONDITION -> readConditionNode(id, root, mapper);
                case INSTRUCTION ->
                        InstructionNode.builder()
                                .id(id)
                                .assignments(
                                        AssignmentDeserializer.readAll(root.get("assignments")))
                                .next(Json.textOrNull(root, "next"))
                                .build();
                case HUB ->
                        HubNode.builder()
                                .id(id)
                                .hubId(Json.textOrNull(root, "hub_id"))
                                .next(Json.textOrNull(root, "next"))
                                .build();
                case JUMP ->
                        JumpNode.builder()
                                .id(id)
                                .targetHubId(Json.textOrNull(root, "target_hub_id"))
                                .build();
                case EXIT -> readExitNode(id, root);
                case SUBFLOW ->
                        SubflowNode.builder()
                                .id(id)
                                .targetFlowId(Json.textOrNull(root, "referenced_flow_id"))
                                .next(Json.textOrNull(root, "next"))
                                .build();
                case SCENE ->
                        SceneNode.builder()
                                .id(id)
                                .location(Json.textOrNull(root, "location"))
                                .next(Json.textOrNull(root, "next"))
                                .build();
            };
        } catch (IllegalStateException e) {
            throw new IOException(
                    "Invalid " + typeName + " node '" + id + "': " + e.getMessage(), e);
        }
    }

    private DialogueNode readDialogueNode(String id, JsonNode root, ObjectMapper mapper)
            throws IOException {
        DialogueNode.Builder builder =
                DialogueNode.builder()
                        .id(id)
                        .speaker(Json.textOrNull(root, "speaker"))
                        .text(Json.textOrNull(root, "text"))
                        .inputCondition(readCondition(root, "input_condition", mapper))
                        .outputInstruction(
                                AssignmentDeserializer.readAll(root.get("output_instruction")))
                        .next(Json.textOrNull(root, "next"));

        JsonNode responses = root.get("responses");
        if (responses != null && responses.isArray()) {
            for (JsonNode entry : responses) {
                builder.response(
                        new Response(
                                Json.requireText(entry, "id", "Response"),
                                Json.textOrNull(entry, "text"),
                                readCondition(entry, "condition", mapper),
                                AssignmentDeserializer.readAll(entry.get("instruction")),
                                Json.textOrNull(entry, "target")));
            }
        }
        return builder.build();
    }

    private ConditionNode readConditionNode(String id, JsonNode root, ObjectMapper mapper)
            throws IOException {
        ConditionNode.Builder builder =
                ConditionNode.builder()
                        .id(id)
                        .condition(readCondition(root, "condition", mapper))
                        .trueTarget(Json.textOrNull(root, "true_target"))
                        .falseTarget(Json.textOrNull(root, "false_target"))
                        .defaultTarget(Json.textOrNull(root, "default_target"));

        JsonNode cases = root.get("cases");
        if (cases != null && cases.isArray()) {
            for (JsonNode entry : cases) {
                builder.switchCase(
                        new SwitchCase(
                                Json.requireText(entry, "id", "Switch case"),
                                Json.textOrNull(entry, "label"),
                                readCondition(entry, "condition", mapper),
                                Json.textOrNull(entry, "target")));
            }
        }
        // an explicit flag wins over the mode implied by the cases
        if (root.has("switch_mode")) {
            builder.switchMode(Json.booleanOrFalse(root, "switch_mode"));
        }
        return builder.build();
    }

    private ExitNode readExitNode(String id, JsonNode root) throws IOException {
        String modeName = Json.textOrNull(root, "exit_mode");
        ExitMode mode =
                modeName == null
                        ? ExitMode.TERMINAL
                        : ExitMode.fromWireName(modeName)
                                .orElseThrow(
                                        () -> new IOException("Unknown exit_mode: " + modeName));
        return ExitNode.builder()
                .id(id)
                .mode(mode)
                .targetFlowId(Json.textOrNull(root, "referenced_flow_id"))
                .build();
    }

    private ConditionTree readCondition(JsonNode root, String field, ObjectMapper mapper)
            throws IOException {
        JsonNode value = root.get(field);
        return value == null ? ConditionTree.EMPTY : ConditionTreeDeserializer.read(mapper, value);
    }
}
