package io.storyarn.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.storyarn.core.condition.ConditionTree;
import io.storyarn.core.flow.node.ConditionNode;
import io.storyarn.core.flow.node.DialogueNode;
import io.storyarn.core.flow.node.EntryNode;
import io.storyarn.core.flow.node.ExitNode;
import io.storyarn.core.flow.node.HubNode;
import io.storyarn.core.flow.node.InstructionNode;
import io.storyarn.core.flow.node.JumpNode;
import io.storyarn.core.flow.node.Node;
import io.storyarn.core.flow.node.Response;
import io.storyarn.core.flow.node.SceneNode;
import io.storyarn.core.flow.node.SubflowNode;
import io.storyarn.core.flow.node.SwitchCase;
import io.storyarn.core.instruction.Assignment;
import java.io.IOException;
import java.io.Serial;
import java.util.List;

/// Serializes all `Node` subtypes to JSON with a `"type"` discriminator field.
///
/// Every serialized object begins with `"id"` and `"type"`, followed by subtype-specific
/// fields. Null targets and empty conditions are omitted.
///
/// ```
/// type           Additional fields
/// ———————————————+——————————————————————————————————————————————————————————————
/// entry          │ next
/// dialogue       │ speaker, text, input_condition, output_instruction,
///                │ responses, next
/// condition      │ switch_mode, condition, true_target, false_target,
///                │ cases, default_target
/// instruction    │ assignments, next
/// hub            │ hub_id, next
/// jump           │ target_hub_id
/// exit           │ exit_mode, referenced_flow_id
/// subflow        │ referenced_flow_id, next
/// scene          │ location, next
/// ```
///
/// @implNote Package-private. Registered by {@link StoryarnJacksonModule}.
/// @see NodeDeserializer for the inverse operation
class NodeSerializer extends StdSerializer<Node> {

    @Serial private static final long serialVersionUID = 4471385029166613508L;

    NodeSerializer() {
        super(Node.class);
    }

    @Override
    public void serialize(Node node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", node.getId());
        gen.writeStringField("type", node.getNodeType().wireName());

        if (node instanceof EntryNode n) {
            Json.writeIfNotNull(gen, "next", n.getNext());
        } else if (node instanceof DialogueNode n) {
            writeDialogueNode(n, gen, provider);
        } else if (node instanceof ConditionNode n) {
            writeConditionNode(n, gen, provider);
        } else if (node instanceof InstructionNode n) {
            writeAssignments("assignments", n.getAssignments(), gen, provider);
            Json.writeIfNotNull(gen, "next", n.getNext());
        } else if (node instanceof HubNode n) {
            Json.writeIfNotNull(gen, "hub_id", n.getHubId());
            Json.writeIfNotNull(gen, "next", n.getNext());
        } else if (node instanceof JumpNode n) {
            Json.writeIfNotNull(gen, "target_hub_id", n.getTargetHubId());
        } else if (node instanceof ExitNode n) {
            gen.writeStringField("exit_mode", n.getMode().wireName());
            Json.writeIfNotNull(gen, "referenced_flow_id", n.getTargetFlowId());
        } else if (node instanceof SubflowNode n) {
            Json.writeIfNotNull(gen, "referenced_flow_id", n.getTargetFlowId());
            Json.writeIfNotNull(gen, "next", n.getNext());
        } else if (node instanceof SceneNode n) {
            Json.writeIfNotNull(gen, "location", n.getLocation());
            Json.writeIfNotNull(gen, "next", n.getNext());
        } else {
            throw new IOException("Unknown node type: " + node.getClass().getSimpleName());
        }

        gen.writeEndObject();
    }

    private void writeDialogueNode(DialogueNode n, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        Json.writeIfNotNull(gen, "speaker", n.getSpeaker());
        gen.writeStringField("text", n.getText());
        writeCondition("input_condition", n.getInputCondition(), gen, provider);
        writeAssignments("output_instruction", n.getOutputInstruction(), gen, provider);
        if (!n.getResponses().isEmpty()) {
            gen.writeArrayFieldStart("responses");
            for (Response response : n.getResponses()) {
                gen.writeStartObject();
                gen.writeStringField("id", response.id());
                gen.writeStringField("text", response.text());
                writeCondition("condition", response.condition(), gen, provider);
                writeAssignments("instruction", response.assignments(), gen, provider);
                Json.writeIfNotNull(gen, "target", response.target());
                gen.writeEndObject();
            }
            gen.writeEndArray();
        }
        Json.writeIfNotNull(gen, "next", n.getNext());
    }

    private void writeConditionNode(
            ConditionNode n, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeBooleanField("switch_mode", n.isSwitchMode());
        if (n.isSwitchMode()) {
            gen.writeArrayFieldStart("cases");
            for (SwitchCase switchCase : n.getCases()) {
                gen.writeStartObject();
                gen.writeStringField("id", switchCase.id());
                Json.writeIfNotNull(gen, "label", switchCase.label());
                writeCondition("condition", switchCase.condition(), gen, provider);
                Json.writeIfNotNull(gen, "target", switchCase.target());
                gen.writeEndObject();
            }
            gen.writeEndArray();
            Json.writeIfNotNull(gen, "default_target", n.getDefaultTarget());
        } else {
            writeCondition("condition", n.getCondition(), gen, provider);
            Json.writeIfNotNull(gen, "true_target", n.getTrueTarget());
            Json.writeIfNotNull(gen, "false_target", n.getFalseTarget());
        }
    }

    private void writeCondition(
            String field, ConditionTree condition, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        if (condition != null && !condition.isEmpty()) {
            provider.defaultSerializeField(field, condition, gen);
        }
    }

    private void writeAssignments(
            String field,
            List<Assignment> assignments,
            JsonGenerator gen,
            SerializerProvider provider)
            throws IOException {
        if (!assignments.isEmpty()) {
            provider.defaultSerializeField(field, assignments, gen);
        }
    }
}
