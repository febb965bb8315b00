package io.storyarn.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.storyarn.core.condition.Block;
import io.storyarn.core.condition.Condition;
import io.storyarn.core.condition.ConditionTree;
import io.storyarn.core.condition.Group;
import io.storyarn.core.condition.Rule;
import java.io.IOException;
import java.io.Serial;

/// Writes condition trees in block form:
///
/// ```
/// {"logic": "all", "blocks": [
///   {"type": "block", "logic": "any", "rules": [{"sheet", "variable", "operator", "value"}]},
///   {"type": "group", "logic": "all", "blocks": [...]}
/// ]}
/// ```
///
/// Trees read from the legacy `{"logic", "rules"}` form are written back in block form.
///
/// @see ConditionTreeDeserializer for the inverse operation
class ConditionTreeSerializer extends StdSerializer<ConditionTree> {

    @Serial private static final long serialVersionUID = 4218305526381947702L;

    ConditionTreeSerializer() {
        super(ConditionTree.class);
    }

    @Override
    public void serialize(ConditionTree tree, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("logic", tree.logic().wireName());
        gen.writeArrayFieldStart("blocks");
        for (Condition child : tree.children()) {
            writeCondition(child, gen);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }

    private static void writeCondition(Condition condition, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        Json.writeIfNotNull(gen, "id", condition.id());
        if (condition instanceof Group group) {
            gen.writeStringField("type", "group");
            gen.writeStringField("logic", group.logic().wireName());
            gen.writeArrayFieldStart("blocks");
            for (Block block : group.blocks()) {
                writeCondition(block, gen);
            }
            gen.writeEndArray();
        } else if (condition instanceof Block block) {
            gen.writeStringField("type", "block");
            gen.writeStringField("logic", block.logic().wireName());
            gen.writeArrayFieldStart("rules");
            for (Rule rule : block.rules()) {
                writeRule(rule, gen);
            }
            gen.writeEndArray();
        } else {
            throw new IOException("Rules cannot appear outside a block");
        }
        gen.writeEndObject();
    }

    private static void writeRule(Rule rule, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        Json.writeIfNotNull(gen, "id", rule.id());
        gen.writeStringField("sheet", rule.sheet());
        gen.writeStringField("variable", rule.variable());
        if (rule.operator() != null) {
            gen.writeStringField("operator", rule.operator().wireName());
        }
        Json.writeIfNotNull(gen, "value", rule.value());
        gen.writeEndObject();
    }
}
