package io.storyarn.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.storyarn.core.condition.Block;
import io.storyarn.core.condition.Condition;
import io.storyarn.core.condition.ConditionOperator;
import io.storyarn.core.condition.ConditionTree;
import io.storyarn.core.condition.Group;
import io.storyarn.core.condition.Logic;
import io.storyarn.core.condition.Rule;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/// Reads condition trees from any of the stored forms:
/// - block form `{"logic", "blocks": [...]}` with `"type": "block" | "group"` entries
/// - legacy flat form `{"logic", "rules": [...]}`, upgraded to a single block
/// - either of the above embedded as a JSON string
/// - `null`, `""` or an object without rules, read as the empty condition
///
/// Incomplete rules (no sheet or variable yet) are dropped, as an editor leaves them while
/// the author is still picking a variable. A missing logic tag reads as `all`.
///
/// @see ConditionTreeSerializer for the inverse operation
class ConditionTreeDeserializer extends StdDeserializer<ConditionTree> {

    @Serial private static final long serialVersionUID = -3055924017823694018L;

    private static final Logger logger =
            Logger.getLogger(ConditionTreeDeserializer.class.getName());

    ConditionTreeDeserializer() {
        super(ConditionTree.class);
    }

    @Override
    public ConditionTree deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        return read(mapper, mapper.readTree(p));
    }

    @Override
    public ConditionTree getNullValue(DeserializationContext ctxt) {
        return ConditionTree.EMPTY;
    }

    static ConditionTree read(ObjectMapper mapper, JsonNode root) throws IOException {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return ConditionTree.EMPTY;
        }
        if (root.isTextual()) {
            String text = root.asText();
            return text.isBlank() ? ConditionTree.EMPTY : read(mapper, mapper.readTree(text));
        }
        Logic logic = logic(root);
        if (root.has("blocks")) {
            List<Condition> children = new ArrayList<>();
            for (JsonNode entry : root.get("blocks")) {
                if ("group".equals(Json.textOrNull(entry, "type"))) {
                    children.add(group(entry));
                } else {
                    children.add(block(entry));
                }
            }
            return new ConditionTree(logic, children);
        }
        if (root.has("rules")) {
            return ConditionTree.ofRules(logic, rules(root.get("rules")));
        }
        return ConditionTree.EMPTY;
    }

    private static Group group(JsonNode root) throws IOException {
        List<Block> blocks = new ArrayList<>();
        JsonNode entries = root.get("blocks");
        if (entries != null) {
            for (JsonNode entry : entries) {
                if ("group".equals(Json.textOrNull(entry, "type"))) {
                    throw new IOException("Groups cannot contain groups");
                }
                blocks.add(block(entry));
            }
        }
        return new Group(Json.textOrNull(root, "id"), logic(root), blocks);
    }

    private static Block block(JsonNode root) throws IOException {
        return new Block(Json.textOrNull(root, "id"), logic(root), rules(root.get("rules")));
    }

    private static List<Rule> rules(JsonNode entries) throws IOException {
        List<Rule> rules = new ArrayList<>();
        if (entries == null) {
            return rules;
        }
        for (JsonNode entry : entries) {
            String sheet = Json.textOrNull(entry, "sheet");
            String variable = Json.textOrNull(entry, "variable");
            if (sheet == null || sheet.isBlank() || variable == null || variable.isBlank()) {
                logger.fine("Skipping incomplete rule " + entry);
                continue;
            }
            rules.add(
                    new Rule(
                            Json.textOrNull(entry, "id"),
                            sheet,
                            variable,
                            operator(Json.textOrNull(entry, "operator")),
                            Json.textOrNull(entry, "value")));
        }
        return rules;
    }

    private static ConditionOperator operator(String name) throws IOException {
        if (name == null || name.isBlank()) {
            return null;
        }
        return ConditionOperator.fromWireName(name)
                .orElseThrow(() -> new IOException("Unknown condition operator: " + name));
    }

    private static Logic logic(JsonNode root) throws IOException {
        String name = Json.textOrNull(root, "logic");
        if (name == null) {
            return Logic.ALL;
        }
        return Logic.fromWireName(name)
                .orElseThrow(() -> new IOException("Unknown logic: " + name));
    }
}
