package io.storyarn.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.storyarn.core.instruction.Assignment;
import io.storyarn.core.instruction.AssignmentOperator;
import io.storyarn.core.instruction.AssignmentValue;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Reads assignments, dispatching on `"value_type"` (`literal` when absent).
///
/// A `variable_ref` value names the source variable in `"value"` and its sheet in
/// `"value_sheet"`. Scalar literal values of any JSON type are kept as their text.
///
/// @see AssignmentSerializer for the inverse operation
class AssignmentDeserializer extends StdDeserializer<Assignment> {

    @Serial private static final long serialVersionUID = -1402719840067236642L;

    AssignmentDeserializer() {
        super(Assignment.class);
    }

    @Override
    public Assignment deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        return read(mapper.readTree(p));
    }

    static List<Assignment> readAll(JsonNode entries) throws IOException {
        List<Assignment> assignments = new ArrayList<>();
        if (entries == null || entries.isNull()) {
            return assignments;
        }
        for (JsonNode entry : entries) {
            assignments.add(read(entry));
        }
        return assignments;
    }

    static Assignment read(JsonNode root) throws IOException {
        String sheet = Json.requireText(root, "sheet", "Assignment");
        String variable = Json.requireText(root, "variable", "Assignment");
        String operatorName = Json.requireText(root, "operator", "Assignment");
        AssignmentOperator operator =
                AssignmentOperator.fromWireName(operatorName)
                        .orElseThrow(
                                () ->
                                        new IOException(
                                                "Unknown assignment operator: " + operatorName));

        String valueType = Json.textOrNull(root, "value_type");
        AssignmentValue value;
        if ("variable_ref".equals(valueType)) {
            value =
                    AssignmentValue.reference(
                            Json.requireText(root, "value_sheet", "Variable reference"),
                            Json.requireText(root, "value", "Variable reference"));
        } else if (valueType == null || "literal".equals(valueType)) {
            value = AssignmentValue.literal(Json.textOrNull(root, "value"));
        } else {
            throw new IOException("Unknown value_type: " + valueType);
        }
        return new Assignment(Json.textOrNull(root, "id"), sheet, variable, operator, value);
    }
}
