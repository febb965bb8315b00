package io.storyarn.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.storyarn.core.variable.Value;
import io.storyarn.core.variable.Variable;
import io.storyarn.core.variable.VariableConstraints;
import io.storyarn.core.variable.VariableKey;
import io.storyarn.core.variable.VariableStore;
import io.storyarn.core.variable.VariableType;
import java.io.IOException;
import java.io.Serial;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/// Reads the sheet array written by {@link VariableStoreSerializer}.
///
/// A variable without a `"value"` starts at its type's default. An unknown type or a value
/// that cannot be read as the declared type fails the whole document.
class VariableStoreDeserializer extends StdDeserializer<VariableStore> {

    @Serial private static final long serialVersionUID = -4818076310269571354L;

    VariableStoreDeserializer() {
        super(VariableStore.class);
    }

    @Override
    public VariableStore deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        return read(mapper.readTree(p));
    }

    @Override
    public VariableStore getNullValue(DeserializationContext ctxt) {
        return VariableStore.empty();
    }

    static VariableStore read(JsonNode root) throws IOException {
        if (root == null || root.isNull()) {
            return VariableStore.empty();
        }
        if (!root.isArray()) {
            throw new IOException("Variables must be an array of sheets");
        }
        List<Variable> variables = new ArrayList<>();
        for (JsonNode sheet : root) {
            String shortcut = Json.requireText(sheet, "shortcut", "Sheet");
            JsonNode entries = sheet.get("variables");
            if (entries == null) {
                continue;
            }
            for (JsonNode entry : entries) {
                variables.add(readVariable(shortcut, entry));
            }
        }
        return VariableStore.of(variables);
    }

    private static Variable readVariable(String sheet, JsonNode entry) throws IOException {
        String name = Json.requireText(entry, "name", "Variable");
        String typeName = Json.requireText(entry, "type", "Variable " + sheet + "." + name);
        VariableType type =
                VariableType.fromWireName(typeName)
                        .orElseThrow(
                                () ->
                                        new IOException(
                                                "Variable "
                                                        + sheet
                                                        + "."
                                                        + name
                                                        + " has unknown type "
                                                        + typeName));

        JsonNode valueNode = entry.get("value");
        Value value =
                valueNode == null ? type.defaultValue() : ValueJson.read(valueNode, type);
        try {
            return new Variable(VariableKey.of(sheet, name), type, value, constraints(entry));
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    private static VariableConstraints constraints(JsonNode entry) throws IOException {
        JsonNode node = entry.get("constraints");
        if (node == null || node.isNull()) {
            return VariableConstraints.NONE;
        }
        JsonNode maxLength = node.get("max_length");
        try {
            return new VariableConstraints(
                    decimal(node.get("min")),
                    decimal(node.get("max")),
                    maxLength == null || maxLength.isNull() ? null : maxLength.asInt());
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid constraints: " + e.getMessage(), e);
        }
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isNumber() ? node.decimalValue() : new BigDecimal(node.asText());
    }
}
