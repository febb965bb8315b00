package io.storyarn.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;

/// Field helpers shared by the tree-based deserializers.
final class Json {

    private Json() {}

    static String textOrNull(JsonNode root, String field) {
        JsonNode value = root.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    static String requireText(JsonNode root, String field, String owner) throws IOException {
        String value = textOrNull(root, field);
        if (value == null) {
            throw new IOException(owner + " is missing required field \"" + field + "\"");
        }
        return value;
    }

    static boolean booleanOrFalse(JsonNode root, String field) {
        JsonNode value = root.get(field);
        return value != null && value.asBoolean(false);
    }

    static void writeIfNotNull(JsonGenerator gen, String field, String value) throws IOException {
        if (value != null) {
            gen.writeStringField(field, value);
        }
    }
}
