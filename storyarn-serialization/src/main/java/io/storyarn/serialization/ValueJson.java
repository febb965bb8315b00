package io.storyarn.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import io.storyarn.core.variable.Value;
import io.storyarn.core.variable.VariableType;
import io.storyarn.core.variable.Values;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Set;

/// Reads and writes variable values as plain JSON scalars.
///
/// ```
/// Type          JSON
/// ——————————————+———————————————————————————
/// number        │ number (exact decimal)
/// text, select  │ string
/// boolean       │ true / false
/// multi_select  │ array of strings
/// date          │ "yyyy-MM-dd"
/// undefined     │ null
/// ```
final class ValueJson {

    private ValueJson() {}

    static void write(JsonGenerator gen, Value value) throws IOException {
        if (value instanceof Value.NumberValue n) {
            gen.writeNumber(n.display());
        } else if (value instanceof Value.TextValue t) {
            gen.writeString(t.text());
        } else if (value instanceof Value.BooleanValue b) {
            gen.writeBoolean(b.value());
        } else if (value instanceof Value.SelectValue s) {
            gen.writeString(s.key());
        } else if (value instanceof Value.MultiSelectValue m) {
            gen.writeStartArray();
            for (String key : m.keys()) {
                gen.writeString(key);
            }
            gen.writeEndArray();
        } else if (value instanceof Value.DateValue d) {
            gen.writeString(d.date().toString());
        } else {
            gen.writeNull();
        }
    }

    /// Reads `node` as a value of `type`. Strings are accepted for every type and parsed.
    ///
    /// @throws IOException if the JSON cannot be read as `type`
    static Value read(JsonNode node, VariableType type) throws IOException {
        if (node == null || node.isNull()) {
            return Value.UNDEFINED;
        }
        if (type == VariableType.MULTI_SELECT && node.isArray()) {
            Set<String> keys = new LinkedHashSet<>();
            node.forEach(k -> keys.add(k.asText()));
            return Value.multiSelect(keys);
        }
        if (type == VariableType.NUMBER && node.isNumber()) {
            BigDecimal number = node.decimalValue();
            if (!Values.isWithinLimits(number)) {
                throw new IOException("Number exceeds " + Values.MAX_DIGITS + " digits");
            }
            return Value.number(number);
        }
        if (type == VariableType.BOOLEAN && node.isBoolean()) {
            return Value.bool(node.booleanValue());
        }
        if (!node.isValueNode()) {
            throw new IOException("Expected a " + type.wireName() + " value but got " + node);
        }
        String literal = node.asText();
        return Values.parse(literal, type)
                .orElseThrow(
                        () ->
                                new IOException(
                                        "'"
                                                + literal
                                                + "' is not a valid "
                                                + type.wireName()
                                                + " value"));
    }
}
