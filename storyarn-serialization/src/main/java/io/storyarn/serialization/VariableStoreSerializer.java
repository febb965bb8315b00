package io.storyarn.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.storyarn.core.variable.Variable;
import io.storyarn.core.variable.VariableConstraints;
import io.storyarn.core.variable.VariableStore;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Writes a variable store as an array of sheets, each listing its variables.
///
/// {@snippet lang=json :
/// [
///   {"shortcut": "mc.jaime", "variables": [
///     {"name": "health", "type": "number", "value": 100,
///      "constraints": {"min": 0, "max": 100}}
///   ]}
/// ]
/// }
///
/// Sheets and variables are written sorted by name so the output is stable.
///
/// @see VariableStoreDeserializer for the inverse operation
class VariableStoreSerializer extends StdSerializer<VariableStore> {

    @Serial private static final long serialVersionUID = 2630419715540820938L;

    VariableStoreSerializer() {
        super(VariableStore.class);
    }

    @Override
    public void serialize(VariableStore store, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        Map<String, List<Variable>> sheets = new LinkedHashMap<>();
        for (Variable variable : store.variables()) {
            sheets.computeIfAbsent(variable.key().sheet(), s -> new ArrayList<>())
                    .add(variable);
        }

        gen.writeStartArray();
        for (Map.Entry<String, List<Variable>> sheet : sheets.entrySet()) {
            gen.writeStartObject();
            gen.writeStringField("shortcut", sheet.getKey());
            gen.writeArrayFieldStart("variables");
            for (Variable variable : sheet.getValue()) {
                writeVariable(variable, gen);
            }
            gen.writeEndArray();
            gen.writeEndObject();
        }
        gen.writeEndArray();
    }

    private void writeVariable(Variable variable, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", variable.key().name());
        gen.writeStringField("type", variable.type().wireName());
        gen.writeFieldName("value");
        ValueJson.write(gen, variable.value());

        VariableConstraints constraints = variable.constraints();
        if (!constraints.isEmpty()) {
            gen.writeObjectFieldStart("constraints");
            if (constraints.min() != null) {
                gen.writeFieldName("min");
                gen.writeNumber(constraints.min().toPlainString());
            }
            if (constraints.max() != null) {
                gen.writeFieldName("max");
                gen.writeNumber(constraints.max().toPlainString());
            }
            if (constraints.maxLength() != null) {
                gen.writeNumberField("max_length", constraints.maxLength());
            }
            gen.writeEndObject();
        }
        gen.writeEndObject();
    }
}
