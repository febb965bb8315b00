package io.storyarn.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.storyarn.core.instruction.Assignment;
import io.storyarn.core.instruction.AssignmentValue;
import java.io.IOException;
import java.io.Serial;

/// Writes an assignment with a `"value_type"` discriminator for its right-hand side.
///
/// ```
/// value_type     Fields
/// ———————————————+——————————————————————————————————————
/// literal        │ value (omitted when null)
/// variable_ref   │ value_sheet, value (variable name)
/// ```
///
/// @see AssignmentDeserializer for the inverse operation
class AssignmentSerializer extends StdSerializer<Assignment> {

    @Serial private static final long serialVersionUID = 7316904483120553611L;

    AssignmentSerializer() {
        super(Assignment.class);
    }

    @Override
    public void serialize(Assignment assignment, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        Json.writeIfNotNull(gen, "id", assignment.id());
        gen.writeStringField("sheet", assignment.sheet());
        gen.writeStringField("variable", assignment.variable());
        gen.writeStringField("operator", assignment.operator().wireName());

        AssignmentValue value = assignment.value();
        if (value instanceof AssignmentValue.Reference ref) {
            gen.writeStringField("value_type", "variable_ref");
            gen.writeStringField("value_sheet", ref.sheet());
            gen.writeStringField("value", ref.variable());
        } else {
            gen.writeStringField("value_type", "literal");
            Json.writeIfNotNull(gen, "value", ((AssignmentValue.Literal) value).raw());
        }
        gen.writeEndObject();
    }
}
