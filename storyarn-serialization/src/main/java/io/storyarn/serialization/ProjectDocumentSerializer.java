package io.storyarn.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.io.Serial;

/// Writes `{"variables": [...], "flows": [...], "start_flow": "..."}`.
///
/// @see ProjectDocumentDeserializer for the inverse operation
class ProjectDocumentSerializer extends StdSerializer<ProjectDocument> {

    @Serial private static final long serialVersionUID = 5912384402117650390L;

    ProjectDocumentSerializer() {
        super(ProjectDocument.class);
    }

    @Override
    public void serialize(ProjectDocument document, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        provider.defaultSerializeField("variables", document.variables(), gen);
        provider.defaultSerializeField("flows", document.flows(), gen);
        Json.writeIfNotNull(gen, "start_flow", document.startFlowId());
        gen.writeEndObject();
    }
}
