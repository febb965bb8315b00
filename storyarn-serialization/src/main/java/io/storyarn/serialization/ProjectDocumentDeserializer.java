package io.storyarn.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.storyarn.core.flow.Flow;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/// Reads a project document.
///
/// Flows are bound through the `Flow` builder mixins; duplicate flow ids and a
/// `"start_flow"` naming no flow are rejected.
///
/// @see ProjectDocumentSerializer for the inverse operation
class ProjectDocumentDeserializer extends StdDeserializer<ProjectDocument> {

    @Serial private static final long serialVersionUID = -2291744861538807721L;

    ProjectDocumentDeserializer() {
        super(ProjectDocument.class);
    }

    @Override
    public ProjectDocument deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (!root.isObject()) {
            throw new IOException("Project must be a JSON object");
        }

        List<Flow> flows = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        JsonNode flowNodes = root.get("flows");
        if (flowNodes != null) {
            for (JsonNode entry : flowNodes) {
                Flow flow = mapper.treeToValue(entry, Flow.class);
                if (!ids.add(flow.getId())) {
                    throw new IOException("Duplicate flow id " + flow.getId());
                }
                flows.add(flow);
            }
        }

        String startFlowId = Json.textOrNull(root, "start_flow");
        if (startFlowId != null && !ids.contains(startFlowId)) {
            throw new IOException("start_flow names unknown flow " + startFlowId);
        }

        return new ProjectDocument(
                VariableStoreDeserializer.read(root.get("variables")), flows, startFlowId);
    }
}
