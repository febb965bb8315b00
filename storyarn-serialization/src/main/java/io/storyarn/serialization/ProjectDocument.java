package io.storyarn.serialization;

import io.storyarn.core.flow.Flow;
import io.storyarn.core.flow.InMemoryFlowRepository;
import io.storyarn.core.variable.VariableStore;
import java.util.List;

/// A playable project as stored on disk: the initial variables, every flow, and the flow
/// a session starts in.
///
/// @param variables initial variable values, not null
/// @param flows all flows in authored order, not null
/// @param startFlowId flow to start in; defaults to the first flow when null
public record ProjectDocument(VariableStore variables, List<Flow> flows, String startFlowId) {

    public ProjectDocument {
        variables = variables != null ? variables : VariableStore.empty();
        flows = flows != null ? List.copyOf(flows) : List.of();
        if (startFlowId == null && !flows.isEmpty()) {
            startFlowId = flows.get(0).getId();
        }
    }

    /// Returns a fresh repository holding this project's flows.
    ///
    /// @return new repository, never null
    public InMemoryFlowRepository repository() {
        return new InMemoryFlowRepository(flows);
    }

    @Override
    public String toString() {
        return "ProjectDocument{flows=" + flows.size() + ", start=" + startFlowId + "}";
    }
}
