package io.storyarn.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.storyarn.core.flow.Flow;
import io.storyarn.core.flow.node.Node;
import java.util.Map;

/// Jackson mixin that binds `Flow` deserialization to its builder.
///
/// Applied to `Flow.class` via `StoryarnJacksonModule.setupModule()`. Nodes are written as
/// an array in authored order rather than as the id-keyed map the getter returns, which is
/// also the shape `Flow.Builder.nodes(List)` accepts on the way back in.
///
/// @apiNote The companion mixin {@link FlowBuilderMixin} must also be registered so Jackson
/// knows how to invoke the builder's setters and `build()` method.
///
/// @see FlowBuilderMixin
/// @see io.storyarn.serialization.StoryarnJacksonModule
@JsonDeserialize(builder = Flow.Builder.class)
@JsonPropertyOrder({"id", "name", "nodes"})
@JsonIgnoreProperties({"entryNodes"})
public abstract class FlowMixin {

    @JsonSerialize(converter = NodeMapToList.class)
    abstract Map<String, Node> getNodes();
}
