package io.storyarn.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import io.storyarn.core.flow.Flow;
import io.storyarn.core.flow.node.Node;

/// Jackson mixin for `Flow.Builder` that configures POJO builder deserialization.
///
/// Sets `withPrefix = ""` so JSON field names map directly to builder method names. The
/// single-node `node(Node)` method is hidden so that `"nodes"` is the only way in.
///
/// @see FlowMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class FlowBuilderMixin {

    @JsonIgnore
    abstract Flow.Builder node(Node node);
}
