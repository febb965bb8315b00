package io.storyarn.serialization.mixin;

import com.fasterxml.jackson.databind.util.StdConverter;
import io.storyarn.core.flow.node.Node;
import java.util.List;
import java.util.Map;

/// Flattens a flow's id-keyed node map into an array, keeping authored order.
public final class NodeMapToList extends StdConverter<Map<String, Node>, List<Node>> {

    @Override
    public List<Node> convert(Map<String, Node> nodes) {
        return List.copyOf(nodes.values());
    }
}
