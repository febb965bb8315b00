package io.storyarn.core.flow;

import io.storyarn.core.flow.node.EntryNode;
import io.storyarn.core.flow.node.HubNode;
import io.storyarn.core.flow.node.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Immutable flow definition: a named graph of nodes representing one dialogue or narrative
/// unit.
///
/// ### Validation
/// The builder rejects duplicate node ids. Graph-level problems (missing entry, dangling
/// edges, unreachable nodes) are reported by {@link io.storyarn.core.validation.FlowValidator}
/// rather than thrown, so that partially authored flows can still be played.
///
/// @implNote Immutable and thread-safe after construction. Node order is preserved as
/// authored. Entry nodes and hubs are indexed once at build time, so jump and subflow
/// resolution does not scan the graph.
///
/// @see Node for node type hierarchy
public final class Flow {

    private final String id;
    private final String name;
    private final Map<String, Node> nodes;
    private final List<EntryNode> entryNodes;
    private final Map<String, HubNode> hubsByHubId;

    private Flow(Builder builder) {
        this.id = builder.id;
        this.name = builder.name != null ? builder.name : builder.id;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodes));

        List<EntryNode> entries = new ArrayList<>();
        Map<String, HubNode> hubs = new HashMap<>();
        for (Node node : nodes.values()) {
            if (node instanceof EntryNode entry) {
                entries.add(entry);
            } else if (node instanceof HubNode hub && hub.getHubId() != null) {
                hubs.putIfAbsent(hub.getHubId(), hub);
            }
        }
        this.entryNodes = List.copyOf(entries);
        this.hubsByHubId = Map.copyOf(hubs);
    }

    /// Returns the unique flow identifier.
    ///
    /// @return flow ID, never null
    public String getId() {
        return id;
    }

    /// @return display name, defaults to the id, never null
    public String getName() {
        return name;
    }

    /// Returns all nodes by id, in authored order.
    ///
    /// @return unmodifiable map of node ID to node, never null
    public Map<String, Node> getNodes() {
        return nodes;
    }

    public Optional<Node> findNode(String nodeId) {
        return nodeId == null ? Optional.empty() : Optional.ofNullable(nodes.get(nodeId));
    }

    public boolean hasNode(String nodeId) {
        return nodeId != null && nodes.containsKey(nodeId);
    }

    /// Returns the entry nodes of this flow.
    ///
    /// A well-formed flow has exactly one; the validator reports other counts.
    ///
    /// @return entry nodes in authored order, never null
    public List<EntryNode> getEntryNodes() {
        return entryNodes;
    }

    /// Returns the first entry node.
    ///
    /// @return the entry node, or empty if the flow has none
    public Optional<EntryNode> findEntry() {
        return entryNodes.isEmpty() ? Optional.empty() : Optional.of(entryNodes.get(0));
    }

    /// Resolves a jump target. Hubs are matched by hub id first, then by node id.
    ///
    /// @param hubId name the jump refers to, may be null
    /// @return the hub, or empty if no hub carries that name
    public Optional<HubNode> findHub(String hubId) {
        if (hubId == null) {
            return Optional.empty();
        }
        HubNode byHubId = hubsByHubId.get(hubId);
        if (byHubId != null) {
            return Optional.of(byHubId);
        }
        Node byNodeId = nodes.get(hubId);
        return byNodeId instanceof HubNode hub ? Optional.of(hub) : Optional.empty();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing immutable Flow instances.
    ///
    /// Required fields: `id`
    public static final class Builder {
        private String id;
        private String name;
        private final Map<String, Node> nodes = new LinkedHashMap<>();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /// Adds a node.
        ///
        /// @param node the node, not null
        /// @return this builder for chaining
        /// @throws IllegalStateException if a node with the same id was already added
        public Builder node(Node node) {
            Objects.requireNonNull(node, "node must not be null");
            if (nodes.putIfAbsent(node.getId(), node) != null) {
                throw new IllegalStateException(
                        "Duplicate node id '" + node.getId() + "' in flow " + id);
            }
            return this;
        }

        public Builder nodes(List<? extends Node> nodes) {
            nodes.forEach(this::node);
            return this;
        }

        /// Builds the immutable flow.
        ///
        /// @return new Flow instance, never null
        /// @throws IllegalStateException if `id` is missing
        public Flow build() {
            if (id == null || id.isBlank()) {
                throw new IllegalStateException("Flow id is required");
            }
            return new Flow(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Flow flow)) return false;
        return id.equals(flow.id) && nodes.equals(flow.nodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, nodes);
    }

    @Override
    public String toString() {
        return "Flow{id='" + id + "', nodes=" + nodes.size() + "}";
    }
}
