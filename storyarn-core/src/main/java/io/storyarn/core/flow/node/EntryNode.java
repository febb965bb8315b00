package io.storyarn.core.flow.node;

import java.util.List;

/// Start of a flow. Advances to its single outgoing edge.
///
/// @implNote Immutable and thread-safe after construction.
public final class EntryNode extends Node {

    private final String next;

    private EntryNode(Builder builder) {
        super(builder.id);
        this.next = builder.next;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the id of the node this entry leads to.
    ///
    /// @return next node id, or null if the entry is not connected
    public String getNext() {
        return next;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.ENTRY;
    }

    @Override
    public List<String> getTargets() {
        return targetsOf(next);
    }

    public static final class Builder {
        private String id;
        private String next;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder next(String next) {
            this.next = next;
            return this;
        }

        /// Builds the immutable entry node.
        ///
        /// @return new EntryNode instance, never null
        /// @throws IllegalStateException if `id` is missing
        public EntryNode build() {
            requireId(id, "EntryNode");
            return new EntryNode(this);
        }
    }
}
