package io.storyarn.core.flow.node;

import java.util.List;

/// Named re-entry point targeted by {@link JumpNode}s. Passes straight through.
///
/// The hub id is the name jumps refer to; it defaults to the node id.
///
/// @implNote Immutable and thread-safe after construction.
public final class HubNode extends Node {

    private final String hubId;
    private final String next;

    private HubNode(Builder builder) {
        super(builder.id);
        this.hubId = builder.hubId != null && !builder.hubId.isBlank() ? builder.hubId : builder.id;
        this.next = builder.next;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return name used by jumps, never null
    public String getHubId() {
        return hubId;
    }

    public String getNext() {
        return next;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.HUB;
    }

    @Override
    public List<String> getTargets() {
        return targetsOf(next);
    }

    public static final class Builder {
        private String id;
        private String hubId;
        private String next;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder hubId(String hubId) {
            this.hubId = hubId;
            return this;
        }

        public Builder next(String next) {
            this.next = next;
            return this;
        }

        public HubNode build() {
            requireId(id, "HubNode");
            return new HubNode(this);
        }
    }
}
