package io.storyarn.core.flow.node;

/// Jumps to the hub named `targetHubId` in the same flow.
///
/// The target is resolved at evaluation time; a hub deleted after authoring surfaces as a
/// missing target rather than failing at build time.
///
/// @implNote Immutable and thread-safe after construction.
public final class JumpNode extends Node {

    private final String targetHubId;

    private JumpNode(Builder builder) {
        super(builder.id);
        this.targetHubId = builder.targetHubId;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return hub id to jump to, may be null if never set
    public String getTargetHubId() {
        return targetHubId;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.JUMP;
    }

    public static final class Builder {
        private String id;
        private String targetHubId;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder targetHubId(String targetHubId) {
            this.targetHubId = targetHubId;
            return this;
        }

        public JumpNode build() {
            requireId(id, "JumpNode");
            return new JumpNode(this);
        }
    }
}
