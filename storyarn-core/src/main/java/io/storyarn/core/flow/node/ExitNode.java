package io.storyarn.core.flow.node;

/// End of a flow path.
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see ExitMode for the three behaviours
public final class ExitNode extends Node {

    private final ExitMode mode;
    private final String targetFlowId;

    private ExitNode(Builder builder) {
        super(builder.id);
        this.mode = builder.mode;
        this.targetFlowId = builder.targetFlowId;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return exit behaviour, never null
    public ExitMode getMode() {
        return mode;
    }

    /// @return flow entered in {@link ExitMode#FLOW} mode, null otherwise
    public String getTargetFlowId() {
        return targetFlowId;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.EXIT;
    }

    public static final class Builder {
        private String id;
        private ExitMode mode = ExitMode.TERMINAL;
        private String targetFlowId;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder mode(ExitMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder targetFlowId(String targetFlowId) {
            this.targetFlowId = targetFlowId;
            return this;
        }

        /// Builds the immutable exit node.
        ///
        /// @return new ExitNode instance, never null
        /// @throws IllegalStateException if `id` or `mode` is missing
        public ExitNode build() {
            requireId(id, "ExitNode");
            if (mode == null) {
                throw new IllegalStateException("ExitNode mode is required");
            }
            return new ExitNode(this);
        }
    }
}
