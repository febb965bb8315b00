package io.storyarn.core.flow.node;

import java.util.List;

/// Calls another flow and continues at `next` when that flow returns.
///
/// @implNote Immutable and thread-safe after construction.
public final class SubflowNode extends Node {

    private final String targetFlowId;
    private final String next;

    private SubflowNode(Builder builder) {
        super(builder.id);
        this.targetFlowId = builder.targetFlowId;
        this.next = builder.next;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return flow to enter, may be null if never set
    public String getTargetFlowId() {
        return targetFlowId;
    }

    /// @return node resumed after the called flow returns, may be null
    public String getNext() {
        return next;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.SUBFLOW;
    }

    @Override
    public List<String> getTargets() {
        return targetsOf(next);
    }

    public static final class Builder {
        private String id;
        private String targetFlowId;
        private String next;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder targetFlowId(String targetFlowId) {
            this.targetFlowId = targetFlowId;
            return this;
        }

        public Builder next(String next) {
            this.next = next;
            return this;
        }

        public SubflowNode build() {
            requireId(id, "SubflowNode");
            return new SubflowNode(this);
        }
    }
}
