package io.storyarn.core.flow.node;

import java.util.List;

/// Location bookkeeping; passes straight through.
///
/// @implNote Immutable and thread-safe after construction.
public final class SceneNode extends Node {

    private final String location;
    private final String next;

    private SceneNode(Builder builder) {
        super(builder.id);
        this.location = builder.location;
        this.next = builder.next;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return location name or sheet shortcut, may be null
    public String getLocation() {
        return location;
    }

    public String getNext() {
        return next;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.SCENE;
    }

    @Override
    public List<String> getTargets() {
        return targetsOf(next);
    }

    public static final class Builder {
        private String id;
        private String location;
        private String next;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder next(String next) {
            this.next = next;
            return this;
        }

        public SceneNode build() {
            requireId(id, "SceneNode");
            return new SceneNode(this);
        }
    }
}
