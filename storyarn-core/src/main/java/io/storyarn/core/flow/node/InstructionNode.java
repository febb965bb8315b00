package io.storyarn.core.flow.node;

import io.storyarn.core.instruction.Assignment;
import java.util.ArrayList;
import java.util.List;

/// Runs its assignments, then advances to its single outgoing edge.
///
/// @implNote Immutable and thread-safe after construction.
public final class InstructionNode extends Node {

    private final List<Assignment> assignments;
    private final String next;

    private InstructionNode(Builder builder) {
        super(builder.id);
        this.assignments = List.copyOf(builder.assignments);
        this.next = builder.next;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return assignments in execution order, never null
    public List<Assignment> getAssignments() {
        return assignments;
    }

    public String getNext() {
        return next;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.INSTRUCTION;
    }

    @Override
    public List<String> getTargets() {
        return targetsOf(next);
    }

    public static final class Builder {
        private String id;
        private final List<Assignment> assignments = new ArrayList<>();
        private String next;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder assignment(Assignment assignment) {
            this.assignments.add(assignment);
            return this;
        }

        public Builder assignments(List<Assignment> assignments) {
            this.assignments.clear();
            this.assignments.addAll(assignments);
            return this;
        }

        public Builder next(String next) {
            this.next = next;
            return this;
        }

        public InstructionNode build() {
            requireId(id, "InstructionNode");
            return new InstructionNode(this);
        }
    }
}
