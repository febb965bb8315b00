package io.storyarn.core.flow.node;

import io.storyarn.core.condition.ConditionTree;
import io.storyarn.core.instruction.Assignment;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/// A line of dialogue with optional player responses.
///
/// When evaluated, the node first checks its `inputCondition` (informational only), runs its
/// `outputInstruction`, then offers the responses whose condition passes. A dialogue without
/// responses follows its `next` edge.
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see Response for response structure
public final class DialogueNode extends Node {

    private final String speaker;
    private final String text;
    private final List<Response> responses;
    private final String next;
    private final ConditionTree inputCondition;
    private final List<Assignment> outputInstruction;

    private DialogueNode(Builder builder) {
        super(builder.id);
        this.speaker = builder.speaker;
        this.text = builder.text;
        this.responses = List.copyOf(builder.responses);
        this.next = builder.next;
        this.inputCondition = builder.inputCondition;
        this.outputInstruction = List.copyOf(builder.outputInstruction);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the speaking character's name or sheet shortcut.
    ///
    /// @return speaker, may be null for narration
    public String getSpeaker() {
        return speaker;
    }

    /// @return dialogue text, never null (may be empty)
    public String getText() {
        return text;
    }

    /// @return responses in authored order, never null
    public List<Response> getResponses() {
        return responses;
    }

    public Optional<Response> findResponse(String responseId) {
        return responses.stream().filter(r -> r.id().equals(responseId)).findFirst();
    }

    /// @return node followed when there are no responses, may be null
    public String getNext() {
        return next;
    }

    /// @return condition checked on entry, {@link ConditionTree#EMPTY} if none
    public ConditionTree getInputCondition() {
        return inputCondition;
    }

    /// @return assignments run when the dialogue is shown, never null
    public List<Assignment> getOutputInstruction() {
        return outputInstruction;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.DIALOGUE;
    }

    @Override
    public List<String> getTargets() {
        List<String> targets = new ArrayList<>();
        responses.forEach(r -> targets.add(r.target()));
        targets.add(next);
        return targetsOf(targets.toArray(new String[0]));
    }

    /// Builder for constructing immutable DialogueNode instances.
    ///
    /// Required fields: `id`. Response ids must be unique.
    public static final class Builder {
        private String id;
        private String speaker;
        private String text = "";
        private final List<Response> responses = new ArrayList<>();
        private String next;
        private ConditionTree inputCondition = ConditionTree.EMPTY;
        private List<Assignment> outputInstruction = List.of();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder speaker(String speaker) {
            this.speaker = speaker;
            return this;
        }

        public Builder text(String text) {
            this.text = text != null ? text : "";
            return this;
        }

        /// Adds a response; responses are offered in the order they are added.
        ///
        /// @param response the response, not null
        /// @return this builder for chaining
        public Builder response(Response response) {
            this.responses.add(response);
            return this;
        }

        public Builder responses(List<Response> responses) {
            this.responses.clear();
            this.responses.addAll(responses);
            return this;
        }

        public Builder next(String next) {
            this.next = next;
            return this;
        }

        public Builder inputCondition(ConditionTree inputCondition) {
            this.inputCondition = inputCondition != null ? inputCondition : ConditionTree.EMPTY;
            return this;
        }

        public Builder outputInstruction(List<Assignment> outputInstruction) {
            this.outputInstruction = outputInstruction != null ? outputInstruction : List.of();
            return this;
        }

        /// Builds the immutable dialogue node.
        ///
        /// @return new DialogueNode instance, never null
        /// @throws IllegalStateException if `id` is missing or response ids repeat
        public DialogueNode build() {
            requireId(id, "DialogueNode");
            Set<String> seen = new HashSet<>();
            for (Response response : responses) {
                if (!seen.add(response.id())) {
                    throw new IllegalStateException(
                            "DialogueNode '" + id + "' has duplicate response id " + response.id());
                }
            }
            return new DialogueNode(this);
        }
    }
}
