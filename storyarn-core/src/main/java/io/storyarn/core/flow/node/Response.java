package io.storyarn.core.flow.node;

import io.storyarn.core.condition.ConditionTree;
import io.storyarn.core.instruction.Assignment;
import java.util.List;
import java.util.Objects;

/// A player response offered by a {@link DialogueNode}.
///
/// @param id response identifier unique within the dialogue, not null
/// @param text response text shown to the player, may be empty
/// @param condition availability condition, {@link ConditionTree#EMPTY} when always available
/// @param assignments run when the response is selected, not null
/// @param target node reached after selection, may be null if unconnected
public record Response(
        String id,
        String text,
        ConditionTree condition,
        List<Assignment> assignments,
        String target) {

    public Response {
        Objects.requireNonNull(id, "response id must not be null");
        text = text != null ? text : "";
        condition = condition != null ? condition : ConditionTree.EMPTY;
        assignments = assignments != null ? List.copyOf(assignments) : List.of();
    }

    public static Response of(String id, String text, String target) {
        return new Response(id, text, ConditionTree.EMPTY, List.of(), target);
    }
}
