package io.storyarn.core.condition;

import java.util.List;
import java.util.Objects;

/// Logic over a list of blocks. Groups never nest.
///
/// @param id authoring id, may be null
/// @param logic combinator, not null
/// @param blocks blocks in evaluation order, not null
public record Group(String id, Logic logic, List<Block> blocks) implements Condition {

    public Group {
        Objects.requireNonNull(logic, "logic must not be null");
        blocks = List.copyOf(Objects.requireNonNull(blocks, "blocks must not be null"));
    }

    public static Group of(Logic logic, Block... blocks) {
        return new Group(null, logic, List.of(blocks));
    }
}
