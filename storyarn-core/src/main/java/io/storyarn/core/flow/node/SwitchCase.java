package io.storyarn.core.flow.node;

import io.storyarn.core.condition.ConditionTree;
import java.util.Objects;

/// One case of a switch-mode {@link ConditionNode}.
///
/// @param id case identifier, not null
/// @param label display label, may be null
/// @param condition case condition, not null
/// @param target node reached when this case wins, may be null if unconnected
public record SwitchCase(String id, String label, ConditionTree condition, String target) {

    public SwitchCase {
        Objects.requireNonNull(id, "case id must not be null");
        condition = condition != null ? condition : ConditionTree.EMPTY;
    }

    public static SwitchCase of(String id, ConditionTree condition, String target) {
        return new SwitchCase(id, id, condition, target);
    }
}
