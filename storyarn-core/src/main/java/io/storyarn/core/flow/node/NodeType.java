package io.storyarn.core.flow.node;

import java.util.Arrays;
import java.util.Optional;

public enum NodeType {
    ENTRY,
    DIALOGUE,
    CONDITION,
    INSTRUCTION,
    HUB,
    JUMP,
    EXIT,
    SUBFLOW,
    SCENE;

    /// Returns the lower-case name used in flow documents.
    public String wireName() {
        return name().toLowerCase();
    }

    public static Optional<NodeType> fromWireName(String name) {
        return Arrays.stream(values()).filter(t -> t.wireName().equals(name)).findFirst();
    }
}
