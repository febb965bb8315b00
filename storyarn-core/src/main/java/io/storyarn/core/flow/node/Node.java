package io.storyarn.core.flow.node;

import java.util.ArrayList;
import java.util.List;

/// Base class for all flow node types.
///
/// Nodes are the vertices of a flow graph. Each node has an identifier unique within its
/// flow, a type used for evaluator dispatch, and the ids of the nodes it can lead to.
///
/// ### Node Types
/// - {@link EntryNode} - where a flow starts
/// - {@link DialogueNode} - a line of dialogue with player responses
/// - {@link ConditionNode} - true/false branch or first-match switch
/// - {@link InstructionNode} - variable assignments
/// - {@link HubNode} / {@link JumpNode} - named re-entry points and jumps to them
/// - {@link ExitNode} - end of flow, call into another flow, or return
/// - {@link SubflowNode} - call into another flow and come back
/// - {@link SceneNode} - location bookkeeping
///
/// @implNote Subclasses must be immutable after construction. Nodes never change while a
/// flow is being played; only the variables and the execution state do.
///
/// @see NodeType for the enumeration of node types
public abstract class Node {

    protected final String id;

    /// Creates a node with the specified identifier.
    ///
    /// @param id unique node identifier within the flow, not null
    protected Node(String id) {
        this.id = id;
    }

    /// Returns the unique node identifier.
    ///
    /// @return node ID used for graph traversal and logging, never null
    public String getId() {
        return id;
    }

    /// Returns the node type for evaluator dispatch.
    ///
    /// @return the node type enum value, never null
    public abstract NodeType getNodeType();

    /// Returns the ids of nodes in the same flow that this node can advance to.
    ///
    /// Jumps (resolved by hub id) and cross-flow targets are not included.
    ///
    /// @return unmodifiable list of node ids, never null (may be empty)
    public List<String> getTargets() {
        return List.of();
    }

    static void requireId(String id, String type) {
        if (id == null || id.isBlank()) {
            throw new IllegalStateException(type + " id is required");
        }
    }

    static List<String> targetsOf(String... ids) {
        List<String> targets = new ArrayList<>();
        for (String target : ids) {
            if (target != null && !targets.contains(target)) {
                targets.add(target);
            }
        }
        return List.copyOf(targets);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id='" + id + "'}";
    }
}
