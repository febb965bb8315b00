package io.storyarn.core.execution.evaluator;

import io.storyarn.core.flow.node.Node;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/// Default implementation of NodeEvaluatorRegistry.
///
/// Registers the evaluators for all nine built-in node types. All built-in evaluators are
/// stateless, so one registry can serve any number of sessions.
public class DefaultNodeEvaluatorRegistry implements NodeEvaluatorRegistry {

    private final Map<Class<? extends Node>, NodeEvaluator<?>> registry = new HashMap<>();

    /// Creates a registry with all built-in evaluators pre-registered.
    public DefaultNodeEvaluatorRegistry() {
        register(new EntryNodeEvaluator());
        register(new DialogueNodeEvaluator());
        register(new ConditionNodeEvaluator());
        register(new InstructionNodeEvaluator());
        register(new HubNodeEvaluator());
        register(new JumpNodeEvaluator());
        register(new ExitNodeEvaluator());
        register(new SubflowNodeEvaluator());
        register(new SceneNodeEvaluator());
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T extends Node> Optional<NodeEvaluator<T>> getEvaluator(Class<T> nodeType) {
        return Optional.ofNullable((NodeEvaluator<T>) registry.get(nodeType));
    }

    @Override
    public <T extends Node> NodeEvaluator<T> getEvaluatorOrThrow(Class<T> nodeType) {
        return getEvaluator(nodeType)
                .orElseThrow(
                        () ->
                                new NodeEvaluatorNotFound(
                                        "No evaluator registered for node type: "
                                                + nodeType.getSimpleName()));
    }

    @Override
    public <T extends Node> void register(NodeEvaluator<T> evaluator) {
        registry.put(evaluator.getNodeType(), evaluator);
    }

    @Override
    public boolean hasEvaluator(Class<? extends Node> nodeType) {
        return registry.containsKey(nodeType);
    }
}
