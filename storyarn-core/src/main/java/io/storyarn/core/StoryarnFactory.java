package io.storyarn.core;

import io.storyarn.core.condition.ConditionEvaluator;
import io.storyarn.core.execution.ExecutionListener;
import io.storyarn.core.execution.FlowEngine;
import io.storyarn.core.execution.evaluator.DefaultNodeEvaluatorRegistry;
import io.storyarn.core.execution.evaluator.NodeEvaluator;
import io.storyarn.core.execution.evaluator.NodeEvaluatorRegistry;
import io.storyarn.core.flow.FlowRepository;
import io.storyarn.core.flow.InMemoryFlowRepository;
import io.storyarn.core.instruction.InstructionExecutor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Factory for creating and wiring {@link FlowEngine} instances.
///
/// ### Usage Patterns
///
/// **Builder** (custom evaluators or listener):
/// {@snippet :
/// FlowEngine engine = StoryarnFactory.builder()
///     .config(StoryarnConfig.builder().maxSteps(500).build())
///     .flowRepository(repository)
///     .listener(myListener)
///     .build();
/// }
///
/// **Quick start**:
/// {@snippet :
/// FlowEngine engine = StoryarnFactory.createEngine(repository);
/// }
///
/// @see StoryarnConfig
/// @see Builder
public final class StoryarnFactory {

    private StoryarnFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an engine with default configuration.
    ///
    /// @param flowRepository source of flows, not null
    /// @return a fully-wired engine, never null
    public static FlowEngine createEngine(FlowRepository flowRepository) {
        return createEngine(new StoryarnConfig(), flowRepository);
    }

    /// Creates an engine with custom configuration.
    ///
    /// @param config engine settings, not null
    /// @param flowRepository source of flows, not null
    /// @return a fully-wired engine, never null
    public static FlowEngine createEngine(StoryarnConfig config, FlowRepository flowRepository) {
        return builder().config(config).flowRepository(flowRepository).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link FlowEngine} instances.
    ///
    /// Unset collaborators default to the built-in implementations, an empty in-memory
    /// repository and {@link ExecutionListener#NOOP}.
    public static class Builder {
        private StoryarnConfig config = new StoryarnConfig();
        private FlowRepository flowRepository;
        private ExecutionListener listener = ExecutionListener.NOOP;
        private final List<NodeEvaluator<?>> evaluators = new ArrayList<>();

        private Builder() {}

        public Builder config(StoryarnConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder flowRepository(FlowRepository flowRepository) {
            this.flowRepository = flowRepository;
            return this;
        }

        public Builder listener(ExecutionListener listener) {
            this.listener = listener != null ? listener : ExecutionListener.NOOP;
            return this;
        }

        /// Registers an evaluator, replacing the built-in one for the same node class.
        ///
        /// @param evaluator the evaluator, not null
        /// @return this builder for chaining, never null
        public Builder evaluator(NodeEvaluator<?> evaluator) {
            this.evaluators.add(Objects.requireNonNull(evaluator, "evaluator must not be null"));
            return this;
        }

        /// Wires and returns the engine.
        ///
        /// @return new engine, never null
        public FlowEngine build() {
            NodeEvaluatorRegistry registry = new DefaultNodeEvaluatorRegistry();
            for (NodeEvaluator<?> evaluator : evaluators) {
                registry.register(evaluator);
            }
            return new FlowEngine(
                    flowRepository != null ? flowRepository : new InMemoryFlowRepository(),
                    registry,
                    new ConditionEvaluator(),
                    new InstructionExecutor(),
                    config,
                    listener);
        }
    }
}
