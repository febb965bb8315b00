package io.storyarn.core.execution.evaluator;

import io.storyarn.core.StoryarnConfig;
import io.storyarn.core.condition.ConditionEvaluator;
import io.storyarn.core.flow.Flow;
import io.storyarn.core.flow.FlowRepository;
import io.storyarn.core.instruction.InstructionExecutor;
import io.storyarn.core.state.ExecutionState;
import java.util.Objects;

/// Everything a {@link NodeEvaluator} may read while evaluating a node.
///
/// ### Required Fields
/// - `state` - execution state before the node is evaluated
/// - `flow` - flow containing the node
///
/// ### Services
/// - `conditionEvaluator` / `instructionExecutor` - expression evaluation
/// - `flowRepository` - cross-flow lookups
/// - `config` - engine settings
///
/// @implNote Immutable after construction. Modified copies can be created via
/// {@link #withState}.
public final class EvaluationContext {

    private final ExecutionState state;
    private final Flow flow;
    private final ConditionEvaluator conditionEvaluator;
    private final InstructionExecutor instructionExecutor;
    private final FlowRepository flowRepository;
    private final StoryarnConfig config;

    private EvaluationContext(Builder builder) {
        this.state = Objects.requireNonNull(builder.state, "state required");
        this.flow = Objects.requireNonNull(builder.flow, "flow required");
        this.conditionEvaluator = builder.conditionEvaluator;
        this.instructionExecutor = builder.instructionExecutor;
        this.flowRepository = builder.flowRepository;
        this.config = builder.config;
    }

    public ExecutionState getState() {
        return state;
    }

    public Flow getFlow() {
        return flow;
    }

    public ConditionEvaluator getConditionEvaluator() {
        return conditionEvaluator;
    }

    public InstructionExecutor getInstructionExecutor() {
        return instructionExecutor;
    }

    public FlowRepository getFlowRepository() {
        return flowRepository;
    }

    public StoryarnConfig getConfig() {
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Creates a copy with a different state.
    ///
    /// @param newState replacement state, not null
    /// @return new context, never null
    public EvaluationContext withState(ExecutionState newState) {
        return builder()
                .state(newState)
                .flow(flow)
                .conditionEvaluator(conditionEvaluator)
                .instructionExecutor(instructionExecutor)
                .flowRepository(flowRepository)
                .config(config)
                .build();
    }

    public static final class Builder {
        private ExecutionState state;
        private Flow flow;
        private ConditionEvaluator conditionEvaluator = new ConditionEvaluator();
        private InstructionExecutor instructionExecutor = new InstructionExecutor();
        private FlowRepository flowRepository;
        private StoryarnConfig config = new StoryarnConfig();

        private Builder() {}

        public Builder state(ExecutionState state) {
            this.state = state;
            return this;
        }

        public Builder flow(Flow flow) {
            this.flow = flow;
            return this;
        }

        public Builder conditionEvaluator(ConditionEvaluator conditionEvaluator) {
            this.conditionEvaluator = conditionEvaluator;
            return this;
        }

        public Builder instructionExecutor(InstructionExecutor instructionExecutor) {
            this.instructionExecutor = instructionExecutor;
            return this;
        }

        public Builder flowRepository(FlowRepository flowRepository) {
            this.flowRepository = flowRepository;
            return this;
        }

        public Builder config(StoryarnConfig config) {
            this.config = config;
            return this;
        }

        public EvaluationContext build() {
            return new EvaluationContext(this);
        }
    }
}
