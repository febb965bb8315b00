package io.storyarn.core.execution.transition;

import io.storyarn.core.error.EvaluationError;
import io.storyarn.core.state.CallFrame;
import io.storyarn.core.state.ChoiceOption;
import java.util.List;
import java.util.Objects;

/// What a node evaluator decided should happen next.
///
/// The engine interprets the transition against the execution state; evaluators never
/// touch the state directly.
///
/// ### Permitted Subtypes
/// - {@link Advance} - move to a node of the current flow
/// - {@link AwaitChoice} - stop and offer responses
/// - {@link EnterFlow} - push a call frame and enter another flow's entry node
/// - {@link ReturnFromFlow} - pop a call frame and resume the caller
/// - {@link Finished} - end the playthrough
/// - {@link Failed} - end the playthrough with a structural error
public sealed interface Transition {

    static Advance advance(String nodeId) {
        return new Advance(nodeId);
    }

    static Finished finished(String reason) {
        return new Finished(reason);
    }

    static Failed failed(EvaluationError error) {
        return new Failed(error);
    }

    /// @param nodeId target node in the current flow, not null
    record Advance(String nodeId) implements Transition {
        public Advance {
            Objects.requireNonNull(nodeId, "nodeId must not be null");
        }
    }

    /// @param options every response of the dialogue, valid or not, not null
    record AwaitChoice(List<ChoiceOption> options) implements Transition {
        public AwaitChoice {
            options = List.copyOf(options);
        }

        public List<ChoiceOption> validOptions() {
            return options.stream().filter(ChoiceOption::valid).toList();
        }
    }

    /// @param flowId flow to enter, not null
    /// @param frame frame to push, not null
    record EnterFlow(String flowId, CallFrame frame) implements Transition {
        public EnterFlow {
            Objects.requireNonNull(flowId, "flowId must not be null");
            Objects.requireNonNull(frame, "frame must not be null");
        }
    }

    record ReturnFromFlow() implements Transition {}

    /// @param reason human-readable reason, not null
    record Finished(String reason) implements Transition {
        public Finished {
            Objects.requireNonNull(reason, "reason must not be null");
        }
    }

    /// @param error the structural error, not null
    record Failed(EvaluationError error) implements Transition {
        public Failed {
            Objects.requireNonNull(error, "error must not be null");
        }
    }
}
