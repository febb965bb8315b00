package io.storyarn.core.state;

import io.storyarn.core.error.EvaluationError;
import io.storyarn.core.execution.log.HistoryEntry;
import io.storyarn.core.execution.log.LogEntry;
import io.storyarn.core.execution.log.LogKind;
import io.storyarn.core.execution.log.PathEntry;
import io.storyarn.core.util.PersistentStack;
import io.storyarn.core.variable.Value;
import io.storyarn.core.variable.VariableKey;
import io.storyarn.core.variable.VariableStore;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;

/// Immutable interpreter state of one playthrough.
///
/// Every engine call takes a state and returns a new one; a state handed out is never
/// modified afterwards, so any state can be kept as an undo point. The variables, call stack,
/// log, history and path are persistent structures shared between consecutive states.
///
/// ### Contracts
/// - `currentNodeId` names a node of `flowId`, except after a failed transition
/// - `pendingChoices` is non-empty only while status is {@link ExecutionStatus#AWAITING_CHOICE}
/// - `error` is set only when status is {@link ExecutionStatus#FINISHED_WITH_ERROR}
///
/// @see io.storyarn.core.execution.FlowEngine for the operations that produce states
/// @see SnapshotStack for undo history
public final class ExecutionState {

    private final String flowId;
    private final String currentNodeId;
    private final VariableStore variables;
    private final CallStack callStack;
    private final PersistentStack<LogEntry> log;
    private final PersistentStack<HistoryEntry> history;
    private final PersistentStack<PathEntry> path;
    private final int stepCount;
    private final int maxSteps;
    private final ExecutionStatus status;
    private final List<ChoiceOption> pendingChoices;
    private final EvaluationError error;

    private ExecutionState(Builder builder) {
        this.flowId = Objects.requireNonNull(builder.flowId, "flowId required");
        this.currentNodeId = builder.currentNodeId;
        this.variables = Objects.requireNonNull(builder.variables, "variables required");
        this.callStack = builder.callStack;
        this.log = builder.log;
        this.history = builder.history;
        this.path = builder.path;
        this.stepCount = builder.stepCount;
        this.maxSteps = builder.maxSteps;
        this.status = Objects.requireNonNull(builder.status, "status required");
        this.pendingChoices = List.copyOf(builder.pendingChoices);
        this.error = builder.error;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns a builder initialized with this state's values.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        return new Builder(this);
    }

    /// @return id of the flow being executed, never null
    public String getFlowId() {
        return flowId;
    }

    /// @return id of the node the next step evaluates, may be null after a failure
    public String getCurrentNodeId() {
        return currentNodeId;
    }

    public VariableStore getVariables() {
        return variables;
    }

    /// Returns every variable's current value, sorted by reference.
    ///
    /// @return unmodifiable view, never null
    public SortedMap<VariableKey, Value> getVariablesSnapshot() {
        return variables.snapshot();
    }

    public CallStack getCallStack() {
        return callStack;
    }

    public int getCallStackDepth() {
        return callStack.depth();
    }

    /// Returns the execution log in the order entries were written.
    ///
    /// @return unmodifiable list, never null
    public List<LogEntry> getLog() {
        return log.toListOldestFirst();
    }

    /// Returns the variable history in the order writes happened.
    ///
    /// @return unmodifiable list, never null
    public List<HistoryEntry> getHistory() {
        return history.toListOldestFirst();
    }

    /// Returns the visited nodes in visiting order.
    ///
    /// @return unmodifiable list, never null
    public List<PathEntry> getPath() {
        return path.toListOldestFirst();
    }

    public int getStepCount() {
        return stepCount;
    }

    /// @return the step count at which the session pauses, never below 1
    public int getMaxSteps() {
        return maxSteps;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    /// @return options of the dialogue awaiting a choice, empty otherwise
    public List<ChoiceOption> getPendingChoices() {
        return pendingChoices;
    }

    /// @return the structural error that ended the run, if any
    public Optional<EvaluationError> getError() {
        return Optional.ofNullable(error);
    }

    /// Returns a copy with `entry` appended to the log.
    ///
    /// @param kind category, not null
    /// @param nodeId node concerned, may be null
    /// @param message detail, not null
    /// @return new state, never null
    public ExecutionState withLogEntry(LogKind kind, String nodeId, String message) {
        return toBuilder().log(kind, nodeId, message).build();
    }

    /// Builder for ExecutionState.
    ///
    /// Required fields: `flowId`, `variables`, `status`
    public static final class Builder {
        private String flowId;
        private String currentNodeId;
        private VariableStore variables = VariableStore.empty();
        private CallStack callStack = CallStack.empty();
        private PersistentStack<LogEntry> log = PersistentStack.empty();
        private PersistentStack<HistoryEntry> history = PersistentStack.empty();
        private PersistentStack<PathEntry> path = PersistentStack.empty();
        private int stepCount;
        private int maxSteps = 1000;
        private ExecutionStatus status = ExecutionStatus.RUNNING;
        private List<ChoiceOption> pendingChoices = List.of();
        private EvaluationError error;

        private Builder() {}

        private Builder(ExecutionState state) {
            this.flowId = state.flowId;
            this.currentNodeId = state.currentNodeId;
            this.variables = state.variables;
            this.callStack = state.callStack;
            this.log = state.log;
            this.history = state.history;
            this.path = state.path;
            this.stepCount = state.stepCount;
            this.maxSteps = state.maxSteps;
            this.status = state.status;
            this.pendingChoices = state.pendingChoices;
            this.error = state.error;
        }

        public Builder flowId(String flowId) {
            this.flowId = flowId;
            return this;
        }

        public Builder currentNodeId(String currentNodeId) {
            this.currentNodeId = currentNodeId;
            return this;
        }

        public Builder variables(VariableStore variables) {
            this.variables = variables;
            return this;
        }

        public Builder callStack(CallStack callStack) {
            this.callStack = Objects.requireNonNull(callStack, "callStack must not be null");
            return this;
        }

        /// Appends a log entry stamped with the builder's current flow and step count.
        ///
        /// @param kind category, not null
        /// @param nodeId node concerned, may be null
        /// @param message detail, not null
        /// @return this builder for chaining
        public Builder log(LogKind kind, String nodeId, String message) {
            this.log = log.push(new LogEntry(stepCount, flowId, nodeId, kind, message));
            return this;
        }

        public Builder logEntries(List<LogEntry> entriesOldestFirst) {
            this.log = PersistentStack.ofOldestFirst(entriesOldestFirst);
            return this;
        }

        public Builder history(HistoryEntry entry) {
            this.history = history.push(entry);
            return this;
        }

        public Builder historyEntries(List<HistoryEntry> entriesOldestFirst) {
            this.history = PersistentStack.ofOldestFirst(entriesOldestFirst);
            return this;
        }

        /// Records `nodeId` in the execution path at the current flow and call depth.
        ///
        /// @param nodeId node visited, not null
        /// @return this builder for chaining
        public Builder visit(String nodeId) {
            this.path = path.push(new PathEntry(stepCount, flowId, nodeId, callStack.depth()));
            return this;
        }

        public Builder stepCount(int stepCount) {
            this.stepCount = stepCount;
            return this;
        }

        public Builder maxSteps(int maxSteps) {
            if (maxSteps < 1) {
                throw new IllegalArgumentException("maxSteps must be positive");
            }
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder pendingChoices(List<ChoiceOption> pendingChoices) {
            this.pendingChoices = pendingChoices != null ? pendingChoices : List.of();
            return this;
        }

        public Builder error(EvaluationError error) {
            this.error = error;
            return this;
        }

        /// Builds the immutable state.
        ///
        /// @return new ExecutionState, never null
        /// @throws NullPointerException if a required field is missing
        public ExecutionState build() {
            return new ExecutionState(this);
        }
    }

    /// Two states are equal when they describe the same position and data, including log,
    /// history and path.
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExecutionState other)) return false;
        return stepCount == other.stepCount
                && maxSteps == other.maxSteps
                && flowId.equals(other.flowId)
                && Objects.equals(currentNodeId, other.currentNodeId)
                && variables.equals(other.variables)
                && callStack.equals(other.callStack)
                && status == other.status
                && pendingChoices.equals(other.pendingChoices)
                && Objects.equals(error, other.error)
                && log.equals(other.log)
                && history.equals(other.history)
                && path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(flowId, currentNodeId, variables, callStack, stepCount, status);
    }

    @Override
    public String toString() {
        return "ExecutionState{flow='"
                + flowId
                + "', node='"
                + currentNodeId
                + "', status="
                + status
                + ", step="
                + stepCount
                + "/"
                + maxSteps
                + ", depth="
                + callStack.depth()
                + "}";
    }
}
