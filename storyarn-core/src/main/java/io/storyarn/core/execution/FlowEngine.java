package io.storyarn.core.execution;

import io.storyarn.core.StoryarnConfig;
import io.storyarn.core.condition.ConditionEvaluator;
import io.storyarn.core.error.ErrorKind;
import io.storyarn.core.error.EvaluationError;
import io.storyarn.core.exception.FlowNotFoundException;
import io.storyarn.core.execution.evaluator.DefaultNodeEvaluatorRegistry;
import io.storyarn.core.execution.evaluator.DialogueNodeEvaluator;
import io.storyarn.core.execution.evaluator.EvaluationContext;
import io.storyarn.core.execution.evaluator.NodeEvaluator;
import io.storyarn.core.execution.evaluator.NodeEvaluatorRegistry;
import io.storyarn.core.execution.evaluator.NodeOutcome;
import io.storyarn.core.execution.log.ChangeSource;
import io.storyarn.core.execution.log.HistoryEntry;
import io.storyarn.core.execution.log.LogKind;
import io.storyarn.core.execution.transition.Transition;
import io.storyarn.core.flow.Flow;
import io.storyarn.core.flow.FlowRepository;
import io.storyarn.core.flow.node.DialogueNode;
import io.storyarn.core.flow.node.EntryNode;
import io.storyarn.core.flow.node.Node;
import io.storyarn.core.flow.node.Response;
import io.storyarn.core.instruction.InstructionExecutor;
import io.storyarn.core.instruction.VariableChange;
import io.storyarn.core.state.CallFrame;
import io.storyarn.core.state.CallStack;
import io.storyarn.core.state.ChoiceOption;
import io.storyarn.core.state.ExecutionState;
import io.storyarn.core.state.ExecutionStatus;
import io.storyarn.core.state.SnapshotStack;
import io.storyarn.core.variable.Value;
import io.storyarn.core.variable.Values;
import io.storyarn.core.variable.Variable;
import io.storyarn.core.variable.VariableKey;
import io.storyarn.core.variable.VariableStore;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Steppable interpreter for flow graphs.
///
/// The engine never runs on its own: every transition is driven by an explicit call
/// ({@link #step}, {@link #stepBack}, {@link #selectChoice}, {@link #continueAfterPause}).
/// Each call takes a {@link DebugSession} and returns a new one; the engine itself holds
/// no per-session state, so one engine can drive any number of independent sessions.
///
/// ### One step
/// 1. The current state is pushed onto the session's undo history
/// 2. The current node is evaluated by its {@link NodeEvaluator}
/// 3. The evaluator's variable writes, log notes and transition are applied
/// 4. The step count is incremented; reaching the step limit pauses the session
///
/// ### Error policy
/// Recoverable problems (undefined variables, type mismatches) are logged as warnings and
/// the step continues. Structural problems (missing targets, call stack overflow) end the
/// session with {@link ExecutionStatus#FINISHED_WITH_ERROR}; they are returned, not thrown.
/// Exceptions are reserved for API misuse, such as selecting a response while no choice
/// is pending.
///
/// @implNote Stateless between calls and safe to share. A single session must not be
/// advanced concurrently from several threads.
///
/// @see DebugSession for the session value
/// @see ExecutionState for what a state holds
public class FlowEngine {

    private static final Logger logger = Logger.getLogger(FlowEngine.class.getName());

    private final FlowRepository flowRepository;
    private final NodeEvaluatorRegistry evaluatorRegistry;
    private final ConditionEvaluator conditionEvaluator;
    private final InstructionExecutor instructionExecutor;
    private final StoryarnConfig config;
    private final ExecutionListener listener;
    private final DialogueNodeEvaluator responseSelector;

    /// Creates an engine with explicit collaborators.
    ///
    /// @param flowRepository source of flows, not null
    /// @param evaluatorRegistry node evaluators, not null
    /// @param conditionEvaluator condition evaluation, not null
    /// @param instructionExecutor assignment execution, not null
    /// @param config engine settings, not null
    /// @param listener lifecycle observer, not null (use {@link ExecutionListener#NOOP})
    public FlowEngine(
            FlowRepository flowRepository,
            NodeEvaluatorRegistry evaluatorRegistry,
            ConditionEvaluator conditionEvaluator,
            InstructionExecutor instructionExecutor,
            StoryarnConfig config,
            ExecutionListener listener) {
        this.flowRepository = Objects.requireNonNull(flowRepository, "flowRepository");
        this.evaluatorRegistry = Objects.requireNonNull(evaluatorRegistry, "evaluatorRegistry");
        this.conditionEvaluator = Objects.requireNonNull(conditionEvaluator, "conditionEvaluator");
        this.instructionExecutor =
                Objects.requireNonNull(instructionExecutor, "instructionExecutor");
        this.config = Objects.requireNonNull(config, "config");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.responseSelector =
                evaluatorRegistry
                        .getEvaluator(DialogueNode.class)
                        .filter(DialogueNodeEvaluator.class::isInstance)
                        .map(DialogueNodeEvaluator.class::cast)
                        .orElseGet(DialogueNodeEvaluator::new);
    }

    /// Creates an engine with the built-in evaluators and no listener.
    ///
    /// @param flowRepository source of flows, not null
    /// @param config engine settings, not null
    public FlowEngine(FlowRepository flowRepository, StoryarnConfig config) {
        this(
                flowRepository,
                new DefaultNodeEvaluatorRegistry(),
                new ConditionEvaluator(),
                new InstructionExecutor(),
                config,
                ExecutionListener.NOOP);
    }

    public StoryarnConfig getConfig() {
        return config;
    }

    /// Starts a session at the entry node of `flowId`.
    ///
    /// @param flowId flow to play, not null
    /// @param variables initial variables, not null
    /// @return new session in status {@link ExecutionStatus#RUNNING}, never null
    /// @throws FlowNotFoundException if the flow is unknown or has no entry node
    public DebugSession start(String flowId, VariableStore variables)
            throws FlowNotFoundException {
        Objects.requireNonNull(flowId, "flowId must not be null");
        Objects.requireNonNull(variables, "variables must not be null");
        Flow flow =
                flowRepository
                        .findById(flowId)
                        .orElseThrow(() -> new FlowNotFoundException("Flow not found: " + flowId));
        EntryNode entry =
                flow.findEntry()
                        .orElseThrow(
                                () ->
                                        new FlowNotFoundException(
                                                "Flow " + flowId + " has no entry node"));

        ExecutionState state =
                ExecutionState.builder()
                        .flowId(flowId)
                        .currentNodeId(entry.getId())
                        .variables(variables)
                        .maxSteps(config.getMaxSteps())
                        .status(ExecutionStatus.RUNNING)
                        .log(LogKind.INFO, entry.getId(), "Started flow " + flow.getName())
                        .visit(entry.getId())
                        .build();
        logger.info("Started flow " + flowId + " with " + variables.size() + " variable(s)");
        return DebugSession.start(state);
    }

    /// Evaluates the current node once.
    ///
    /// Does nothing unless the session is {@link ExecutionStatus#RUNNING}.
    ///
    /// @param session session to advance, not null
    /// @return the advanced session and whether an undo point was recorded, never null
    public StepResult step(DebugSession session) {
        ExecutionState state = session.state();
        if (state.getStatus() != ExecutionStatus.RUNNING) {
            return new StepResult(session, false);
        }
        SnapshotStack snapshots = session.snapshots().push(state);
        ExecutionState next = evaluateCurrent(state);
        return new StepResult(
                new DebugSession(next, snapshots, session.initialState(), session.breakpoints()),
                true);
    }

    /// Restores the state before the most recent step, choice or resume after a pause.
    ///
    /// The restored state is exactly the recorded one, including its log and step count.
    ///
    /// @param session session to rewind, not null
    /// @return the rewound session, or empty when already at the start
    public Optional<DebugSession> stepBack(DebugSession session) {
        Optional<ExecutionState> previous = session.snapshots().peek();
        if (previous.isEmpty()) {
            return Optional.empty();
        }
        logger.fine("Stepped back to " + previous.get().getCurrentNodeId());
        return Optional.of(
                new DebugSession(
                        previous.get(),
                        session.snapshots().pop(),
                        session.initialState(),
                        session.breakpoints()));
    }

    /// Selects a pending dialogue response.
    ///
    /// Runs the response's assignments and advances along its edge. Counts as a step and
    /// records an undo point.
    ///
    /// @param session session awaiting a choice, not null
    /// @param responseId id of a valid pending response, not null
    /// @return the advanced session, never null
    /// @throws IllegalStateException if the session is not awaiting a choice
    /// @throws IllegalArgumentException if the response is unknown or not valid
    public DebugSession selectChoice(DebugSession session, String responseId) {
        ExecutionState state = session.state();
        if (state.getStatus() != ExecutionStatus.AWAITING_CHOICE) {
            throw new IllegalStateException(
                    "Session is not awaiting a choice (status " + state.getStatus() + ")");
        }
        ChoiceOption option =
                state.getPendingChoices().stream()
                        .filter(o -> o.id().equals(responseId))
                        .findFirst()
                        .orElseThrow(() -> unknownResponse(responseId));
        if (!option.valid()) {
            throw new IllegalArgumentException("Response " + responseId + " is not available");
        }

        Flow flow = requireFlow(state.getFlowId());
        Node node =
                flow.findNode(state.getCurrentNodeId())
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "Node " + state.getCurrentNodeId() + " not found"));
        if (!(node instanceof DialogueNode dialogue)) {
            throw new IllegalStateException("Node " + node.getId() + " is not a dialogue");
        }
        Response response =
                dialogue.findResponse(responseId)
                        .orElseThrow(() -> unknownResponse(responseId));

        SnapshotStack snapshots = session.snapshots().push(state);
        NodeOutcome outcome =
                responseSelector.select(
                        dialogue, response, context(state, flow), state.getVariables());
        int step = state.getStepCount() + 1;
        ExecutionState.Builder builder =
                state.toBuilder()
                        .stepCount(step)
                        .status(ExecutionStatus.RUNNING)
                        .pendingChoices(List.of())
                        .log(LogKind.CHOICE, node.getId(), "Selected \"" + response.text() + "\"");
        apply(builder, state, flow, node, outcome, step);
        ExecutionState next = completeStep(node, builder.build());
        return new DebugSession(next, snapshots, session.initialState(), session.breakpoints());
    }

    /// Resumes a session paused at its step limit, raising the limit by the configured
    /// increment.
    ///
    /// Records an undo point, so stepping back from the resumed session returns to the
    /// paused state.
    ///
    /// @param session paused session, not null
    /// @return the resumed session in status {@link ExecutionStatus#RUNNING}, never null
    /// @throws IllegalStateException if the session is not paused
    public DebugSession continueAfterPause(DebugSession session) {
        ExecutionState state = session.state();
        if (state.getStatus() != ExecutionStatus.PAUSED) {
            throw new IllegalStateException(
                    "Session is not paused (status " + state.getStatus() + ")");
        }
        int raised = state.getMaxSteps() + config.getStepLimitIncrement();
        ExecutionState resumed =
                state.toBuilder()
                        .maxSteps(raised)
                        .status(ExecutionStatus.RUNNING)
                        .log(
                                LogKind.INFO,
                                state.getCurrentNodeId(),
                                "Step limit raised to " + raised)
                        .build();
        logger.info("Resumed at step " + state.getStepCount() + ", new limit " + raised);
        return new DebugSession(
                resumed,
                session.snapshots().push(state),
                session.initialState(),
                session.breakpoints());
    }

    /// Overrides a variable's value from the debugger.
    ///
    /// The write is recorded in the variable history with source
    /// {@link ChangeSource#USER_OVERRIDE}. It is not an undo point.
    ///
    /// @param session session to modify, not null
    /// @param key declared variable, not null
    /// @param value new value of the variable's type, not null
    /// @return the modified session, never null
    /// @throws IllegalArgumentException if the variable is unknown or the value has the wrong type
    public DebugSession setVariable(DebugSession session, VariableKey key, Value value) {
        ExecutionState state = session.state();
        Variable variable =
                state.getVariables()
                        .find(key)
                        .orElseThrow(() -> unknownVariable(key));
        VariableStore updated = state.getVariables().set(key, value);
        ExecutionState next =
                state.toBuilder()
                        .variables(updated)
                        .history(
                                new HistoryEntry(
                                        state.getStepCount(),
                                        null,
                                        key,
                                        variable.value(),
                                        value,
                                        null,
                                        ChangeSource.USER_OVERRIDE))
                        .log(
                                LogKind.INFO,
                                null,
                                "User override: "
                                        + key
                                        + ": "
                                        + variable.value().display()
                                        + " -> "
                                        + value.display())
                        .build();
        return session.withState(next);
    }

    /// Overrides a variable from a literal, parsed against the variable's declared type.
    ///
    /// @param session session to modify, not null
    /// @param reference variable as `sheet.variable`, not null
    /// @param literal value as text, may be null to unset
    /// @return the modified session, never null
    /// @throws IllegalArgumentException if the variable is unknown or the literal unreadable
    public DebugSession setVariable(DebugSession session, String reference, String literal) {
        VariableKey key = VariableKey.parse(reference);
        Variable variable =
                session.state()
                        .getVariables()
                        .find(key)
                        .orElseThrow(() -> unknownVariable(key));
        Value value =
                Values.parse(literal, variable.type())
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "'"
                                                        + literal
                                                        + "' is not a valid "
                                                        + variable.type().wireName()));
        return setVariable(session, key, value);
    }

    /// Starts over from the session's initial state. Undo history is cleared; breakpoints
    /// are kept.
    ///
    /// @param session session to reset, not null
    /// @return the reset session, never null
    public DebugSession reset(DebugSession session) {
        return new DebugSession(
                session.initialState(),
                SnapshotStack.empty(),
                session.initialState(),
                session.breakpoints());
    }

    /// Steps until the session stops running or reaches a breakpoint.
    ///
    /// The node the session is at when `run` is called never counts as a breakpoint hit,
    /// so calling `run` again continues past it.
    ///
    /// @param session session to play, not null
    /// @return the session where play stopped, never null
    public DebugSession run(DebugSession session) {
        DebugSession current = session;
        boolean first = true;
        while (current.state().getStatus() == ExecutionStatus.RUNNING) {
            if (!first && current.isAtBreakpoint()) {
                logger.fine("Breakpoint hit at " + current.state().getCurrentNodeId());
                break;
            }
            current = step(current).session();
            first = false;
        }
        return current;
    }

    /// Resolves the node a state is positioned at.
    ///
    /// @param state any state, not null
    /// @return the node, or empty if its flow or id no longer resolves
    public Optional<Node> currentNode(ExecutionState state) {
        return flowRepository
                .findById(state.getFlowId())
                .flatMap(f -> f.findNode(state.getCurrentNodeId()));
    }

    private ExecutionState evaluateCurrent(ExecutionState state) {
        int step = state.getStepCount() + 1;
        Optional<Flow> flow = flowRepository.findById(state.getFlowId());
        Optional<Node> found = flow.flatMap(f -> f.findNode(state.getCurrentNodeId()));
        if (found.isEmpty()) {
            ExecutionState.Builder builder = state.toBuilder().stepCount(step);
            fail(
                    builder,
                    state.getCurrentNodeId(),
                    EvaluationError.missingTarget(
                            state.getCurrentNodeId(),
                            "Node "
                                    + state.getCurrentNodeId()
                                    + " not found in flow "
                                    + state.getFlowId()));
            ExecutionState failed = builder.build();
            listener.onFinish(failed);
            return failed;
        }

        Node node = found.get();
        listener.onNodeStart(node, state);
        logger.fine("Step " + step + ": evaluating " + node);

        NodeEvaluator<Node> evaluator = evaluatorRegistry.getEvaluatorFor(node);
        NodeOutcome outcome = evaluator.evaluate(node, context(state, flow.get()));

        ExecutionState.Builder builder = state.toBuilder().stepCount(step);
        apply(builder, state, flow.get(), node, outcome, step);
        return completeStep(node, builder.build());
    }

    private void apply(
            ExecutionState.Builder builder,
            ExecutionState before,
            Flow flow,
            Node node,
            NodeOutcome outcome,
            int step) {
        builder.variables(outcome.variables());
        for (NodeOutcome.Note note : outcome.notes()) {
            builder.log(note.kind(), node.getId(), note.message());
        }
        for (VariableChange change : outcome.changes()) {
            builder.history(
                    new HistoryEntry(
                            step,
                            node.getId(),
                            change.key(),
                            change.oldValue(),
                            change.newValue(),
                            change.operator(),
                            ChangeSource.INSTRUCTION));
            builder.log(
                    LogKind.INFO,
                    node.getId(),
                    change.key()
                            + ": "
                            + change.oldValue().display()
                            + " -> "
                            + change.newValue().display());
        }
        applyTransition(builder, before, flow, node, outcome.transition());
    }

    private void applyTransition(
            ExecutionState.Builder builder,
            ExecutionState before,
            Flow flow,
            Node node,
            Transition transition) {
        String nodeId = node.getId();

        if (transition instanceof Transition.Advance advance) {
            String target = advance.nodeId();
            if (!flow.hasNode(target)) {
                fail(
                        builder,
                        nodeId,
                        EvaluationError.missingTarget(
                                nodeId,
                                "Node "
                                        + target
                                        + " reached from "
                                        + nodeId
                                        + " does not exist in flow "
                                        + flow.getId()));
                return;
            }
            builder.currentNodeId(target)
                    .pendingChoices(List.of())
                    .log(LogKind.ADVANCE, nodeId, nodeId + " -> " + target)
                    .visit(target);

        } else if (transition instanceof Transition.AwaitChoice choice) {
            List<ChoiceOption> valid = choice.validOptions();
            if (valid.isEmpty()) {
                builder.status(ExecutionStatus.FINISHED)
                        .pendingChoices(List.of())
                        .log(
                                LogKind.WARNING,
                                nodeId,
                                "No valid responses in " + nodeId + "; finished");
                return;
            }
            builder.status(ExecutionStatus.AWAITING_CHOICE)
                    .pendingChoices(choice.options())
                    .log(
                            LogKind.CHOICE,
                            nodeId,
                            "Waiting for a choice among " + valid.size() + " response(s)");

        } else if (transition instanceof Transition.EnterFlow enter) {
            enterFlow(builder, before.getCallStack(), nodeId, enter);

        } else if (transition instanceof Transition.ReturnFromFlow) {
            returnFromFlow(builder, before.getCallStack(), nodeId);

        } else if (transition instanceof Transition.Finished finished) {
            builder.status(ExecutionStatus.FINISHED).log(LogKind.INFO, nodeId, finished.reason());

        } else if (transition instanceof Transition.Failed failed) {
            fail(builder, nodeId, failed.error());
        }
    }

    private void enterFlow(
            ExecutionState.Builder builder,
            CallStack stack,
            String nodeId,
            Transition.EnterFlow enter) {
        if (stack.depth() >= config.getMaxCallDepth()) {
            fail(
                    builder,
                    nodeId,
                    new EvaluationError(
                            ErrorKind.CALL_STACK_OVERFLOW,
                            nodeId,
                            "Call depth limit of "
                                    + config.getMaxCallDepth()
                                    + " reached entering flow "
                                    + enter.flowId()));
            return;
        }
        Optional<Flow> target = flowRepository.findById(enter.flowId());
        if (target.isEmpty()) {
            fail(
                    builder,
                    nodeId,
                    EvaluationError.missingTarget(
                            nodeId, "Flow " + enter.flowId() + " does not exist"));
            return;
        }
        Optional<EntryNode> entry = target.get().findEntry();
        if (entry.isEmpty()) {
            fail(
                    builder,
                    nodeId,
                    EvaluationError.missingTarget(
                            nodeId, "Flow " + enter.flowId() + " has no entry node"));
            return;
        }
        CallStack pushed = stack.push(enter.frame());
        builder.log(
                        LogKind.ADVANCE,
                        nodeId,
                        "Entered flow " + enter.flowId() + " (depth " + pushed.depth() + ")")
                .flowId(enter.flowId())
                .callStack(pushed)
                .currentNodeId(entry.get().getId())
                .pendingChoices(List.of())
                .visit(entry.get().getId());
    }

    private void returnFromFlow(ExecutionState.Builder builder, CallStack stack, String nodeId) {
        CallStack remaining = stack;
        while (true) {
            Optional<CallFrame> top = remaining.peek();
            if (top.isEmpty()) {
                builder.callStack(remaining)
                        .status(ExecutionStatus.FINISHED)
                        .log(LogKind.INFO, nodeId, "Returned with an empty call stack; finished");
                return;
            }
            CallFrame frame = top.get();
            remaining = remaining.pop();
            if (!frame.hasReturnNode()) {
                continue;
            }
            Optional<Flow> caller = flowRepository.findById(frame.returnFlowId());
            if (caller.isEmpty() || !caller.get().hasNode(frame.returnNodeId())) {
                builder.callStack(remaining);
                fail(
                        builder,
                        nodeId,
                        EvaluationError.missingTarget(
                                nodeId,
                                "Return point "
                                        + frame.returnFlowId()
                                        + "/"
                                        + frame.returnNodeId()
                                        + " does not exist"));
                return;
            }
            builder.log(
                            LogKind.ADVANCE,
                            nodeId,
                            "Returned to flow "
                                    + frame.returnFlowId()
                                    + " at "
                                    + frame.returnNodeId())
                    .flowId(frame.returnFlowId())
                    .callStack(remaining)
                    .currentNodeId(frame.returnNodeId())
                    .visit(frame.returnNodeId());
            return;
        }
    }

    private static void fail(ExecutionState.Builder builder, String nodeId, EvaluationError error) {
        logger.warning("Execution failed at " + nodeId + ": " + error);
        builder.status(ExecutionStatus.FINISHED_WITH_ERROR)
                .error(error)
                .pendingChoices(List.of())
                .log(
                        LogKind.ERROR,
                        nodeId,
                        error.kind() + " at " + nodeId + ": " + error.message());
    }

    private ExecutionState completeStep(Node node, ExecutionState state) {
        ExecutionState result = state;
        if (result.getStatus() == ExecutionStatus.RUNNING
                && result.getStepCount() >= result.getMaxSteps()) {
            result =
                    result.toBuilder()
                            .status(ExecutionStatus.PAUSED)
                            .log(
                                    LogKind.PAUSE,
                                    result.getCurrentNodeId(),
                                    ErrorKind.STEP_LIMIT_REACHED
                                            + ": paused after "
                                            + result.getStepCount()
                                            + " steps")
                            .build();
        }
        listener.onNodeComplete(node, result);
        if (result.getStatus() == ExecutionStatus.PAUSED) {
            logger.info("Paused at step " + result.getStepCount());
            listener.onPause(result);
        } else if (result.getStatus().isTerminal()) {
            logger.info("Session finished with status " + result.getStatus());
            listener.onFinish(result);
        }
        return result;
    }

    private EvaluationContext context(ExecutionState state, Flow flow) {
        return EvaluationContext.builder()
                .state(state)
                .flow(flow)
                .conditionEvaluator(conditionEvaluator)
                .instructionExecutor(instructionExecutor)
                .flowRepository(flowRepository)
                .config(config)
                .build();
    }

    private Flow requireFlow(String flowId) {
        return flowRepository
                .findById(flowId)
                .orElseThrow(() -> new IllegalStateException("Flow not found: " + flowId));
    }

    private static IllegalArgumentException unknownResponse(String responseId) {
        return new IllegalArgumentException("Unknown response: " + responseId);
    }

    private static IllegalArgumentException unknownVariable(VariableKey key) {
        return new IllegalArgumentException("Unknown variable: " + key);
    }
}
