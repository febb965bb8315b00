package io.storyarn.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.storyarn.core.condition.RuleResult;
import io.storyarn.core.error.EvaluationError;
import io.storyarn.core.execution.log.HistoryEntry;
import io.storyarn.core.execution.log.LogEntry;
import io.storyarn.core.execution.log.PathEntry;
import io.storyarn.core.state.CallFrame;
import io.storyarn.core.state.ChoiceOption;
import io.storyarn.core.state.ExecutionState;
import io.storyarn.core.variable.Value;
import io.storyarn.core.variable.VariableKey;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;
import java.util.Optional;

/// Exports an execution state for inspection: position, status, call stack, variables,
/// pending choices, the console log, variable history and the visited path.
///
/// Export only. Sessions are not restored from this form; the snapshot stack that backs
/// step-back is not written.
///
/// Call frames are written innermost first, matching {@link
/// io.storyarn.core.state.CallStack#frames()}.
class ExecutionStateSerializer extends StdSerializer<ExecutionState> {

    @Serial private static final long serialVersionUID = -7719860132245471903L;

    ExecutionStateSerializer() {
        super(ExecutionState.class);
    }

    @Override
    public void serialize(ExecutionState state, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("flow_id", state.getFlowId());
        Json.writeIfNotNull(gen, "current_node_id", state.getCurrentNodeId());
        gen.writeStringField("status", state.getStatus().name().toLowerCase());
        gen.writeNumberField("step_count", state.getStepCount());
        gen.writeNumberField("max_steps", state.getMaxSteps());

        gen.writeArrayFieldStart("call_stack");
        for (CallFrame frame : state.getCallStack().frames()) {
            gen.writeStartObject();
            gen.writeStringField("return_flow_id", frame.returnFlowId());
            Json.writeIfNotNull(gen, "return_node_id", frame.returnNodeId());
            Json.writeIfNotNull(gen, "caller_node_id", frame.callerNodeId());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeObjectFieldStart("variables");
        for (Map.Entry<VariableKey, Value> entry : state.getVariablesSnapshot().entrySet()) {
            gen.writeFieldName(entry.getKey().ref());
            ValueJson.write(gen, entry.getValue());
        }
        gen.writeEndObject();

        if (!state.getPendingChoices().isEmpty()) {
            gen.writeArrayFieldStart("pending_choices");
            for (ChoiceOption choice : state.getPendingChoices()) {
                writeChoice(choice, gen);
            }
            gen.writeEndArray();
        }

        Optional<EvaluationError> error = state.getError();
        if (error.isPresent()) {
            gen.writeObjectFieldStart("error");
            gen.writeStringField("kind", error.get().kind().name().toLowerCase());
            Json.writeIfNotNull(gen, "reference", error.get().reference());
            gen.writeStringField("message", error.get().message());
            gen.writeEndObject();
        }

        gen.writeArrayFieldStart("log");
        for (LogEntry entry : state.getLog()) {
            gen.writeStartObject();
            gen.writeNumberField("step", entry.step());
            Json.writeIfNotNull(gen, "flow_id", entry.flowId());
            Json.writeIfNotNull(gen, "node_id", entry.nodeId());
            gen.writeStringField("kind", entry.kind().name().toLowerCase());
            gen.writeStringField("message", entry.message());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("history");
        for (HistoryEntry entry : state.getHistory()) {
            writeHistory(entry, gen);
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("path");
        for (PathEntry entry : state.getPath()) {
            gen.writeStartObject();
            gen.writeNumberField("step", entry.step());
            gen.writeStringField("flow_id", entry.flowId());
            gen.writeStringField("node_id", entry.nodeId());
            gen.writeNumberField("depth", entry.depth());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeEndObject();
    }

    private void writeChoice(ChoiceOption choice, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", choice.id());
        gen.writeStringField("text", choice.text());
        gen.writeBooleanField("valid", choice.valid());
        Json.writeIfNotNull(gen, "target", choice.targetNodeId());
        if (!choice.ruleResults().isEmpty()) {
            gen.writeArrayFieldStart("rule_results");
            for (RuleResult result : choice.ruleResults()) {
                gen.writeStartObject();
                Json.writeIfNotNull(gen, "rule_id", result.ruleId());
                gen.writeStringField("reference", result.reference());
                gen.writeStringField("operator", result.operator().wireName());
                Json.writeIfNotNull(gen, "expected", result.expected());
                gen.writeFieldName("actual");
                ValueJson.write(gen, result.actual());
                gen.writeBooleanField("passed", result.passed());
                gen.writeEndObject();
            }
            gen.writeEndArray();
        }
        gen.writeEndObject();
    }

    private void writeHistory(HistoryEntry entry, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeNumberField("step", entry.step());
        Json.writeIfNotNull(gen, "node_id", entry.nodeId());
        gen.writeStringField("variable", entry.key().ref());
        gen.writeFieldName("old_value");
        ValueJson.write(gen, entry.oldValue());
        gen.writeFieldName("new_value");
        ValueJson.write(gen, entry.newValue());
        if (entry.operator() != null) {
            gen.writeStringField("operator", entry.operator().wireName());
        }
        gen.writeStringField("source", entry.source().name().toLowerCase());
        gen.writeEndObject();
    }
}
