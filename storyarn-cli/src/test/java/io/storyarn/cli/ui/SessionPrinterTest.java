package io.storyarn.cli.ui;

import static org.assertj.core.api.Assertions.assertThat;

import io.storyarn.core.StoryarnFactory;
import io.storyarn.core.condition.ConditionOperator;
import io.storyarn.core.condition.ConditionTree;
import io.storyarn.core.condition.Rule;
import io.storyarn.core.execution.DebugSession;
import io.storyarn.core.execution.FlowEngine;
import io.storyarn.core.flow.Flow;
import io.storyarn.core.flow.InMemoryFlowRepository;
import io.storyarn.core.flow.node.DialogueNode;
import io.storyarn.core.flow.node.EntryNode;
import io.storyarn.core.flow.node.ExitMode;
import io.storyarn.core.flow.node.ExitNode;
import io.storyarn.core.flow.node.Response;
import io.storyarn.core.variable.Value;
import io.storyarn.core.variable.Variable;
import io.storyarn.core.variable.VariableStore;
import io.storyarn.core.variable.VariableType;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionPrinterTest {

    private ByteArrayOutputStream outputStream;
    private FlowEngine engine;
    private SessionPrinter printer;
    private VariableStore variables;

    @BeforeEach
    void setUp() {
        outputStream = new ByteArrayOutputStream();
        Flow flow =
                Flow.builder()
                        .id("gate")
                        .node(EntryNode.builder().id("entry").next("guard").build())
                        .node(
                                DialogueNode.builder()
                                        .id("guard")
                                        .speaker("guard")
                                        .text("Halt!")
                                        .response(
                                                new Response(
                                                        "bribe",
                                                        "Here's some gold.",
                                                        ConditionTree.single(
                                                                Rule.of(
                                                                        "mc.gold",
                                                                        ConditionOperator
                                                                                .GREATER_THAN,
                                                                        "10")),
                                                        List.of(),
                                                        "end"))
                                        .response(Response.of("run", "Run!", "end"))
                                        .response(Response.of("talk", "Let's talk.", "end"))
                                        .build())
                        .node(ExitNode.builder().id("end").mode(ExitMode.TERMINAL).build())
                        .build();
        engine = StoryarnFactory.createEngine(InMemoryFlowRepository.of(flow));
        printer =
                new SessionPrinter(
                        new PrintStream(outputStream, true, StandardCharsets.UTF_8),
                        AnsiStyles.of(false),
                        engine);
        variables = VariableStore.of(Variable.of("mc.gold", VariableType.NUMBER, Value.number(3)));
    }

    @Test
    void shouldPrintDialogueAndNumberedChoices() throws Exception {
        DebugSession session = engine.run(engine.start("gate", variables));

        printer.printState(session.state());

        assertThat(output())
                .contains("gate/guard (dialogue)")
                .contains("guard: Halt!")
                .contains("✗ 1. Here's some gold. (unavailable)")
                .contains("✓ 2. Run!")
                .contains("✓ 3. Let's talk.");
    }

    @Test
    void shouldPrintVariablesAndLog() throws Exception {
        DebugSession session = engine.start("gate", variables);

        printer.printVariables(session.state());
        printer.printLog(session.state(), 5);

        assertThat(output()).contains("• mc.gold = 3").contains("Started flow gate");
    }

    @Test
    void shouldPrintSummary() throws Exception {
        DebugSession session = engine.run(engine.start("gate", variables));
        session = engine.run(engine.selectChoice(session, "run"));

        printer.printSummary(session.state());

        assertThat(output())
                .contains("Status: FINISHED")
                .contains("Steps: " + session.state().getStepCount())
                .doesNotContain("Error:");
    }

    private String output() {
        return outputStream.toString(StandardCharsets.UTF_8);
    }
}
