package io.storyarn.cli.commands;

import io.storyarn.cli.execution.VerboseExecutionListener;
import io.storyarn.cli.ui.AnsiStyles;
import io.storyarn.cli.ui.SessionPrinter;
import io.storyarn.core.StoryarnConfig;
import io.storyarn.core.StoryarnFactory;
import io.storyarn.core.exception.FlowNotFoundException;
import io.storyarn.core.execution.DebugSession;
import io.storyarn.core.execution.FlowEngine;
import io.storyarn.core.state.ChoiceOption;
import io.storyarn.core.state.ExecutionState;
import io.storyarn.core.state.ExecutionStatus;
import io.storyarn.core.variable.VariableKey;
import io.storyarn.serialization.ProjectDocument;
import io.storyarn.serialization.ProjectSerializer;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import picocli.CommandLine;
import picocli.CommandLine.Option;

/// CLI command for playing a flow in a terminal debugger.
///
/// Interactive mode reads one command per line from standard input:
///
/// ```
/// Command          Effect
/// ————————————————+————————————————————————————————————————————————
/// <enter>, s      │ evaluate the current node once
/// 1, 2, ...       │ select a pending choice by number
/// b               │ step back to the previous undo point
/// c               │ continue after a step-limit pause
/// r               │ run until a choice, pause, breakpoint or end
/// v               │ show variables
/// log             │ show the last 20 log entries
/// set <ref> <v>   │ override a variable, e.g. set mc.jaime.gold 50
/// bp <node>       │ toggle a breakpoint
/// reset           │ start over from the initial state
/// q               │ quit
/// ```
///
/// With `--auto` the flow plays unattended, always taking the first available choice,
/// and stops at the first step-limit pause.
///
/// ### Usage
/// ```bash
/// storyarn play <project.json> [--flow <id>] [--auto] [--max-steps <n>] [--export <file>]
/// ```
///
/// Exit code is 1 when the session ends with an error or the project cannot be played.
@CommandLine.Command(name = "play", description = "Play a flow in the terminal debugger")
class PlayCommand extends ProjectCommand {

    private static final int LOG_TAIL = 20;

    @Option(
            names = "--flow",
            description = "Flow to start in (default: the project's start flow)")
    private String flowId;

    @Option(names = "--auto", description = "Play unattended, taking the first valid choice")
    private boolean auto;

    @Option(names = "--max-steps", description = "Steps before the engine pauses")
    private Integer maxSteps;

    @Option(names = "--max-call-depth", description = "Maximum nested subflow calls")
    private Integer maxCallDepth;

    @Option(
            names = {"-b", "--break"},
            description = "Node id to break at (repeatable)")
    private List<String> breakpoints = new ArrayList<>();

    @Option(names = "--export", description = "Write the final execution state as JSON")
    private Path exportFile;

    private AnsiStyles styles;

    @Override
    protected int execute() {
        try {
            ProjectDocument project = loadProject();
            StoryarnConfig config = loadConfig();
            if (maxSteps != null) {
                config.setMaxSteps(maxSteps);
            }
            if (maxCallDepth != null) {
                config.setMaxCallDepth(maxCallDepth);
            }

            String startFlow = flowId != null ? flowId : project.startFlowId();
            if (startFlow == null) {
                throw new IllegalArgumentException("Project has no flows");
            }

            styles = styles();
            StoryarnFactory.Builder factory =
                    StoryarnFactory.builder().config(config).flowRepository(project.repository());
            if (verbose) {
                factory.listener(
                        new VerboseExecutionListener(System.out, styles.isColorEnabled()));
            }
            FlowEngine engine = factory.build();
            SessionPrinter printer = new SessionPrinter(System.out, styles, engine);

            DebugSession session = engine.start(startFlow, project.variables());
            for (String nodeId : breakpoints) {
                session = session.toggleBreakpoint(nodeId);
            }

            session =
                    auto
                            ? autoPlay(engine, session, printer)
                            : interactive(engine, session, printer);
            printer.printSummary(session.state());

            if (exportFile != null) {
                Files.writeString(exportFile, ProjectSerializer.exportState(session.state()));
                System.out.println("Exported execution state to " + exportFile);
            }
            return session.state().getStatus() == ExecutionStatus.FINISHED_WITH_ERROR ? 1 : 0;
        } catch (FlowNotFoundException | IOException | RuntimeException e) {
            System.err.println(" [FAIL] Play failed: " + e.getMessage());
            return 1;
        }
    }

    private DebugSession autoPlay(FlowEngine engine, DebugSession session, SessionPrinter printer) {
        DebugSession current = session;
        while (true) {
            current = engine.run(current);
            ExecutionState state = current.state();
            if (state.getStatus() == ExecutionStatus.AWAITING_CHOICE) {
                printer.printState(state);
                Optional<ChoiceOption> first =
                        state.getPendingChoices().stream().filter(ChoiceOption::valid).findFirst();
                if (first.isEmpty()) {
                    return current;
                }
                System.out.println("  " + styles.autoChoice(first.get()));
                current = engine.selectChoice(current, first.get().id());
            } else if (state.getStatus() == ExecutionStatus.RUNNING) {
                System.out.println("Breakpoint at " + state.getCurrentNodeId());
                printer.printState(state);
            } else {
                printer.printState(state);
                return current;
            }
        }
    }

    private DebugSession interactive(
            FlowEngine engine, DebugSession session, SessionPrinter printer) throws IOException {
        BufferedReader in =
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        DebugSession current = session;
        printer.printState(current.state());
        System.out.println("Type 'h' for help.");

        while (true) {
            System.out.print("> ");
            System.out.flush();
            String line = in.readLine();
            if (line == null) {
                return current;
            }
            String command = line.trim();
            if (command.equals("q") || command.equals("quit")) {
                return current;
            }
            try {
                current = dispatch(engine, current, printer, command);
            } catch (IllegalArgumentException | IllegalStateException e) {
                System.out.println("  " + styles.failure(e.getMessage()));
            }
        }
    }

    private DebugSession dispatch(
            FlowEngine engine, DebugSession session, SessionPrinter printer, String command) {
        ExecutionState state = session.state();
        if (command.isEmpty() || command.equals("s") || command.equals("step")) {
            if (state.getStatus() != ExecutionStatus.RUNNING) {
                throw new IllegalStateException(hint(state.getStatus()));
            }
            return show(printer, engine.step(session).session());
        }
        if (command.chars().allMatch(Character::isDigit)) {
            int index = Integer.parseInt(command) - 1;
            List<ChoiceOption> choices = state.getPendingChoices();
            if (index < 0 || index >= choices.size()) {
                throw new IllegalArgumentException("No choice " + command);
            }
            return show(printer, engine.selectChoice(session, choices.get(index).id()));
        }
        if (command.equals("b") || command.equals("back")) {
            return show(
                    printer,
                    engine.stepBack(session)
                            .orElseThrow(
                                    () -> new IllegalStateException("Already at the start")));
        }
        if (command.equals("c") || command.equals("continue")) {
            return show(printer, engine.continueAfterPause(session));
        }
        if (command.equals("r") || command.equals("run")) {
            return show(printer, engine.run(session));
        }
        if (command.equals("v") || command.equals("vars")) {
            printer.printVariables(state);
            return session;
        }
        if (command.equals("log")) {
            printer.printLog(state, LOG_TAIL);
            return session;
        }
        if (command.equals("reset")) {
            return show(printer, engine.reset(session));
        }
        if (command.startsWith("set ")) {
            String[] parts = command.substring(4).trim().split("\\s+", 2);
            if (parts.length < 2) {
                throw new IllegalArgumentException("Usage: set <sheet.variable> <value>");
            }
            DebugSession updated = engine.setVariable(session, parts[0], parts[1]);
            VariableKey key = VariableKey.parse(parts[0]);
            System.out.println(
                    "  " + key.ref() + " = " + updated.state().getVariables().get(key).display());
            return updated;
        }
        if (command.startsWith("bp ")) {
            String nodeId = command.substring(3).trim();
            DebugSession updated = session.toggleBreakpoint(nodeId);
            System.out.println(
                    "  Breakpoint "
                            + (updated.breakpoints().contains(nodeId) ? "set" : "cleared")
                            + " at "
                            + nodeId);
            return updated;
        }
        if (command.equals("h") || command.equals("help")) {
            printHelp();
            return session;
        }
        throw new IllegalArgumentException(
                "Unknown command '" + command + "', type 'h' for help");
    }

    private static DebugSession show(SessionPrinter printer, DebugSession session) {
        printer.printState(session.state());
        return session;
    }

    private static String hint(ExecutionStatus status) {
        return switch (status) {
            case AWAITING_CHOICE -> "Waiting for a choice; enter its number";
            case PAUSED -> "Paused at the step limit; type 'c' to continue";
            default -> "Session has ended; type 'b' to step back or 'reset'";
        };
    }

    private static void printHelp() {
        System.out.println("  <enter>/s  step          1,2,...  choose");
        System.out.println("  b          step back     c        continue after pause");
        System.out.println("  r          run           v        variables");
        System.out.println("  log        recent log    reset    start over");
        System.out.println("  set <ref> <value>        bp <node>  toggle breakpoint");
        System.out.println("  q          quit");
    }
}
