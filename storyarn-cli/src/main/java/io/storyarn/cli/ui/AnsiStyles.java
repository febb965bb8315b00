package io.storyarn.cli.ui;

import io.storyarn.core.execution.log.LogKind;
import io.storyarn.core.state.ChoiceOption;
import io.storyarn.core.state.ExecutionStatus;
import io.storyarn.core.validation.Severity;

/// Terminal styling for debugger sessions.
///
/// Colors follow what a line means to the person stepping through a flow: the session's
/// status, the kind of log entry, whether a response can be picked and how severe a
/// validation issue is. With color disabled every method returns its plain text, so the
/// rendered layout is identical either way.
///
/// ### Usage
/// ```java
/// AnsiStyles styles = AnsiStyles.of(true);
/// System.out.println(styles.status(ExecutionStatus.FINISHED));
/// System.out.println(styles.choice(1, option));
/// ```
///
/// @implNote **Thread-safe**. Instances are immutable after construction.
public final class AnsiStyles {

    private static final String BOLD = "\033[1m";
    private static final String GRAY = "\033[38;5;244m";
    private static final String DIM = "\033[38;5;241m";
    private static final String GREEN = "\033[0;32m";
    private static final String RED = "\033[38;5;167m";
    private static final String YELLOW = "\033[38;5;214m";
    private static final String BLUE = "\033[38;5;39m";
    private static final String RESET = "\033[0m";

    private static final String RULE = "─".repeat(61);

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    /// @param useColor true to apply ANSI codes, false for plain text
    /// @return new instance, never null
    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    public boolean isColorEnabled() {
        return useColor;
    }

    /// Colors `text` by the status it reports.
    ///
    /// Finished sessions are green, failed ones red, paused ones yellow and sessions
    /// awaiting a choice blue. A running session is left unstyled.
    ///
    /// @param status status the text describes, not null
    /// @param text text to color, not null
    /// @return styled text, never null
    public String forStatus(ExecutionStatus status, String text) {
        switch (status) {
            case FINISHED:
                return paint(text, GREEN);
            case FINISHED_WITH_ERROR:
                return paint(text, RED);
            case PAUSED:
                return paint(text, YELLOW);
            case AWAITING_CHOICE:
                return paint(text, BLUE);
            case RUNNING:
            default:
                return text;
        }
    }

    /// Renders a status by name, colored by {@link #forStatus(ExecutionStatus, String)}.
    public String status(ExecutionStatus status) {
        return forStatus(status, status.name());
    }

    /// Colors an execution log line by its entry kind.
    ///
    /// @param kind kind of the log entry, not null
    /// @param line rendered entry, not null
    /// @return styled line, never null
    public String forLog(LogKind kind, String line) {
        switch (kind) {
            case ERROR:
                return paint(line, RED);
            case PAUSE:
            case WARNING:
                return paint(line, YELLOW);
            case CHOICE:
                return paint(line, BLUE);
            default:
                return paint(line, GRAY);
        }
    }

    /// Renders a pending response as a numbered menu line.
    ///
    /// Valid responses get a check mark. Unavailable ones are crossed, dimmed and
    /// labelled so the numbering stays stable.
    ///
    /// @param number one-based menu number
    /// @param option pending response, not null
    /// @return menu line without indentation, never null
    public String choice(int number, ChoiceOption option) {
        if (option.valid()) {
            return paint("✓", GREEN) + " " + number + ". " + option.text();
        }
        return paint("✗", RED) + " " + paint(number + ". " + option.text() + " (unavailable)", DIM);
    }

    /// Marks the response the auto player picked.
    public String autoChoice(ChoiceOption option) {
        return paint("→", BLUE) + " " + option.text();
    }

    /// Bracketed tag for a validation issue, `[ERROR]` or `[WARN]`.
    public String issueTag(Severity severity) {
        return severity == Severity.ERROR ? paint("[ERROR]", RED) : paint("[WARN]", YELLOW);
    }

    /// Tag shown when a project validates cleanly.
    public String validTag() {
        return paint("[OK]", GREEN);
    }

    /// Header line for the node a session is positioned at.
    ///
    /// @param step steps taken so far
    /// @param position `flow/node`
    /// @param nodeType wire name of the node type, `?` when unresolved
    public String position(int step, String position, String nodeType) {
        return paint("[step " + step + "] ", GRAY)
                + paint(position, BLUE)
                + paint(" (" + nodeType + ")", GRAY);
    }

    /// Trace line for a node about to be evaluated.
    public String trace(String nodeType, String nodeId, String detail) {
        return paint("→", BLUE)
                + " "
                + paint("[" + nodeType + "]", GRAY)
                + " "
                + paint(nodeId, BLUE)
                + "  "
                + paint("(" + detail + ")", GRAY);
    }

    public String speaker(String name) {
        return paint(name + ":", BOLD);
    }

    /// One `sheet.variable = value` row of the variables table.
    public String variable(String reference, String value) {
        return paint("•", GRAY) + " " + reference + " = " + value;
    }

    /// Secondary remarks such as an empty variables table.
    public String note(String text) {
        return paint(text, GRAY);
    }

    /// A command the debugger refused, or an evaluation error.
    public String failure(String text) {
        return paint(text, RED);
    }

    public String summaryTop() {
        return paint("┌" + RULE, DIM);
    }

    public String summaryBottom() {
        return paint("└" + RULE, DIM);
    }

    private String paint(String text, String code) {
        return useColor ? code + text + RESET : text;
    }
}
