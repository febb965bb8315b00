package io.storyarn.cli.commands;

import io.storyarn.cli.ui.AnsiStyles;
import io.storyarn.core.validation.FlowValidator;
import io.storyarn.core.validation.ValidationIssue;
import io.storyarn.serialization.ProjectDocument;
import java.util.List;
import picocli.CommandLine;

/// CLI command for validating a project's flows.
///
/// Loads the project and runs {@link FlowValidator} over every flow, checking variable
/// references against the project's variable sheets.
///
/// ### Usage
/// ```bash
/// storyarn validate <project.json>
/// ```
///
/// Exit code is 1 when the project cannot be read or any issue is an error; warnings alone
/// still exit with 0.
@CommandLine.Command(name = "validate", description = "Check flows for structural problems")
class ValidateCommand extends ProjectCommand {

    private final FlowValidator validator = new FlowValidator();

    @Override
    protected int execute() {
        try {
            ProjectDocument project = loadProject();
            List<ValidationIssue> issues =
                    validator.validate(project.repository(), project.variables());
            AnsiStyles styles = styles();

            long errors = issues.stream().filter(ValidationIssue::isError).count();
            for (ValidationIssue issue : issues) {
                System.out.println(
                        " " + styles.issueTag(issue.severity()) + " " + location(issue));
            }

            if (errors > 0) {
                System.err.println(
                        " [FAIL] Validation failed: "
                                + errors
                                + " error(s), "
                                + (issues.size() - errors)
                                + " warning(s)");
                return 1;
            }
            System.out.println(" " + styles.validTag() + " Project is valid!");
            System.out.println("   Flows: " + project.flows().size());
            System.out.println("   Variables: " + project.variables().size());
            System.out.println("   Start flow: " + project.startFlowId());
            if (!issues.isEmpty()) {
                System.out.println("   Warnings: " + issues.size());
            }
            return 0;
        } catch (Exception e) {
            System.err.println(" [FAIL] Validation failed: " + e.getMessage());
            return 1;
        }
    }

    private static String location(ValidationIssue issue) {
        String where =
                issue.nodeId() != null ? issue.flowId() + "/" + issue.nodeId() : issue.flowId();
        return where + ": " + issue.message();
    }
}
