package io.storyarn.cli.commands;

import io.storyarn.cli.CliLogging;
import io.storyarn.cli.ui.AnsiStyles;
import io.storyarn.core.StoryarnConfig;
import io.storyarn.serialization.ProjectDocument;
import io.storyarn.serialization.ProjectSerializer;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.concurrent.Callable;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// Base class for commands that operate on a project file.
///
/// Owns the banner, project loading, logging setup and the shared options. Subclasses
/// implement {@link #execute()} and return the process exit code.
///
/// ### Configuration Resolution
/// Engine settings start from the defaults, are overridden by the `--config` properties
/// file (keys `storyarn.*`), and then by command options.
///
/// @implNote Subclasses must be package-private and annotated with `@Command`.
/// @see PlayCommand
/// @see ValidateCommand
public abstract class ProjectCommand implements Callable<Integer> {

    private static final String[] BANNER = {
        "",
        "      _                                  ",
        "  ___| |_ ___  _ __ _   _  __ _ _ __ _ __",
        " / __| __/ _ \\| '__| | | |/ _` | '__| '_ \\",
        " \\__ \\ || (_) | |  | |_| | (_| | |  | | | |",
        " |___/\\__\\___/|_|   \\__, |\\__,_|_|  |_| |_|",
        "                    |___/",
        "",
        " Flow debugger",
        ""
    };

    @Parameters(index = "0", description = "Project JSON file")
    protected Path projectFile;

    @Option(
            names = {"-c", "--config"},
            description = "Properties file with storyarn.* engine settings")
    protected Path configFile;

    @Option(names = "--no-color", description = "Disable ANSI colors")
    protected boolean noColor;

    @Option(
            names = {"-v", "--verbose"},
            description = "Trace every node and enable engine debug logging")
    protected boolean verbose;

    @Override
    public final Integer call() {
        for (String line : BANNER) {
            System.out.println(line);
        }
        CliLogging.configure(verbose);
        return execute();
    }

    protected abstract int execute();

    /// Loads the project named on the command line.
    ///
    /// @return parsed project, never null
    /// @throws java.io.UncheckedIOException if the file cannot be read
    /// @throws IllegalArgumentException if the file is not a valid project
    protected ProjectDocument loadProject() {
        System.out.println("Loading project: " + projectFile);
        return ProjectSerializer.read(projectFile);
    }

    /// Reads engine settings from `--config`, or the defaults when it is not given.
    ///
    /// @return configuration, never null
    /// @throws IOException if the config file cannot be read
    protected StoryarnConfig loadConfig() throws IOException {
        if (configFile == null) {
            return new StoryarnConfig();
        }
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(configFile)) {
            properties.load(reader);
        }
        return StoryarnConfig.fromProperties(properties);
    }

    protected AnsiStyles styles() {
        return AnsiStyles.of(!noColor);
    }
}
