package io.storyarn.cli.commands;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/// Main entry point for the Storyarn CLI application.
///
/// Registers the available subcommands:
/// - `play` - step through a flow in a terminal debugger, or auto-play it
/// - `validate` - report structural problems in a project's flows
///
/// @see PlayCommand
/// @see ValidateCommand
@Command(
        name = "storyarn",
        description = "Storyarn flow debugger",
        mixinStandardHelpOptions = true,
        version = "storyarn 0.1.0",
        subcommands = {PlayCommand.class, ValidateCommand.class})
public class StoryarnCli {

    public static void main(String[] args) {
        System.exit(new CommandLine(new StoryarnCli()).execute(args));
    }
}
