package io.storyarn.cli.commands;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

/// Base class for CLI command tests with common utilities.
abstract class BaseCommandTest {

    @TempDir protected Path tempDir;

    protected ByteArrayOutputStream outContent;
    protected ByteArrayOutputStream errContent;
    private PrintStream originalOut;
    private PrintStream originalErr;
    private InputStream originalIn;

    @BeforeEach
    void setUpStreams() {
        originalOut = System.out;
        originalErr = System.err;
        originalIn = System.in;
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(errContent, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
        System.setIn(originalIn);
    }

    /// Runs the CLI as `storyarn <args>` and returns its exit code.
    protected int run(String... args) {
        return new CommandLine(new StoryarnCli()).execute(args);
    }

    /// Feeds the given lines to standard input.
    protected void input(String... lines) {
        String text = String.join("\n", lines) + "\n";
        System.setIn(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
    }

    /// Copies a project fixture into the temp directory.
    protected Path project(String name) throws IOException {
        Path target = tempDir.resolve(name);
        try (InputStream in = getClass().getResourceAsStream("/projects/" + name)) {
            Files.copy(in, target);
        }
        return target;
    }

    protected String out() {
        return outContent.toString(StandardCharsets.UTF_8);
    }

    protected String err() {
        return errContent.toString(StandardCharsets.UTF_8);
    }
}
