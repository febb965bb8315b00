package io.storyarn.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/// Loads `logging.properties` from the classpath into JUL.
///
/// Engine loggers stay at `WARNING` unless `--verbose` lowers them to `FINE`.
public final class CliLogging {

    // held so the level survives LogManager's weak references
    private static final Logger STORYARN = Logger.getLogger("io.storyarn");

    private CliLogging() {}

    public static void configure(boolean verbose) {
        try (InputStream in = CliLogging.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println(" [WARN] Could not load logging configuration: " + e.getMessage());
        }
        STORYARN.setLevel(verbose ? Level.FINE : Level.WARNING);
    }
}
