package io.storyarn.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.storyarn.core.state.ExecutionState;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/// Reads and writes project documents, and exports execution states.
///
/// All methods wrap Jackson failures in {@link IllegalArgumentException}; reading a file
/// that cannot be opened raises {@link UncheckedIOException}.
///
/// @see FlowSerializer#createMapper() for the mapper configuration
public final class ProjectSerializer {

    private static final Logger logger = Logger.getLogger(ProjectSerializer.class.getName());

    private ProjectSerializer() {}

    /// Loads a project document from a JSON file.
    ///
    /// @param file path to the project file, not null
    /// @return the parsed project, never null
    /// @throws UncheckedIOException if the file cannot be read
    /// @throws IllegalArgumentException if the content is not a valid project
    public static ProjectDocument read(Path file) {
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read project file " + file, e);
        }
        ProjectDocument document = fromJson(json);
        logger.fine(
                () ->
                        "Loaded "
                                + document.flows().size()
                                + " flow(s) and "
                                + document.variables().size()
                                + " variable(s) from "
                                + file);
        return document;
    }

    public static ProjectDocument fromJson(String json) {
        try {
            return FlowSerializer.createMapper().readValue(json, ProjectDocument.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize project: " + e.getOriginalMessage(), e);
        }
    }

    public static String toJson(ProjectDocument document) {
        try {
            return FlowSerializer.createMapper().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize project: " + e.getMessage(), e);
        }
    }

    /// Exports an execution state as pretty-printed JSON.
    ///
    /// @param state the state to export, not null
    /// @return JSON string, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String exportState(ExecutionState state) {
        try {
            return FlowSerializer.createMapper().writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to export execution state: " + e.getMessage(), e);
        }
    }
}
