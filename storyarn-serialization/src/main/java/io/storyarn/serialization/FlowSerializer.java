package io.storyarn.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.storyarn.core.flow.Flow;

/// Utility class for serializing and deserializing single flows to/from JSON.
///
/// ### Usage
/// {@snippet :
/// String json = FlowSerializer.toJson(flow);
/// Flow restored = FlowSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. The ObjectMapper is created per call via `createMapper()`. For
/// high-throughput scenarios, cache the mapper.
///
/// @see StoryarnJacksonModule for the registered type handlers
/// @see ProjectSerializer for whole projects
public final class FlowSerializer {

    private FlowSerializer() {}

    /// Serializes a flow to pretty-printed JSON.
    ///
    /// @param flow the flow to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Flow flow) {
        try {
            return createMapper().writeValueAsString(flow);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize flow: " + e.getMessage(), e);
        }
    }

    /// Deserializes a flow from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized flow, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static Flow fromJson(String json) {
        try {
            return createMapper().readValue(json, Flow.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize flow: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for Storyarn serialization.
    ///
    /// Registers:
    /// - `StoryarnJacksonModule` for the flow, condition and variable types
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled so editor-only fields are ignored
    /// - `USE_BIG_DECIMAL_FOR_FLOATS` so number literals keep their exact value
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new StoryarnJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
