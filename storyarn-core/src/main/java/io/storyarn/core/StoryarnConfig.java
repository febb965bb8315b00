package io.storyarn.core;

import java.util.Properties;

/// Configuration options for the flow evaluation engine.
///
/// Use the {@link Builder} for fluent configuration, construct directly and use setters,
/// or read a properties file with {@link #fromProperties(Properties)}.
///
/// ### Default Values
/// - `maxSteps`: `1000` (a session pauses when it reaches this many steps)
/// - `stepLimitIncrement`: `1000` (added to the limit on each resume)
/// - `maxCallDepth`: `256` (deepest subflow nesting before `CALL_STACK_OVERFLOW`)
/// - `autoSelectSingleChoice`: `true` (a single valid response is taken without asking)
///
/// ### Property Keys
/// - `storyarn.max-steps`
/// - `storyarn.step-limit-increment`
/// - `storyarn.max-call-depth`
/// - `storyarn.auto-select-single-choice`
///
/// @implNote **Not thread-safe**. This is a mutable configuration object intended to be
/// configured before passing to {@link StoryarnFactory}. Do not modify after the engine
/// has been created.
///
/// @see StoryarnFactory#createEngine(StoryarnConfig, io.storyarn.core.flow.FlowRepository)
public class StoryarnConfig {

    public static final String MAX_STEPS_KEY = "storyarn.max-steps";
    public static final String STEP_LIMIT_INCREMENT_KEY = "storyarn.step-limit-increment";
    public static final String MAX_CALL_DEPTH_KEY = "storyarn.max-call-depth";
    public static final String AUTO_SELECT_KEY = "storyarn.auto-select-single-choice";

    private int maxSteps = 1000;
    private int stepLimitIncrement = 1000;
    private int maxCallDepth = 256;
    private boolean autoSelectSingleChoice = true;

    /// Creates a configuration with default values.
    public StoryarnConfig() {}

    /// Returns the step count at which a new session pauses.
    ///
    /// @return positive step limit
    public int getMaxSteps() {
        return maxSteps;
    }

    /// Sets the step count at which a new session pauses.
    ///
    /// ### Contracts
    /// - **Precondition**: `maxSteps` must be positive
    ///
    /// @param maxSteps the step limit
    /// @throws IllegalArgumentException if `maxSteps` is not positive
    public void setMaxSteps(int maxSteps) {
        this.maxSteps = requirePositive(maxSteps, "maxSteps");
    }

    /// Returns how many steps each resume after a pause adds to the limit.
    ///
    /// @return positive increment
    public int getStepLimitIncrement() {
        return stepLimitIncrement;
    }

    public void setStepLimitIncrement(int stepLimitIncrement) {
        this.stepLimitIncrement = requirePositive(stepLimitIncrement, "stepLimitIncrement");
    }

    /// Returns the maximum call stack depth.
    ///
    /// @return positive depth
    public int getMaxCallDepth() {
        return maxCallDepth;
    }

    public void setMaxCallDepth(int maxCallDepth) {
        this.maxCallDepth = requirePositive(maxCallDepth, "maxCallDepth");
    }

    /// Returns whether a dialogue with exactly one valid response advances on its own.
    ///
    /// @return `true` to auto-select, `false` to always wait for a choice
    public boolean isAutoSelectSingleChoice() {
        return autoSelectSingleChoice;
    }

    public void setAutoSelectSingleChoice(boolean autoSelectSingleChoice) {
        this.autoSelectSingleChoice = autoSelectSingleChoice;
    }

    /// Reads a configuration from properties, using defaults for absent keys.
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws IllegalArgumentException if a numeric property is not a positive integer
    public static StoryarnConfig fromProperties(Properties properties) {
        StoryarnConfig config = new StoryarnConfig();
        String maxSteps = properties.getProperty(MAX_STEPS_KEY);
        if (maxSteps != null) {
            config.setMaxSteps(parseInt(MAX_STEPS_KEY, maxSteps));
        }
        String increment = properties.getProperty(STEP_LIMIT_INCREMENT_KEY);
        if (increment != null) {
            config.setStepLimitIncrement(parseInt(STEP_LIMIT_INCREMENT_KEY, increment));
        }
        String depth = properties.getProperty(MAX_CALL_DEPTH_KEY);
        if (depth != null) {
            config.setMaxCallDepth(parseInt(MAX_CALL_DEPTH_KEY, depth));
        }
        String autoSelect = properties.getProperty(AUTO_SELECT_KEY);
        if (autoSelect != null) {
            config.setAutoSelectSingleChoice(Boolean.parseBoolean(autoSelect.trim()));
        }
        return config;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Property " + key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static int requirePositive(int value, String name) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
        return value;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link StoryarnConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final StoryarnConfig config = new StoryarnConfig();

        public Builder maxSteps(int maxSteps) {
            config.setMaxSteps(maxSteps);
            return this;
        }

        public Builder stepLimitIncrement(int stepLimitIncrement) {
            config.setStepLimitIncrement(stepLimitIncrement);
            return this;
        }

        public Builder maxCallDepth(int maxCallDepth) {
            config.setMaxCallDepth(maxCallDepth);
            return this;
        }

        public Builder autoSelectSingleChoice(boolean autoSelectSingleChoice) {
            config.setAutoSelectSingleChoice(autoSelectSingleChoice);
            return this;
        }

        /// Builds and returns the configured {@link StoryarnConfig} instance.
        ///
        /// @return the configured instance, never null
        public StoryarnConfig build() {
            return config;
        }
    }
}
