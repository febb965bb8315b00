package io.storyarn.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Properties;
import org.junit.jupiter.api.Test;

class StoryarnConfigTest {

    @Test
    void shouldUseDefaults() {
        StoryarnConfig config = new StoryarnConfig();

        assertThat(config.getMaxSteps()).isEqualTo(1000);
        assertThat(config.getStepLimitIncrement()).isEqualTo(1000);
        assertThat(config.getMaxCallDepth()).isEqualTo(256);
        assertThat(config.isAutoSelectSingleChoice()).isTrue();
    }

    @Test
    void shouldReadProperties() {
        // Given
        Properties properties = new Properties();
        properties.setProperty(StoryarnConfig.MAX_STEPS_KEY, " 50 ");
        properties.setProperty(StoryarnConfig.AUTO_SELECT_KEY, "false");

        // When
        StoryarnConfig config = StoryarnConfig.fromProperties(properties);

        // Then
        assertThat(config.getMaxSteps()).isEqualTo(50);
        assertThat(config.isAutoSelectSingleChoice()).isFalse();
        assertThat(config.getMaxCallDepth()).isEqualTo(256);
    }

    @Test
    void shouldRejectMalformedOrNonPositiveValues() {
        Properties garbage = new Properties();
        garbage.setProperty(StoryarnConfig.MAX_CALL_DEPTH_KEY, "deep");
        Properties zero = new Properties();
        zero.setProperty(StoryarnConfig.MAX_STEPS_KEY, "0");

        assertThatThrownBy(() -> StoryarnConfig.fromProperties(garbage))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(StoryarnConfig.MAX_CALL_DEPTH_KEY);
        assertThatThrownBy(() -> StoryarnConfig.fromProperties(zero))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
