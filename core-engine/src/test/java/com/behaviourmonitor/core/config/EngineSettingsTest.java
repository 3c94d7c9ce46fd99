package com.behaviourmonitor.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EngineSettings}.
 */
class EngineSettingsTest {

    @Test
    @DisplayName("Defaults should match documented values")
    void defaults() {
        EngineSettings settings = EngineSettings.defaults();

        assertThat(settings.getDefaultCooldownSeconds()).isEqualTo(10);
        assertThat(settings.getAnomalyThreshold()).isEqualTo(2.0);
        assertThat(settings.getSubjectKeyField()).isEqualTo("subjectId");
        assertThat(settings.getMaxClockSkew()).isEqualTo(Duration.ofMinutes(5));
        assertThat(settings.getDedupCapacity()).isEqualTo(10_000);
        assertThat(settings.getDefaultChannel()).isEqualTo("log");
    }

    @Test
    @DisplayName("Builder should reject invalid values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> EngineSettings.builder().defaultCooldownSeconds(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineSettings.builder().anomalyThreshold(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineSettings.builder().dedupCapacity(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
