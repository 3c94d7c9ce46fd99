package com.behaviourmonitor.flink;

import com.behaviourmonitor.core.config.EngineSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Builder defaults should match the documented environment defaults")
    void builderDefaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getKafkaInputTopic()).isEqualTo("behaviour-events");
        assertThat(config.getKafkaAlertTopic()).isEqualTo("behaviour-alerts");
        assertThat(config.getKafkaGroupId()).isEqualTo("behaviour-monitor");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getCheckpointIntervalMs()).isEqualTo(60_000L);
        assertThat(config.getAppPort()).isEqualTo(8080);
        assertThat(config.getMonitoringIntervalSeconds()).isEqualTo(5);
        assertThat(config.getAlertCooldownSeconds()).isEqualTo(10);
        assertThat(config.getAnomalyThreshold()).isEqualTo(2.0);
        assertThat(config.getRetentionDays()).isEqualTo(30);
    }

    @Test
    @DisplayName("Should map job settings onto engine settings")
    void toEngineSettings() {
        EngineSettings settings = new JobConfig.Builder()
                .subjectKeyField("userId")
                .alertCooldownSeconds(30)
                .anomalyThreshold(3.5)
                .build()
                .toEngineSettings();

        assertThat(settings.getSubjectKeyField()).isEqualTo("userId");
        assertThat(settings.getDefaultCooldownSeconds()).isEqualTo(30);
        assertThat(settings.getAnomalyThreshold()).isEqualTo(3.5);
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> new JobConfig.Builder().appPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("appPort");
        assertThatThrownBy(() -> new JobConfig.Builder().monitoringIntervalSeconds(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("monitoringIntervalSeconds");
        assertThatThrownBy(() -> new JobConfig.Builder().retentionDays(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retentionDays");
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaInputTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaInputTopic");
    }
}
