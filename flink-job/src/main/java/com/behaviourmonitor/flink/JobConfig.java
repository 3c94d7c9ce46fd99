package com.behaviourmonitor.flink;

import com.behaviourmonitor.core.config.EngineSettings;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the Behaviour Monitor Flink job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job is configurable via Kubernetes Deployment env vars, Docker
 * {@code -e} flags, or a shell environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // Kafka
    private final String kafkaBootstrapServers;
    private final String kafkaInputTopic;
    private final String kafkaAlertTopic;
    private final String kafkaGroupId;

    // Flink
    private final int parallelism;
    private final long checkpointIntervalMs;

    // Rules
    private final String rulesConfigPath;

    // Status server
    private final int appPort;

    // Monitoring
    private final String subjectKeyField;
    private final int monitoringIntervalSeconds;
    private final int alertCooldownSeconds;
    private final double anomalyThreshold;
    private final int retentionDays;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaInputTopic = b.kafkaInputTopic;
        this.kafkaAlertTopic = b.kafkaAlertTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.rulesConfigPath = b.rulesConfigPath;
        this.appPort = b.appPort;
        this.subjectKeyField = b.subjectKeyField;
        this.monitoringIntervalSeconds = b.monitoringIntervalSeconds;
        this.alertCooldownSeconds = b.alertCooldownSeconds;
        this.anomalyThreshold = b.anomalyThreshold;
        this.retentionDays = b.retentionDays;
    }

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaInputTopic(env("KAFKA_INPUT_TOPIC", "behaviour-events"))
                    .kafkaAlertTopic(env("KAFKA_ALERT_TOPIC", "behaviour-alerts"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "behaviour-monitor"))
                    .parallelism(parseIntEnv("FLINK_PARALLELISM", "1"))
                    .checkpointIntervalMs(parseLongEnv("FLINK_CHECKPOINT_INTERVAL_MS", "60000"))
                    .rulesConfigPath(env("RULES_CONFIG_PATH", ""))
                    .appPort(parseIntEnv("APP_PORT", "8080"))
                    .subjectKeyField(env("SUBJECT_KEY_FIELD", "subjectId"))
                    .monitoringIntervalSeconds(parseIntEnv("MONITORING_INTERVAL_SECONDS", "5"))
                    .alertCooldownSeconds(parseIntEnv("ALERT_COOLDOWN_SECONDS", "10"))
                    .anomalyThreshold(Double.parseDouble(env("ANOMALY_THRESHOLD", "2.0")))
                    .retentionDays(parseIntEnv("RETENTION_DAYS", "30"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * @return engine settings derived from this job configuration
     */
    public EngineSettings toEngineSettings() {
        return EngineSettings.builder()
                .subjectKeyField(subjectKeyField)
                .defaultCooldownSeconds(alertCooldownSeconds)
                .anomalyThreshold(anomalyThreshold)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    public String getRulesConfigPath() {
        return rulesConfigPath;
    }

    public int getAppPort() {
        return appPort;
    }

    public String getSubjectKeyField() {
        return subjectKeyField;
    }

    public int getMonitoringIntervalSeconds() {
        return monitoringIntervalSeconds;
    }

    public int getAlertCooldownSeconds() {
        return alertCooldownSeconds;
    }

    public double getAnomalyThreshold() {
        return anomalyThreshold;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (parallelism &gt; 0, checkpoint interval &gt; 0, port in
     * [1, 65535], monitoring interval &gt; 0, retention &gt; 0, non-blank
     * topic names).
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaInputTopic = "behaviour-events";
        private String kafkaAlertTopic = "behaviour-alerts";
        private String kafkaGroupId = "behaviour-monitor";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String rulesConfigPath = "";
        private int appPort = 8080;
        private String subjectKeyField = "subjectId";
        private int monitoringIntervalSeconds = 5;
        private int alertCooldownSeconds = 10;
        private double anomalyThreshold = 2.0;
        private int retentionDays = 30;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaInputTopic(String v) {
            this.kafkaInputTopic = v;
            return this;
        }

        public Builder kafkaAlertTopic(String v) {
            this.kafkaAlertTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder rulesConfigPath(String v) {
            this.rulesConfigPath = v;
            return this;
        }

        public Builder appPort(int v) {
            this.appPort = v;
            return this;
        }

        public Builder subjectKeyField(String v) {
            this.subjectKeyField = v;
            return this;
        }

        public Builder monitoringIntervalSeconds(int v) {
            this.monitoringIntervalSeconds = v;
            return this;
        }

        public Builder alertCooldownSeconds(int v) {
            this.alertCooldownSeconds = v;
            return this;
        }

        public Builder anomalyThreshold(double v) {
            this.anomalyThreshold = v;
            return this;
        }

        public Builder retentionDays(int v) {
            this.retentionDays = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaInputTopic, "kafkaInputTopic");
            requireNonBlank(kafkaAlertTopic, "kafkaAlertTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            requireNonBlank(subjectKeyField, "subjectKeyField");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (appPort < 1 || appPort > 65_535) {
                throw new IllegalArgumentException(
                        "appPort must be in [1, 65535], got: " + appPort);
            }
            if (monitoringIntervalSeconds < 1) {
                throw new IllegalArgumentException(
                        "monitoringIntervalSeconds must be >= 1, got: " + monitoringIntervalSeconds);
            }
            if (alertCooldownSeconds < 0) {
                throw new IllegalArgumentException(
                        "alertCooldownSeconds must be >= 0, got: " + alertCooldownSeconds);
            }
            if (anomalyThreshold <= 0) {
                throw new IllegalArgumentException(
                        "anomalyThreshold must be > 0, got: " + anomalyThreshold);
            }
            if (retentionDays < 1) {
                throw new IllegalArgumentException("retentionDays must be >= 1, got: " + retentionDays);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaInputTopic='" + kafkaInputTopic + '\'' +
                ", kafkaAlertTopic='" + kafkaAlertTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", appPort=" + appPort +
                ", subjectKeyField='" + subjectKeyField + '\'' +
                ", monitoringIntervalSeconds=" + monitoringIntervalSeconds +
                ", alertCooldownSeconds=" + alertCooldownSeconds +
                ", anomalyThreshold=" + anomalyThreshold +
                ", retentionDays=" + retentionDays +
                '}';
    }
}
