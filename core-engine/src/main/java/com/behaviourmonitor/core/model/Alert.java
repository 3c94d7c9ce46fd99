package com.behaviourmonitor.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Alert produced when a rule's trigger fires for a subject.
 *
 * <p>
 * Serialized to JSON and published to the configured Kafka alerts topic, and
 * handed to {@link com.behaviourmonitor.core.dispatch.AlertChannel}s by the
 * dispatcher. Instances are immutable.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code ruleName}, {@code subjectId},
 * {@code timestamp} and {@code severity} are required; omitting any of them
 * throws a {@link NullPointerException} at build time. When no
 * {@code alertId} is given it is derived as
 * {@code ruleName:subjectId:epochMillis}, so the same firing always carries
 * the same id. Backslashes and colons inside the rule name and subject id
 * are escaped with a backslash, which keeps ids of different firings
 * distinct.
 * </p>
 *
 * @since 1.0.0
 */
public final class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String alertId;
    private final String ruleName;
    private final String subjectId;
    private final Instant timestamp;
    private final Severity severity;
    private final String action;
    private final List<String> channels;

    /** Human-readable description of what was detected. */
    private final String details;

    /** Copy of the attributes of the event that triggered the alert. */
    private final Map<String, Object> evidence;

    private Alert(Builder builder) {
        this.ruleName = Objects.requireNonNull(builder.ruleName, "ruleName must not be null");
        this.subjectId = Objects.requireNonNull(builder.subjectId, "subjectId must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.alertId = builder.alertId != null
                ? builder.alertId
                : escape(ruleName) + ":" + escape(subjectId) + ":" + timestamp.toEpochMilli();
        this.action = builder.action;
        this.channels = builder.channels != null ? new ArrayList<>(builder.channels) : new ArrayList<>();
        this.details = builder.details;
        this.evidence = Attributes.copyOf(builder.evidence);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String escape(String part) {
        return part.replace("\\", "\\\\").replace(":", "\\:");
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String alertId;
        private String ruleName;
        private String subjectId;
        private Instant timestamp;
        private Severity severity;
        private String action;
        private List<String> channels;
        private String details;
        private Map<String, Object> evidence;

        public Builder alertId(String alertId) {
            this.alertId = alertId;
            return this;
        }

        public Builder ruleName(String ruleName) {
            this.ruleName = ruleName;
            return this;
        }

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder channels(List<String> channels) {
            this.channels = channels;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        public Builder evidence(Map<String, Object> evidence) {
            this.evidence = evidence;
            return this;
        }

        /**
         * Build the alert.
         *
         * @return a new {@link Alert}
         * @throws NullPointerException if a required field is {@code null}
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters (used by Jackson)
    // ---------------------------------------------------------------

    public String getAlertId() {
        return alertId;
    }

    public String getRuleName() {
        return ruleName;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getAction() {
        return action;
    }

    public List<String> getChannels() {
        return Collections.unmodifiableList(channels);
    }

    public String getDetails() {
        return details;
    }

    public Map<String, Object> getEvidence() {
        return Attributes.readOnly(evidence);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return alertId.equals(alert.alertId);
    }

    @Override
    public int hashCode() {
        return alertId.hashCode();
    }

    @Override
    public String toString() {
        return "Alert{" +
                "alertId='" + alertId + '\'' +
                ", ruleName='" + ruleName + '\'' +
                ", subjectId='" + subjectId + '\'' +
                ", timestamp=" + timestamp +
                ", severity=" + severity +
                ", details='" + details + '\'' +
                '}';
    }
}
