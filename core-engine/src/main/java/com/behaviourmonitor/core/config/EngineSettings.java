package com.behaviourmonitor.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.Objects;

/**
 * Typed, immutable engine-wide settings.
 *
 * <p>
 * Rules can override {@code cooldownSeconds} and {@code deviationFactor}
 * individually; the values here apply when a rule leaves them unset.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int defaultCooldownSeconds;
    private final double anomalyThreshold;
    private final String subjectKeyField;
    private final Duration maxClockSkew;
    private final int dedupCapacity;
    private final String defaultChannel;

    private EngineSettings(Builder b) {
        this.defaultCooldownSeconds = b.defaultCooldownSeconds;
        this.anomalyThreshold = b.anomalyThreshold;
        this.subjectKeyField = b.subjectKeyField;
        this.maxClockSkew = b.maxClockSkew;
        this.dedupCapacity = b.dedupCapacity;
        this.defaultChannel = b.defaultChannel;
    }

    /**
     * @return settings with every default applied
     */
    public static EngineSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getDefaultCooldownSeconds() {
        return defaultCooldownSeconds;
    }

    /** Default number of standard deviations for statistical rules. */
    public double getAnomalyThreshold() {
        return anomalyThreshold;
    }

    public String getSubjectKeyField() {
        return subjectKeyField;
    }

    public Duration getMaxClockSkew() {
        return maxClockSkew;
    }

    public int getDedupCapacity() {
        return dedupCapacity;
    }

    public String getDefaultChannel() {
        return defaultChannel;
    }

    /**
     * Fluent builder for {@link EngineSettings}. {@link #build()} validates
     * ranges.
     */
    public static class Builder {
        private int defaultCooldownSeconds = 10;
        private double anomalyThreshold = 2.0;
        private String subjectKeyField = "subjectId";
        private Duration maxClockSkew = Duration.ofMinutes(5);
        private int dedupCapacity = 10_000;
        private String defaultChannel = "log";

        public Builder defaultCooldownSeconds(int v) {
            this.defaultCooldownSeconds = v;
            return this;
        }

        public Builder anomalyThreshold(double v) {
            this.anomalyThreshold = v;
            return this;
        }

        public Builder subjectKeyField(String v) {
            this.subjectKeyField = v;
            return this;
        }

        public Builder maxClockSkew(Duration v) {
            this.maxClockSkew = v;
            return this;
        }

        public Builder dedupCapacity(int v) {
            this.dedupCapacity = v;
            return this;
        }

        public Builder defaultChannel(String v) {
            this.defaultChannel = v;
            return this;
        }

        /**
         * @return validated settings
         * @throws IllegalArgumentException if any value is out of range
         */
        public EngineSettings build() {
            Objects.requireNonNull(maxClockSkew, "maxClockSkew required");
            if (defaultCooldownSeconds < 0) {
                throw new IllegalArgumentException(
                        "defaultCooldownSeconds must be >= 0, got: " + defaultCooldownSeconds);
            }
            if (anomalyThreshold <= 0) {
                throw new IllegalArgumentException(
                        "anomalyThreshold must be > 0, got: " + anomalyThreshold);
            }
            if (subjectKeyField == null || subjectKeyField.isBlank()) {
                throw new IllegalArgumentException("subjectKeyField must not be null or blank");
            }
            if (maxClockSkew.isNegative()) {
                throw new IllegalArgumentException("maxClockSkew must not be negative, got: " + maxClockSkew);
            }
            if (dedupCapacity < 1) {
                throw new IllegalArgumentException("dedupCapacity must be >= 1, got: " + dedupCapacity);
            }
            if (defaultChannel == null || defaultChannel.isBlank()) {
                throw new IllegalArgumentException("defaultChannel must not be null or blank");
            }
            return new EngineSettings(this);
        }
    }

    @Override
    public String toString() {
        return "EngineSettings{" +
                "defaultCooldownSeconds=" + defaultCooldownSeconds +
                ", anomalyThreshold=" + anomalyThreshold +
                ", subjectKeyField='" + subjectKeyField + '\'' +
                ", maxClockSkew=" + maxClockSkew +
                ", dedupCapacity=" + dedupCapacity +
                ", defaultChannel='" + defaultChannel + '\'' +
                '}';
    }
}
