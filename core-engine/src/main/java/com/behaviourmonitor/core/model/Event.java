package com.behaviourmonitor.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A validated, normalised behaviour event.
 *
 * <p>
 * Instances are produced by
 * {@link com.behaviourmonitor.core.intake.EventIntake} (or the
 * {@link Builder} in tests) and are immutable once built: the attribute map
 * and any nested maps or lists are copied and exposed read-only.
 * </p>
 *
 * @since 1.0.0
 */
public final class Event implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String subjectId;
    private final String eventType;
    private final Instant timestamp;
    private final Map<String, Object> attributes;

    private Event(Builder builder) {
        this.subjectId = Objects.requireNonNull(builder.subjectId, "subjectId must not be null");
        this.eventType = Objects.requireNonNull(builder.eventType, "eventType must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.attributes = Attributes.copyOf(builder.attributes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getEventType() {
        return eventType;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return unmodifiable map of payload attributes, nested values included
     */
    public Map<String, Object> getAttributes() {
        return Attributes.readOnly(attributes);
    }

    public Optional<Object> getAttribute(String name) {
        return Optional.ofNullable(Attributes.readOnlyValue(attributes.get(name)));
    }

    /**
     * Retrieve a numeric attribute, coercing common JSON number types.
     *
     * <p>
     * Handles {@link Number} subclasses natively and attempts
     * {@link Double#parseDouble(String)} for string-encoded numbers.
     * Booleans map to {@code 1.0} / {@code 0.0}.
     * </p>
     *
     * @param name attribute name
     * @return optional containing the value as a {@code double}
     */
    public Optional<Double> getNumericAttribute(String name) {
        Object raw = attributes.get(name);
        if (raw instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (raw instanceof Boolean b) {
            return Optional.of(b ? 1.0 : 0.0);
        }
        if (raw instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<String> getStringAttribute(String name) {
        Object raw = attributes.get(name);
        return raw == null ? Optional.empty() : Optional.of(raw.toString());
    }

    /**
     * Fluent builder for {@link Event}. {@code subjectId}, {@code eventType}
     * and {@code timestamp} are required.
     */
    public static class Builder {
        private String subjectId;
        private String eventType;
        private Instant timestamp;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder attribute(String name, Object value) {
            this.attributes.put(Objects.requireNonNull(name, "Attribute name must not be null"), value);
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            if (attributes != null) {
                attributes.forEach(this::attribute);
            }
            return this;
        }

        public Event build() {
            return new Event(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Event that))
            return false;
        return subjectId.equals(that.subjectId)
                && eventType.equals(that.eventType)
                && timestamp.equals(that.timestamp)
                && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subjectId, eventType, timestamp, attributes);
    }

    @Override
    public String toString() {
        return "Event{" +
                "subjectId='" + subjectId + '\'' +
                ", eventType='" + eventType + '\'' +
                ", timestamp=" + timestamp +
                ", attributes=" + attributes +
                '}';
    }
}
