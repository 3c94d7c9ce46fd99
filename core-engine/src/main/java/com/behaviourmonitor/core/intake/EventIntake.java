package com.behaviourmonitor.core.intake;

import com.behaviourmonitor.core.config.EngineSettings;
import com.behaviourmonitor.core.model.Event;
import com.behaviourmonitor.core.model.RawEvent;

import java.io.Serializable;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Validates and normalises raw behaviour events before evaluation.
 *
 * <h3>Field resolution</h3>
 * <ul>
 * <li>Subject: the configured key field (default {@code subjectId}), else
 * {@code subject}. Trimmed.</li>
 * <li>Type: {@code eventType}, else {@code type}. Trimmed and
 * lower-cased.</li>
 * <li>Timestamp: {@code timestamp} as ISO-8601 text, epoch millis, or a
 * numeric string. Missing means the ingestion time.</li>
 * <li>Everything else becomes an attribute. Nested {@code attributes} and
 * {@code payload} objects are flattened in; top-level fields win on
 * conflicts.</li>
 * </ul>
 *
 * <p>
 * All problems are collected and reported together in one
 * {@link EventValidationException}. The class is stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class EventIntake implements Serializable {

    private static final long serialVersionUID = 1L;

    static final String FALLBACK_SUBJECT_FIELD = "subject";
    static final String TYPE_FIELD = "eventType";
    static final String FALLBACK_TYPE_FIELD = "type";
    static final String TIMESTAMP_FIELD = "timestamp";
    private static final Set<String> NESTED_FIELDS = Set.of("attributes", "payload");

    private final String subjectKeyField;
    private final long maxClockSkewMillis;

    public EventIntake(EngineSettings settings) {
        Objects.requireNonNull(settings, "EngineSettings must not be null");
        this.subjectKeyField = settings.getSubjectKeyField();
        this.maxClockSkewMillis = settings.getMaxClockSkew().toMillis();
    }

    /**
     * Normalise a raw event.
     *
     * @param raw           raw event; must not be {@code null}
     * @param ingestionTime time the event was received
     * @return the immutable normalised event
     * @throws EventValidationException if the event is invalid
     */
    public Event normalize(RawEvent raw, Instant ingestionTime) {
        Objects.requireNonNull(raw, "RawEvent must not be null");
        Objects.requireNonNull(ingestionTime, "ingestionTime must not be null");

        Map<String, Object> fields = raw.getFields();
        List<String> errors = new ArrayList<>();

        String subjectField = fields.containsKey(subjectKeyField) ? subjectKeyField : FALLBACK_SUBJECT_FIELD;
        String subjectId = text(fields.get(subjectField));
        if (subjectId == null) {
            errors.add("missing subject ('" + subjectKeyField + "')");
        }

        String typeField = fields.containsKey(TYPE_FIELD) ? TYPE_FIELD : FALLBACK_TYPE_FIELD;
        String eventType = text(fields.get(typeField));
        if (eventType == null) {
            errors.add("missing event type ('" + TYPE_FIELD + "')");
        }

        Instant timestamp = ingestionTime;
        Object rawTimestamp = fields.get(TIMESTAMP_FIELD);
        if (rawTimestamp != null) {
            try {
                timestamp = parseTimestamp(rawTimestamp);
                if (timestamp.toEpochMilli() - ingestionTime.toEpochMilli() > maxClockSkewMillis) {
                    errors.add("timestamp " + timestamp + " is too far ahead of ingestion time " + ingestionTime);
                }
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new EventValidationException(errors);
        }

        return Event.builder()
                .subjectId(subjectId)
                .eventType(eventType.toLowerCase(Locale.ROOT))
                .timestamp(timestamp)
                .attributes(attributes(fields, subjectField, typeField))
                .build();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Map<String, Object> attributes(Map<String, Object> fields,
            String subjectField, String typeField) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (String nested : NESTED_FIELDS) {
            if (fields.get(nested) instanceof Map<?, ?> map) {
                map.forEach((k, v) -> {
                    if (k != null) {
                        attributes.put(k.toString(), v);
                    }
                });
            }
        }
        fields.forEach((key, value) -> {
            if (!key.equals(subjectField) && !key.equals(typeField)
                    && !key.equals(TIMESTAMP_FIELD) && !NESTED_FIELDS.contains(key)) {
                attributes.put(key, value);
            }
        });
        return attributes;
    }

    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        String s = value.toString().trim();
        return s.isEmpty() ? null : s;
    }

    static Instant parseTimestamp(Object raw) {
        if (raw instanceof Number n) {
            return Instant.ofEpochMilli(n.longValue());
        }
        String s = raw.toString().trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("timestamp is blank");
        }
        if (s.chars().allMatch(Character::isDigit)) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(s));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("timestamp out of range: '" + s + "'", e);
            }
        }
        Instant parsed;
        try {
            parsed = Instant.parse(s);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("unparseable timestamp: '" + s + "'", e);
        }
        // Instant spans a wider range than epoch milliseconds
        try {
            parsed.toEpochMilli();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("timestamp out of range: '" + s + "'", e);
        }
        return parsed;
    }
}
