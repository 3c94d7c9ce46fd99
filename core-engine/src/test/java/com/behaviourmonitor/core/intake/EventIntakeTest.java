package com.behaviourmonitor.core.intake;

import com.behaviourmonitor.core.config.EngineSettings;
import com.behaviourmonitor.core.model.Event;
import com.behaviourmonitor.core.model.RawEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Unit tests for {@link EventIntake}.
 */
class EventIntakeTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private EventIntake intake;

    @BeforeEach
    void setUp() {
        intake = new EventIntake(EngineSettings.defaults());
    }

    @Test
    @DisplayName("Should normalise subject, type, timestamp and attributes")
    void shouldNormalise() {
        RawEvent raw = raw(Map.of(
                "subjectId", " alice ",
                "eventType", "LOGIN",
                "timestamp", "2024-05-01T09:59:00Z",
                "ip", "10.0.0.1"));

        Event event = intake.normalize(raw, NOW);

        assertThat(event.getSubjectId()).isEqualTo("alice");
        assertThat(event.getEventType()).isEqualTo("login");
        assertThat(event.getTimestamp()).isEqualTo(Instant.parse("2024-05-01T09:59:00Z"));
        assertThat(event.getAttributes()).containsOnlyKeys("ip");
    }

    @Test
    @DisplayName("Should fall back to 'subject' and 'type' fields")
    void shouldUseFallbackFields() {
        Event event = intake.normalize(raw(Map.of("subject", "cam-7", "type", "Pose")), NOW);

        assertThat(event.getSubjectId()).isEqualTo("cam-7");
        assertThat(event.getEventType()).isEqualTo("pose");
    }

    @Test
    @DisplayName("Should honour a custom subject key field")
    void shouldUseConfiguredKeyField() {
        EventIntake custom = new EventIntake(EngineSettings.builder().subjectKeyField("userId").build());

        Event event = custom.normalize(raw(Map.of("userId", "u1", "eventType", "click")), NOW);

        assertThat(event.getSubjectId()).isEqualTo("u1");
    }

    @Test
    @DisplayName("Should default a missing timestamp to ingestion time")
    void shouldDefaultTimestamp() {
        Event event = intake.normalize(raw(Map.of("subjectId", "a", "eventType", "x")), NOW);

        assertThat(event.getTimestamp()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should accept epoch millis as number or digit string")
    void shouldParseEpochMillis() {
        long millis = NOW.minusSeconds(30).toEpochMilli();

        assertThat(EventIntake.parseTimestamp(millis)).isEqualTo(NOW.minusSeconds(30));
        assertThat(EventIntake.parseTimestamp(Long.toString(millis))).isEqualTo(NOW.minusSeconds(30));
    }

    @Test
    @DisplayName("Should flatten nested attributes with top-level fields winning")
    void shouldFlattenNestedAttributes() {
        RawEvent raw = raw(Map.of("subjectId", "a", "eventType", "vitals", "heartRate", 90));
        raw.setField("payload", Map.of("heartRate", 200, "spo2", 97));

        Event event = intake.normalize(raw, NOW);

        assertThat(event.getAttributes())
                .containsEntry("heartRate", 90)
                .containsEntry("spo2", 97)
                .doesNotContainKey("payload");
    }

    @Test
    @DisplayName("Should collect every validation error")
    void shouldCollectErrors() {
        EventValidationException e = catchThrowableOfType(
                () -> intake.normalize(raw(Map.of("timestamp", "yesterday")), NOW),
                EventValidationException.class);

        assertThat(e.getErrors()).hasSize(3);
        assertThat(e.getMessage())
                .contains("missing subject")
                .contains("missing event type")
                .contains("unparseable timestamp");
    }

    @Test
    @DisplayName("Should reject blank subject ids")
    void shouldRejectBlankSubject() {
        assertThatThrownBy(() -> intake.normalize(raw(Map.of("subjectId", "  ", "eventType", "x")), NOW))
                .isInstanceOf(EventValidationException.class)
                .hasMessageContaining("missing subject");
    }

    @Test
    @DisplayName("Should reject timestamps too far in the future")
    void shouldRejectFutureTimestamp() {
        RawEvent raw = raw(Map.of("subjectId", "a", "eventType", "x",
                "timestamp", NOW.plusSeconds(600).toString()));

        assertThatThrownBy(() -> intake.normalize(raw, NOW))
                .isInstanceOf(EventValidationException.class)
                .hasMessageContaining("too far ahead");
    }

    @Test
    @DisplayName("Should accept small clock skew")
    void shouldAcceptSmallSkew() {
        RawEvent raw = raw(Map.of("subjectId", "a", "eventType", "x",
                "timestamp", NOW.plusSeconds(60).toString()));

        assertThat(intake.normalize(raw, NOW).getTimestamp()).isEqualTo(NOW.plusSeconds(60));
    }

    @Test
    @DisplayName("Should report timestamps beyond the epoch-millisecond range as validation errors")
    void shouldRejectOutOfRangeTimestamps() {
        for (String extreme : new String[] {"+1000000000-01-01T00:00:00Z", "-1000000000-01-01T00:00:00Z"}) {
            RawEvent raw = raw(Map.of("subjectId", "a", "eventType", "x", "timestamp", extreme));

            assertThatThrownBy(() -> intake.normalize(raw, NOW))
                    .as(extreme)
                    .isInstanceOf(EventValidationException.class)
                    .hasMessageContaining("timestamp out of range");
        }
    }

    @Test
    @DisplayName("Should reject epoch-millisecond strings that overflow a long")
    void shouldRejectOverflowingEpochMillis() {
        RawEvent raw = raw(Map.of("subjectId", "a", "eventType", "x",
                "timestamp", "99999999999999999999"));

        assertThatThrownBy(() -> intake.normalize(raw, NOW))
                .isInstanceOf(EventValidationException.class)
                .hasMessageContaining("timestamp out of range");
    }

    private static RawEvent raw(Map<String, Object> fields) {
        RawEvent raw = new RawEvent();
        fields.forEach(raw::setField);
        return raw;
    }
}
