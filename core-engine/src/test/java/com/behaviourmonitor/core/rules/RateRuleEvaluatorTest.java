package com.behaviourmonitor.core.rules;

import com.behaviourmonitor.core.model.Alert;
import com.behaviourmonitor.core.model.Event;
import com.behaviourmonitor.core.model.MonitoringRule;
import com.behaviourmonitor.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RateRuleEvaluator}.
 */
class RateRuleEvaluatorTest {

    private static final Instant BASE = Instant.parse("2024-05-01T10:00:00Z");

    private RateRuleEvaluator evaluator;

    @BeforeEach
    void setUp() {
        MonitoringRule rule = new MonitoringRule();
        rule.setName("login-burst");
        rule.setType("rate");
        rule.setWindowSeconds(10);
        rule.setThreshold(3);
        rule.setSeverity("high");
        rule.setAction("lock-account");
        rule.setChannels(List.of("security"));
        evaluator = new RateRuleEvaluator(rule);
    }

    @Test
    @DisplayName("Should NOT fire when count is at or below threshold")
    void shouldNotFireBelowThreshold() {
        for (int i = 0; i < 3; i++) {
            assertThat(evaluator.evaluate(eventAt(i))).isEmpty();
        }
    }

    @Test
    @DisplayName("Should fire when count exceeds threshold within window")
    void shouldFireWhenExceedsThreshold() {
        Optional<Alert> alert = Optional.empty();
        for (int i = 0; i < 4; i++) {
            alert = evaluator.evaluate(eventAt(i));
        }

        assertThat(alert).isPresent();
        assertThat(alert.get().getRuleName()).isEqualTo("login-burst");
        assertThat(alert.get().getSubjectId()).isEqualTo("alice");
        assertThat(alert.get().getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(alert.get().getAction()).isEqualTo("lock-account");
        assertThat(alert.get().getChannels()).containsExactly("security");
        assertThat(alert.get().getDetails()).contains("Rate spike: 4 events in 10 seconds");
        assertThat(alert.get().getAlertId()).isEqualTo("login-burst:alice:" + BASE.plusSeconds(3).toEpochMilli());
    }

    @Test
    @DisplayName("Should evict old events outside the window")
    void shouldEvictOldEvents() {
        for (int i = 0; i < 3; i++) {
            evaluator.evaluate(eventAt(0));
        }

        assertThat(evaluator.evaluate(eventAt(11))).isEmpty();
    }

    @Test
    @DisplayName("Should reject a non-positive threshold")
    void shouldRejectNonPositiveThreshold() {
        MonitoringRule rule = new MonitoringRule();
        rule.setName("bad");
        rule.setType("rate");
        rule.setWindowSeconds(10);

        assertThatThrownBy(() -> new RateRuleEvaluator(rule))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("threshold");
    }

    private static Event eventAt(int seconds) {
        return Event.builder()
                .subjectId("alice")
                .eventType("login")
                .timestamp(BASE.plusSeconds(seconds))
                .build();
    }
}
