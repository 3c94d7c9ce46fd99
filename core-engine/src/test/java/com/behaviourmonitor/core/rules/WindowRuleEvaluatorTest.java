package com.behaviourmonitor.core.rules;

import com.behaviourmonitor.core.model.Alert;
import com.behaviourmonitor.core.model.Event;
import com.behaviourmonitor.core.model.MonitoringRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link WindowRuleEvaluator}.
 */
class WindowRuleEvaluatorTest {

    private static final Instant BASE = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    @DisplayName("Should fire when the windowed average crosses the trigger")
    void shouldFireOnAverage() {
        WindowRuleEvaluator evaluator = new WindowRuleEvaluator(rule("avg(heartRate) > 120", 60));

        assertThat(evaluator.evaluate(vitals(0, 110))).isEmpty();
        Optional<Alert> alert = evaluator.evaluate(vitals(10, 140));

        assertThat(alert).isPresent();
        assertThat(alert.get().getDetails())
                .contains("Window trigger 'avg(heartRate) > 120' met")
                .contains("value=125.00 over 2 event(s) in 60 seconds");
    }

    @Test
    @DisplayName("Should forget values that left the window")
    void shouldForgetExpiredValues() {
        WindowRuleEvaluator evaluator = new WindowRuleEvaluator(rule("sum(amount) >= 100", 30));

        assertThat(evaluator.evaluate(transfer(0, 60))).isEmpty();
        assertThat(evaluator.evaluate(transfer(45, 60))).isEmpty();
        assertThat(evaluator.evaluate(transfer(50, 60))).isPresent();
    }

    @Test
    @DisplayName("Count trigger should count every matching event")
    void countTrigger() {
        WindowRuleEvaluator evaluator = new WindowRuleEvaluator(rule("count >= 3", 60));

        assertThat(evaluator.evaluate(Event.builder().subjectId("s").eventType("door")
                .timestamp(BASE).build())).isEmpty();
        assertThat(evaluator.evaluate(Event.builder().subjectId("s").eventType("door")
                .timestamp(BASE.plusSeconds(1)).build())).isEmpty();
        assertThat(evaluator.evaluate(Event.builder().subjectId("s").eventType("door")
                .timestamp(BASE.plusSeconds(2)).build())).isPresent();
    }

    @Test
    @DisplayName("Should skip events without the aggregated field")
    void shouldSkipMissingField() {
        WindowRuleEvaluator evaluator = new WindowRuleEvaluator(rule("max(heartRate) > 0", 60));

        assertThat(evaluator.evaluate(transfer(0, 10))).isEmpty();
    }

    private static MonitoringRule rule(String trigger, int windowSeconds) {
        MonitoringRule rule = new MonitoringRule();
        rule.setName("windowed");
        rule.setType("window");
        rule.setTrigger(trigger);
        rule.setWindowSeconds(windowSeconds);
        return rule;
    }

    private static Event vitals(int seconds, int heartRate) {
        return Event.builder().subjectId("patient-1").eventType("vitals")
                .timestamp(BASE.plusSeconds(seconds)).attribute("heartRate", heartRate).build();
    }

    private static Event transfer(int seconds, int amount) {
        return Event.builder().subjectId("alice").eventType("transfer")
                .timestamp(BASE.plusSeconds(seconds)).attribute("amount", amount).build();
    }
}
