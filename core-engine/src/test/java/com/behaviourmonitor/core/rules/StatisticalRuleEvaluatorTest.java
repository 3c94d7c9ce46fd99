package com.behaviourmonitor.core.rules;

import com.behaviourmonitor.core.model.Alert;
import com.behaviourmonitor.core.model.Event;
import com.behaviourmonitor.core.model.MonitoringRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StatisticalRuleEvaluator}.
 */
class StatisticalRuleEvaluatorTest {

    @Test
    @DisplayName("Should NOT fire before minimum history is accumulated")
    void shouldNotFireWithInsufficientHistory() {
        StatisticalRuleEvaluator evaluator = new StatisticalRuleEvaluator(rule(null), 2.0);

        assertThat(evaluator.evaluate(event(10))).isEmpty();
        assertThat(evaluator.evaluate(event(1000))).isEmpty();
    }

    @Test
    @DisplayName("Should fire on a value far from the moving average")
    void shouldFireOnOutlier() {
        StatisticalRuleEvaluator evaluator = new StatisticalRuleEvaluator(rule(null), 2.0);
        for (int v : new int[] {70, 72, 68, 71, 69}) {
            assertThat(evaluator.evaluate(event(v))).isEmpty();
        }

        Optional<Alert> alert = evaluator.evaluate(event(140));

        assertThat(alert).isPresent();
        assertThat(alert.get().getDetails()).startsWith("Statistical outlier: heartRate=140.00");
    }

    @Test
    @DisplayName("Should NOT fire on a value within the deviation band")
    void shouldNotFireWithinBand() {
        StatisticalRuleEvaluator evaluator = new StatisticalRuleEvaluator(rule(null), 2.0);
        for (int v : new int[] {70, 72, 68, 71, 69}) {
            evaluator.evaluate(event(v));
        }

        assertThat(evaluator.evaluate(event(71))).isEmpty();
    }

    @Test
    @DisplayName("Rule deviation factor should override the engine default")
    void ruleFactorOverridesDefault() {
        StatisticalRuleEvaluator evaluator = new StatisticalRuleEvaluator(rule(10.0), 2.0);
        for (int v : new int[] {70, 72, 68, 71, 69}) {
            evaluator.evaluate(event(v));
        }

        assertThat(evaluator.evaluate(event(75))).isEmpty();
    }

    @Test
    @DisplayName("Should reject a window smaller than the minimum history")
    void shouldRejectSmallWindow() {
        MonitoringRule rule = rule(null);
        rule.setWindowSize(1);

        assertThatThrownBy(() -> new StatisticalRuleEvaluator(rule, 2.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowSize");
    }

    private static MonitoringRule rule(Double deviationFactor) {
        MonitoringRule rule = new MonitoringRule();
        rule.setName("heart-rate-outlier");
        rule.setType("statistical");
        rule.setField("heartRate");
        rule.setWindowSize(10);
        rule.setDeviationFactor(deviationFactor);
        return rule;
    }

    private static Event event(int heartRate) {
        return Event.builder()
                .subjectId("patient-1")
                .eventType("vitals")
                .timestamp(Instant.now())
                .attribute("heartRate", heartRate)
                .build();
    }
}
