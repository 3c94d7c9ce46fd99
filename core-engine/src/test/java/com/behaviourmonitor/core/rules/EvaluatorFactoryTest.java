package com.behaviourmonitor.core.rules;

import com.behaviourmonitor.core.config.EngineSettings;
import com.behaviourmonitor.core.model.MonitoringRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EvaluatorFactory}.
 */
class EvaluatorFactoryTest {

    private final EngineSettings settings = EngineSettings.defaults();

    @Test
    @DisplayName("Should create the evaluator class matching each rule type")
    void shouldCreateMatchingEvaluators() {
        MonitoringRule rate = rule("r", "rate");
        rate.setWindowSeconds(10);
        rate.setThreshold(5);

        MonitoringRule threshold = rule("t", "threshold");
        threshold.setField("x");

        MonitoringRule statistical = rule("s", "statistical");
        statistical.setField("x");

        MonitoringRule window = rule("w", "window");
        window.setWindowSeconds(10);
        window.setTrigger("count > 1");

        MonitoringRule consecutive = rule("c", "consecutive");
        consecutive.setField("x");

        MonitoringRule inactivity = rule("i", "inactivity");
        inactivity.setWindowSeconds(10);

        MonitoringRule dwell = rule("d", "dwell");
        dwell.setField("zone");
        dwell.setValue("restroom");
        dwell.setWindowSeconds(10);

        assertThat(EvaluatorFactory.create(rate, settings)).isInstanceOf(RateRuleEvaluator.class);
        assertThat(EvaluatorFactory.create(threshold, settings)).isInstanceOf(ThresholdRuleEvaluator.class);
        assertThat(EvaluatorFactory.create(statistical, settings)).isInstanceOf(StatisticalRuleEvaluator.class);
        assertThat(EvaluatorFactory.create(window, settings)).isInstanceOf(WindowRuleEvaluator.class);
        assertThat(EvaluatorFactory.create(consecutive, settings)).isInstanceOf(ConsecutiveRuleEvaluator.class);
        assertThat(EvaluatorFactory.create(inactivity, settings)).isInstanceOf(InactivityRuleEvaluator.class);
        assertThat(EvaluatorFactory.create(dwell, settings)).isInstanceOf(DwellRuleEvaluator.class);
    }

    @Test
    @DisplayName("Should throw for unknown rule type")
    void shouldThrowForUnknownType() {
        assertThatThrownBy(() -> EvaluatorFactory.create(rule("x", "unknown"), settings))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown rule type");
    }

    @Test
    @DisplayName("Should skip disabled rules in createAll")
    void shouldSkipDisabledRules() {
        MonitoringRule enabled = rule("on", "threshold");
        enabled.setField("x");
        MonitoringRule disabled = rule("off", "threshold");
        disabled.setField("x");
        disabled.setEnabled(false);

        List<RuleEvaluator> evaluators = EvaluatorFactory.createAll(List.of(enabled, disabled), settings);

        assertThat(evaluators).extracting(RuleEvaluator::getRuleName).containsExactly("on");
    }

    private static MonitoringRule rule(String name, String type) {
        MonitoringRule rule = new MonitoringRule();
        rule.setName(name);
        rule.setType(type);
        return rule;
    }
}
