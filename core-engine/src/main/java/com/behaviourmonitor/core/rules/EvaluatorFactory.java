package com.behaviourmonitor.core.rules;

import com.behaviourmonitor.core.config.EngineSettings;
import com.behaviourmonitor.core.model.MonitoringRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link RuleEvaluator} instances from
 * {@link MonitoringRule} configurations.
 *
 * <p>
 * This is the single point of extension when adding new rule types:
 * register the new type string here and create the corresponding evaluator.
 * </p>
 *
 * @since 1.0.0
 */
public final class EvaluatorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(EvaluatorFactory.class);

    private EvaluatorFactory() {
        // utility class
    }

    /**
     * Create an evaluator for the given rule.
     *
     * @param rule     the rule configuration; must not be {@code null}
     * @param settings engine defaults; must not be {@code null}
     * @return a fresh evaluator with empty state
     * @throws IllegalArgumentException if the rule type is unknown
     */
    public static RuleEvaluator create(MonitoringRule rule, EngineSettings settings) {
        Objects.requireNonNull(rule, "MonitoringRule must not be null");
        Objects.requireNonNull(settings, "EngineSettings must not be null");
        Objects.requireNonNull(rule.getType(), "Rule type must not be null");

        return switch (rule.getType()) {
            case MonitoringRule.TYPE_RATE -> new RateRuleEvaluator(rule);
            case MonitoringRule.TYPE_THRESHOLD -> new ThresholdRuleEvaluator(rule);
            case MonitoringRule.TYPE_STATISTICAL -> new StatisticalRuleEvaluator(rule, settings.getAnomalyThreshold());
            case MonitoringRule.TYPE_WINDOW -> new WindowRuleEvaluator(rule);
            case MonitoringRule.TYPE_CONSECUTIVE -> new ConsecutiveRuleEvaluator(rule);
            case MonitoringRule.TYPE_INACTIVITY -> new InactivityRuleEvaluator(rule);
            case MonitoringRule.TYPE_DWELL -> new DwellRuleEvaluator(rule);
            default -> throw new IllegalArgumentException(
                    "Unknown rule type: '" + rule.getType()
                            + "'. Supported types: rate, threshold, statistical, window, consecutive, inactivity, dwell");
        };
    }

    /**
     * Create evaluators for every <em>enabled</em> rule in the list.
     *
     * @param rules    rule configurations; must not be {@code null}
     * @param settings engine defaults
     * @return unmodifiable list of evaluators (one per enabled rule)
     */
    public static List<RuleEvaluator> createAll(List<MonitoringRule> rules, EngineSettings settings) {
        Objects.requireNonNull(rules, "Rules list must not be null");
        List<RuleEvaluator> evaluators = rules.stream()
                .filter(MonitoringRule::isEnabled)
                .map(rule -> create(rule, settings))
                .toList();
        LOG.debug("Created {} evaluator(s) from {} rule(s)", evaluators.size(), rules.size());
        return evaluators;
    }
}
