package com.behaviourmonitor.core.rules;

import com.behaviourmonitor.core.model.Alert;
import com.behaviourmonitor.core.model.Event;
import com.behaviourmonitor.core.model.MonitoringRule;
import com.behaviourmonitor.core.window.Comparison;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Threshold rule.
 *
 * <p>
 * Fires when a numeric attribute compares true against the configured
 * threshold (default operator {@code >}). This is a <strong>stateless</strong>
 * evaluator: each event is evaluated independently.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdRuleEvaluator extends AbstractRuleEvaluator {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ThresholdRuleEvaluator.class);

    private final String field;
    private final Comparison comparison;
    private final double threshold;

    public ThresholdRuleEvaluator(MonitoringRule rule) {
        super(rule);
        this.field = requireField(rule, "threshold");
        this.comparison = Comparison.parse(rule.getOperator());
        this.threshold = rule.getThreshold();
    }

    @Override
    public Optional<Alert> evaluate(Event event) {
        Objects.requireNonNull(event, "Event must not be null");

        Optional<Double> value = event.getNumericAttribute(field);
        if (value.isEmpty()) {
            LOG.trace("Rule [{}]: field '{}' not present or not numeric - skipping", ruleName, field);
            return Optional.empty();
        }

        double v = value.get();
        if (comparison.test(v, threshold)) {
            LOG.debug("Rule [{}] fired: {}={} {} {}", ruleName, field, v, comparison.symbol(), threshold);
            return Optional.of(newAlert(event.getSubjectId(), event.getTimestamp(),
                    String.format("Threshold crossed: %s=%.2f %s %.2f",
                            field, v, comparison.symbol(), threshold))
                    .evidence(event.getAttributes())
                    .build());
        }
        return Optional.empty();
    }
}
