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
 * Consecutive-confirmation rule.
 *
 * <p>
 * Fires once a condition ({@code field operator threshold}) has held for
 * {@code consecutive} matching events in a row, e.g. a classifier confidence
 * above 0.95 on five frames running. Any event that fails the condition
 * resets the streak, and so does firing. Events without the field leave the
 * streak untouched.
 * </p>
 *
 * @since 1.0.0
 */
public class ConsecutiveRuleEvaluator extends AbstractRuleEvaluator {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ConsecutiveRuleEvaluator.class);

    private final String field;
    private final Comparison comparison;
    private final double threshold;
    private final int required;

    private int streak;

    public ConsecutiveRuleEvaluator(MonitoringRule rule) {
        super(rule);
        this.field = requireField(rule, "consecutive");
        this.comparison = Comparison.parse(rule.getOperator());
        this.threshold = rule.getThreshold();
        this.required = rule.getConsecutive();
        if (required < 1) {
            throw new IllegalArgumentException(
                    "consecutive must be >= 1 for rule '" + ruleName + "', got: " + required);
        }
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
        if (!comparison.test(v, threshold)) {
            streak = 0;
            return Optional.empty();
        }

        streak++;
        if (streak < required) {
            return Optional.empty();
        }

        streak = 0;
        LOG.debug("Rule [{}] fired: {} consecutive events with {} {} {}",
                ruleName, required, field, comparison.symbol(), threshold);
        return Optional.of(newAlert(event.getSubjectId(), event.getTimestamp(),
                String.format("%s %s %.2f for %d consecutive events (last value %.2f)",
                        field, comparison.symbol(), threshold, required, v))
                .evidence(event.getAttributes())
                .build());
    }

    int getStreak() {
        return streak;
    }
}
