package com.behaviourmonitor.core.rules;

import com.behaviourmonitor.core.model.Alert;
import com.behaviourmonitor.core.model.Event;
import com.behaviourmonitor.core.model.MonitoringRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * Statistical outlier rule based on a moving average.
 *
 * <p>
 * Keeps the last <i>N</i> values of a numeric attribute. A new value is an
 * outlier when it deviates from the moving average by more than
 * {@code deviationFactor x stddev}.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * Outlier checks only engage after at least {@value #MIN_HISTORY_SIZE}
 * observations have been recorded.
 * </p>
 *
 * @since 1.0.0
 */
public class StatisticalRuleEvaluator extends AbstractRuleEvaluator {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(StatisticalRuleEvaluator.class);

    /** Minimum number of observations required before outlier checks begin. */
    static final int MIN_HISTORY_SIZE = 2;

    private final String field;
    private final int windowSize;
    private final double deviationFactor;

    private final Deque<Double> history = new ArrayDeque<>();

    /**
     * @param rule                   the rule configuration
     * @param defaultDeviationFactor used when the rule sets no
     *                               {@code deviationFactor}
     * @throws IllegalArgumentException if {@code windowSize} or the deviation
     *                                  factor are invalid
     */
    public StatisticalRuleEvaluator(MonitoringRule rule, double defaultDeviationFactor) {
        super(rule);
        this.field = requireField(rule, "statistical");
        this.windowSize = rule.getWindowSize();
        this.deviationFactor = rule.getDeviationFactor() != null
                ? rule.getDeviationFactor()
                : defaultDeviationFactor;

        if (windowSize < MIN_HISTORY_SIZE) {
            throw new IllegalArgumentException(
                    "windowSize must be >= " + MIN_HISTORY_SIZE + " for rule '" + ruleName
                            + "', got: " + windowSize);
        }
        if (deviationFactor <= 0) {
            throw new IllegalArgumentException(
                    "deviationFactor must be > 0 for rule '" + ruleName + "', got: " + deviationFactor);
        }
    }

    @Override
    public Optional<Alert> evaluate(Event event) {
        Objects.requireNonNull(event, "Event must not be null");

        Optional<Double> optValue = event.getNumericAttribute(field);
        if (optValue.isEmpty()) {
            LOG.trace("Rule [{}]: field '{}' not present or not numeric - skipping", ruleName, field);
            return Optional.empty();
        }

        double value = optValue.get();
        Optional<Alert> result = Optional.empty();

        if (history.size() >= MIN_HISTORY_SIZE) {
            double mean = computeMean();
            double stddev = computeStdDev(mean);

            // zero stddev: every different value is an outlier
            double allowedDeviation = stddev == 0 ? 0 : deviationFactor * stddev;
            double diff = Math.abs(value - mean);

            if (diff > allowedDeviation) {
                LOG.debug("Rule [{}] fired: value={} mean={} stddev={} deviation={}",
                        ruleName, value, mean, stddev, diff);
                result = Optional.of(newAlert(event.getSubjectId(), event.getTimestamp(),
                        String.format("Statistical outlier: %s=%.2f (mean=%.2f, stddev=%.2f, factor=%.1f)",
                                field, value, mean, stddev, deviationFactor))
                        .evidence(event.getAttributes())
                        .build());
            }
        }

        // the current value must not influence its own evaluation
        history.addLast(value);
        if (history.size() > windowSize) {
            history.pollFirst();
        }
        return result;
    }

    private double computeMean() {
        double sum = 0;
        for (double v : history) {
            sum += v;
        }
        return sum / history.size();
    }

    private double computeStdDev(double mean) {
        double sumSquaredDiff = 0;
        for (double v : history) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / history.size());
    }
}
