package com.behaviourmonitor.core.rules;

import com.behaviourmonitor.core.model.Alert;
import com.behaviourmonitor.core.model.Event;
import com.behaviourmonitor.core.model.MonitoringRule;
import com.behaviourmonitor.core.window.SlidingWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Rate rule.
 *
 * <p>
 * Fires when the number of matching events for a subject exceeds the
 * configured threshold within a sliding time window (in seconds).
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * This evaluator is <strong>stateful</strong>. One instance is held per
 * subject.
 * </p>
 *
 * @since 1.0.0
 */
public class RateRuleEvaluator extends AbstractRuleEvaluator {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(RateRuleEvaluator.class);

    private final int windowSeconds;
    private final double threshold;
    private final SlidingWindow window;

    /**
     * @param rule the rule configuration
     * @throws NullPointerException     if {@code rule} is {@code null}
     * @throws IllegalArgumentException if {@code windowSeconds} or
     *                                  {@code threshold} are invalid
     */
    public RateRuleEvaluator(MonitoringRule rule) {
        super(rule);
        this.windowSeconds = requirePositiveWindow(rule);
        this.threshold = rule.getThreshold();
        if (threshold <= 0) {
            throw new IllegalArgumentException(
                    "threshold must be > 0 for rule '" + ruleName + "', got: " + threshold);
        }
        this.window = new SlidingWindow(windowSeconds);
    }

    @Override
    public Optional<Alert> evaluate(Event event) {
        Objects.requireNonNull(event, "Event must not be null");

        window.add(event.getTimestamp(), 1);
        int count = window.count();

        if (count > threshold) {
            LOG.debug("Rule [{}] fired: count={} > threshold={}", ruleName, count, threshold);
            return Optional.of(newAlert(event.getSubjectId(), event.getTimestamp(),
                    String.format("Rate spike: %d events in %d seconds (threshold: %.0f)",
                            count, windowSeconds, threshold))
                    .evidence(event.getAttributes())
                    .build());
        }
        return Optional.empty();
    }
}
