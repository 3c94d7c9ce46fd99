package com.behaviourmonitor.core.rules;

import com.behaviourmonitor.core.model.Alert;
import com.behaviourmonitor.core.model.Event;
import com.behaviourmonitor.core.model.MonitoringRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Inactivity rule.
 *
 * <p>
 * Fires when a subject shows no activity for longer than
 * {@code windowSeconds}. Any matching event counts as activity; when the rule
 * names a {@code field}, only events whose numeric value of that field
 * exceeds {@code threshold} (e.g. a movement magnitude) do.
 * </p>
 *
 * <p>
 * The rule fires once per idle period and re-arms on the next activity. The
 * idle clock starts at the first event seen for the subject.
 * </p>
 *
 * @since 1.0.0
 */
public class InactivityRuleEvaluator extends AbstractRuleEvaluator {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(InactivityRuleEvaluator.class);

    private final int windowSeconds;
    private final String field;
    private final double threshold;

    private Instant lastActivity;
    private boolean alerted;

    public InactivityRuleEvaluator(MonitoringRule rule) {
        super(rule);
        this.windowSeconds = requirePositiveWindow(rule);
        this.field = rule.getField();
        this.threshold = rule.getThreshold();
    }

    @Override
    public Optional<Alert> evaluate(Event event) {
        Objects.requireNonNull(event, "Event must not be null");

        if (lastActivity == null || isActivity(event)) {
            if (lastActivity == null || event.getTimestamp().isAfter(lastActivity)) {
                lastActivity = event.getTimestamp();
            }
            alerted = false;
            return Optional.empty();
        }
        return check(event.getSubjectId(), event.getTimestamp());
    }

    @Override
    public Optional<Alert> onTick(String subjectId, Instant now) {
        return check(subjectId, now);
    }

    @Override
    public boolean isTimeDriven() {
        return true;
    }

    private boolean isActivity(Event event) {
        if (field == null) {
            return true;
        }
        return event.getNumericAttribute(field).map(v -> v > threshold).orElse(false);
    }

    private Optional<Alert> check(String subjectId, Instant now) {
        if (lastActivity == null || alerted) {
            return Optional.empty();
        }
        long idleSeconds = Duration.between(lastActivity, now).toSeconds();
        if (Duration.between(lastActivity, now).toMillis() <= windowSeconds * 1_000L) {
            return Optional.empty();
        }
        alerted = true;
        LOG.debug("Rule [{}] fired: subject {} idle for {}s", ruleName, subjectId, idleSeconds);
        return Optional.of(newAlert(subjectId, now,
                String.format("No activity for %d seconds (limit: %d seconds)", idleSeconds, windowSeconds))
                .build());
    }
}
