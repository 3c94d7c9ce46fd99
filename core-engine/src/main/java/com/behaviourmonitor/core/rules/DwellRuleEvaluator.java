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
 * Dwell rule.
 *
 * <p>
 * Fires when an attribute keeps one value (for example {@code zone} equal to
 * {@code restroom}) for longer than {@code windowSeconds}. After firing the
 * dwell clock restarts, so a subject that stays keeps producing alerts at most
 * once per window. An event with a different value ends the dwell; events
 * without the attribute are ignored.
 * </p>
 *
 * @since 1.0.0
 */
public class DwellRuleEvaluator extends AbstractRuleEvaluator {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(DwellRuleEvaluator.class);

    private final String field;
    private final String value;
    private final int windowSeconds;

    private Instant enteredAt;

    public DwellRuleEvaluator(MonitoringRule rule) {
        super(rule);
        this.field = requireField(rule, "dwell");
        this.value = Objects.requireNonNull(rule.getValue(),
                "Value must not be null for dwell rule '" + ruleName + "'");
        this.windowSeconds = requirePositiveWindow(rule);
    }

    @Override
    public Optional<Alert> evaluate(Event event) {
        Objects.requireNonNull(event, "Event must not be null");

        Optional<String> current = event.getStringAttribute(field);
        if (current.isEmpty()) {
            return Optional.empty();
        }

        if (!value.equals(current.get())) {
            if (enteredAt != null) {
                LOG.trace("Rule [{}]: subject {} left {}={}", ruleName, event.getSubjectId(), field, value);
            }
            enteredAt = null;
            return Optional.empty();
        }

        if (enteredAt == null) {
            enteredAt = event.getTimestamp();
            LOG.trace("Rule [{}]: subject {} entered {}={}", ruleName, event.getSubjectId(), field, value);
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

    private Optional<Alert> check(String subjectId, Instant now) {
        if (enteredAt == null) {
            return Optional.empty();
        }
        Duration dwell = Duration.between(enteredAt, now);
        if (dwell.toMillis() <= windowSeconds * 1_000L) {
            return Optional.empty();
        }
        enteredAt = now;
        LOG.debug("Rule [{}] fired: subject {} in {}={} for {}s",
                ruleName, subjectId, field, value, dwell.toSeconds());
        return Optional.of(newAlert(subjectId, now,
                String.format("%s=%s for %d seconds (limit: %d seconds)",
                        field, value, dwell.toSeconds(), windowSeconds))
                .build());
    }
}
