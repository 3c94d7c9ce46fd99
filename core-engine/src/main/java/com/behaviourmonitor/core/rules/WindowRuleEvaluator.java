package com.behaviourmonitor.core.rules;

import com.behaviourmonitor.core.model.Alert;
import com.behaviourmonitor.core.model.Event;
import com.behaviourmonitor.core.model.MonitoringRule;
import com.behaviourmonitor.core.window.Aggregate;
import com.behaviourmonitor.core.window.SlidingWindow;
import com.behaviourmonitor.core.window.TriggerExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Window rule: a {@link TriggerExpression} evaluated over a sliding time
 * window of the subject's matching events.
 *
 * <p>
 * For {@code count} every matching event is a sample. For the other
 * aggregates only events carrying a numeric value for the expression's field
 * are sampled; other events are ignored.
 * </p>
 *
 * @since 1.0.0
 */
public class WindowRuleEvaluator extends AbstractRuleEvaluator {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(WindowRuleEvaluator.class);

    private final TriggerExpression trigger;
    private final SlidingWindow window;

    public WindowRuleEvaluator(MonitoringRule rule) {
        super(rule);
        this.trigger = TriggerExpression.parse(Objects.requireNonNull(rule.getTrigger(),
                "Trigger must not be null for window rule '" + ruleName + "'"));
        this.window = new SlidingWindow(requirePositiveWindow(rule));
    }

    @Override
    public Optional<Alert> evaluate(Event event) {
        Objects.requireNonNull(event, "Event must not be null");

        if (trigger.getAggregate() == Aggregate.COUNT) {
            window.add(event.getTimestamp(), 1);
        } else {
            Optional<Double> value = event.getNumericAttribute(trigger.getField());
            if (value.isEmpty()) {
                LOG.trace("Rule [{}]: field '{}' not present or not numeric - skipping",
                        ruleName, trigger.getField());
                return Optional.empty();
            }
            window.add(event.getTimestamp(), value.get());
        }

        if (trigger.test(window)) {
            OptionalDouble observed = trigger.getAggregate().apply(window);
            LOG.debug("Rule [{}] fired: '{}' observed={} samples={}",
                    ruleName, trigger, observed, window.count());
            return Optional.of(newAlert(event.getSubjectId(), event.getTimestamp(),
                    String.format("Window trigger '%s' met: value=%.2f over %d event(s) in %d seconds",
                            trigger, observed.orElse(Double.NaN), window.count(), window.getWindowSeconds()))
                    .evidence(event.getAttributes())
                    .build());
        }
        return Optional.empty();
    }
}
