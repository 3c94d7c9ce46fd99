package com.behaviourmonitor.core.rules;

import com.behaviourmonitor.core.model.Alert;
import com.behaviourmonitor.core.model.MonitoringRule;
import com.behaviourmonitor.core.model.Severity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base class holding the alert metadata every evaluator copies from its rule.
 *
 * @since 1.0.0
 */
public abstract class AbstractRuleEvaluator implements RuleEvaluator {

    private static final long serialVersionUID = 1L;

    protected final String ruleName;
    private final Severity severity;
    private final String action;
    private final List<String> channels;

    protected AbstractRuleEvaluator(MonitoringRule rule) {
        Objects.requireNonNull(rule, "MonitoringRule must not be null");
        this.ruleName = Objects.requireNonNull(rule.getName(), "Rule name must not be null");
        this.severity = rule.severityLevel();
        this.action = rule.getAction();
        this.channels = new ArrayList<>(rule.getChannels());
    }

    /**
     * Start an alert for this rule with the shared metadata filled in.
     */
    protected Alert.Builder newAlert(String subjectId, Instant timestamp, String details) {
        return Alert.builder()
                .ruleName(ruleName)
                .subjectId(subjectId)
                .timestamp(timestamp)
                .severity(severity)
                .action(action)
                .channels(channels)
                .details(details);
    }

    protected static String requireField(MonitoringRule rule, String kind) {
        return Objects.requireNonNull(rule.getField(),
                "Field must not be null for " + kind + " rule '" + rule.getName() + "'");
    }

    protected static int requirePositiveWindow(MonitoringRule rule) {
        if (rule.getWindowSeconds() <= 0) {
            throw new IllegalArgumentException(
                    "windowSeconds must be > 0 for rule '" + rule.getName() + "', got: "
                            + rule.getWindowSeconds());
        }
        return rule.getWindowSeconds();
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }
}
