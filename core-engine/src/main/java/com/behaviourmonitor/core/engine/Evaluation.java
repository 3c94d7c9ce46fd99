package com.behaviourmonitor.core.engine;

import com.behaviourmonitor.core.model.Alert;

import java.util.List;

/**
 * Result of one {@link RuleEngine} pass: the alerts that fired and how many
 * were held back by cooldowns.
 *
 * @since 1.0.0
 */
public final class Evaluation {

    private static final Evaluation EMPTY = new Evaluation(List.of(), 0);

    private final List<Alert> alerts;
    private final int suppressed;

    Evaluation(List<Alert> alerts, int suppressed) {
        this.alerts = List.copyOf(alerts);
        this.suppressed = suppressed;
    }

    static Evaluation empty() {
        return EMPTY;
    }

    public List<Alert> getAlerts() {
        return alerts;
    }

    public int getSuppressed() {
        return suppressed;
    }

    @Override
    public String toString() {
        return "Evaluation{alerts=" + alerts + ", suppressed=" + suppressed + '}';
    }
}
