package com.behaviourmonitor.core.engine;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Running counters of a {@link MonitoringEngine}. Thread-safe; can be reset
 * at any time.
 *
 * @since 1.0.0
 */
public class EngineStatistics {

    private final LongAdder eventsProcessed = new LongAdder();
    private final LongAdder eventsRejected = new LongAdder();
    private final LongAdder alertsSuppressed = new LongAdder();
    private final LongAdder alertsDispatched = new LongAdder();
    private final LongAdder alertsDuplicate = new LongAdder();
    private final ConcurrentHashMap<String, LongAdder> alertsByRule = new ConcurrentHashMap<>();

    void eventProcessed() {
        eventsProcessed.increment();
    }

    void eventRejected() {
        eventsRejected.increment();
    }

    void alertFired(String ruleName) {
        alertsByRule.computeIfAbsent(ruleName, k -> new LongAdder()).increment();
    }

    void alertsSuppressed(int count) {
        alertsSuppressed.add(count);
    }

    void alertDispatched() {
        alertsDispatched.increment();
    }

    void alertDuplicate() {
        alertsDuplicate.increment();
    }

    public long getEventsProcessed() {
        return eventsProcessed.sum();
    }

    public long getEventsRejected() {
        return eventsRejected.sum();
    }

    public long getAlertsSuppressed() {
        return alertsSuppressed.sum();
    }

    public long getAlertsDispatched() {
        return alertsDispatched.sum();
    }

    public long getAlertsDuplicate() {
        return alertsDuplicate.sum();
    }

    public long getAlertsFired() {
        return alertsByRule.values().stream().mapToLong(LongAdder::sum).sum();
    }

    /**
     * @return snapshot of fired-alert counts per rule, sorted by rule name
     */
    public Map<String, Long> getAlertsByRule() {
        Map<String, Long> snapshot = new TreeMap<>();
        alertsByRule.forEach((rule, count) -> snapshot.put(rule, count.sum()));
        return snapshot;
    }

    public void reset() {
        eventsProcessed.reset();
        eventsRejected.reset();
        alertsSuppressed.reset();
        alertsDispatched.reset();
        alertsDuplicate.reset();
        alertsByRule.clear();
    }

    @Override
    public String toString() {
        return "EngineStatistics{" +
                "eventsProcessed=" + getEventsProcessed() +
                ", eventsRejected=" + getEventsRejected() +
                ", alertsFired=" + getAlertsFired() +
                ", alertsSuppressed=" + getAlertsSuppressed() +
                ", alertsDispatched=" + getAlertsDispatched() +
                ", alertsByRule=" + getAlertsByRule() +
                '}';
    }
}
