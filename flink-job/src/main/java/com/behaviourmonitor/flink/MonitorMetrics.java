package com.behaviourmonitor.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Custom Flink metric definitions for Behaviour Monitor.
 * <p>
 * Flink exposes these via its configured metric reporters (e.g. Prometheus).
 * The reporter is configured at cluster level; the job only defines the
 * metrics.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code events_processed_total} - events evaluated</li>
 *   <li>{@code alerts_fired_total} - alerts admitted by the rule engine</li>
 *   <li>{@code alerts_suppressed_total} - alerts held back by cooldowns</li>
 *   <li>{@code alerts_dispatched_total} - alerts delivered downstream</li>
 *   <li>{@code alerts_duplicate_total} - alerts dropped as duplicates</li>
 *   <li>{@code processing_latency_ms} - per-event evaluation latency</li>
 * </ul>
 */
public class MonitorMetrics {

    private final Counter eventsProcessed;
    private final Counter alertsFired;
    private final Counter alertsSuppressed;
    private final Counter alertsDispatched;
    private final Counter alertsDuplicate;
    private final Histogram processingLatency;

    public MonitorMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("behaviour_monitor");

        this.eventsProcessed = group.counter("events_processed_total");
        this.alertsFired = group.counter("alerts_fired_total");
        this.alertsSuppressed = group.counter("alerts_suppressed_total");
        this.alertsDispatched = group.counter("alerts_dispatched_total");
        this.alertsDuplicate = group.counter("alerts_duplicate_total");

        // sliding window of 350 samples, exposes p50/p95/p99
        this.processingLatency = group
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementEventsProcessed() {
        eventsProcessed.inc();
    }

    public void incrementAlertsFired(int count) {
        alertsFired.inc(count);
    }

    public void incrementAlertsSuppressed(int count) {
        alertsSuppressed.inc(count);
    }

    public void incrementAlertsDispatched() {
        alertsDispatched.inc();
    }

    public void incrementAlertsDuplicate() {
        alertsDuplicate.inc();
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}
