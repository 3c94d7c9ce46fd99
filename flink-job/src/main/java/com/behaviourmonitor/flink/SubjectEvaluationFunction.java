package com.behaviourmonitor.flink;

import com.behaviourmonitor.core.engine.Evaluation;
import com.behaviourmonitor.core.engine.RuleEngine;
import com.behaviourmonitor.core.engine.SubjectState;
import com.behaviourmonitor.core.model.Alert;
import com.behaviourmonitor.core.model.Event;
import org.apache.flink.api.common.state.StateTtlConfig;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.time.Time;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Flink {@link KeyedProcessFunction}, keyed by subject id, that runs the
 * {@link RuleEngine} over each subject's events.
 *
 * <h3>State Management</h3>
 * <p>
 * A {@code ValueState<SubjectState>} holds the subject's evaluators, windows
 * and cooldown clocks. It is snapshotted with every checkpoint. Alongside it
 * the function keeps the processing time at which the subject's latest event
 * was handled and the time of the next pending tick. All three carry a TTL of
 * the configured retention.
 * </p>
 *
 * <h3>Ticks</h3>
 * <p>
 * When time-driven rules (inactivity, dwell) are configured, a processing
 * time timer fires every monitoring interval per subject. Rules keep event
 * time, so the timer does not pass the wall clock to the engine: it calls
 * {@link RuleEngine#tickAfterIdle} with the processing time elapsed since the
 * subject's latest event, which advances the subject's event-time clock by
 * exactly the time it has been silent.
 * </p>
 *
 * <h3>Retention</h3>
 * <p>
 * Ticks rewrite the state and would keep renewing its TTL. A tick that finds
 * the subject silent for the whole retention period therefore clears all of
 * the subject's state and ends the timer chain; the next event starts afresh.
 * </p>
 *
 * @since 1.0.0
 */
public class SubjectEvaluationFunction extends KeyedProcessFunction<String, Event, Alert> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SubjectEvaluationFunction.class);

    private final RuleEngine engine;
    private final long tickIntervalMs;
    private final int retentionDays;
    private final long retentionMs;

    private transient ValueState<SubjectState> subjectState;
    private transient ValueState<Long> lastEventAt;
    private transient ValueState<Long> nextTick;
    private transient MonitorMetrics metrics;

    /**
     * @param engine                    configured rule engine
     * @param monitoringIntervalSeconds tick period for time-driven rules
     * @param retentionDays             keyed-state time-to-live
     */
    public SubjectEvaluationFunction(RuleEngine engine, int monitoringIntervalSeconds, int retentionDays) {
        this.engine = Objects.requireNonNull(engine, "RuleEngine must not be null");
        if (monitoringIntervalSeconds < 1) {
            throw new IllegalArgumentException(
                    "monitoringIntervalSeconds must be >= 1, got: " + monitoringIntervalSeconds);
        }
        if (retentionDays < 1) {
            throw new IllegalArgumentException("retentionDays must be >= 1, got: " + retentionDays);
        }
        this.tickIntervalMs = monitoringIntervalSeconds * 1_000L;
        this.retentionDays = retentionDays;
        this.retentionMs = Duration.ofDays(retentionDays).toMillis();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        StateTtlConfig ttl = StateTtlConfig.newBuilder(Time.days(retentionDays))
                .setUpdateType(StateTtlConfig.UpdateType.OnCreateAndWrite)
                .setStateVisibility(StateTtlConfig.StateVisibility.NeverReturnExpired)
                .build();

        ValueStateDescriptor<SubjectState> stateDescriptor = new ValueStateDescriptor<>(
                "subject-state", TypeInformation.of(SubjectState.class));
        stateDescriptor.enableTimeToLive(ttl);
        subjectState = getRuntimeContext().getState(stateDescriptor);

        ValueStateDescriptor<Long> lastEventDescriptor = new ValueStateDescriptor<>("last-event-at", Types.LONG);
        lastEventDescriptor.enableTimeToLive(ttl);
        lastEventAt = getRuntimeContext().getState(lastEventDescriptor);

        ValueStateDescriptor<Long> tickDescriptor = new ValueStateDescriptor<>("next-tick", Types.LONG);
        tickDescriptor.enableTimeToLive(ttl);
        nextTick = getRuntimeContext().getState(tickDescriptor);

        metrics = new MonitorMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("SubjectEvaluationFunction opened with {} rule(s), tick every {} ms",
                engine.getRules().size(), tickIntervalMs);
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(Event event,
            KeyedProcessFunction<String, Event, Alert>.Context ctx,
            Collector<Alert> out) throws Exception {
        long startNanos = System.nanoTime();

        SubjectState state = subjectState.value();
        if (state == null) {
            state = engine.newState(ctx.getCurrentKey());
        }

        Evaluation evaluation = engine.evaluate(state, event);
        subjectState.update(state);
        emit(evaluation, out);

        long now = ctx.timerService().currentProcessingTime();
        if (engine.hasTimeDrivenRules()) {
            lastEventAt.update(now);
            if (nextTick.value() == null) {
                long at = now + tickIntervalMs;
                ctx.timerService().registerProcessingTimeTimer(at);
                nextTick.update(at);
            }
        }

        metrics.incrementEventsProcessed();
        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
    }

    @Override
    public void onTimer(long timestamp,
            KeyedProcessFunction<String, Event, Alert>.OnTimerContext ctx,
            Collector<Alert> out) throws Exception {
        SubjectState state = subjectState.value();
        if (state == null) {
            clear();
            return;
        }

        Long handledAt = lastEventAt.value();
        long idleMs = handledAt != null ? timestamp - handledAt : 0L;
        if (idleMs >= retentionMs) {
            LOG.debug("Subject {} silent for {} day(s), dropping its state", ctx.getCurrentKey(), retentionDays);
            clear();
            return;
        }
        if (handledAt == null) {
            lastEventAt.update(timestamp);
        }

        Evaluation evaluation = engine.tickAfterIdle(state, Duration.ofMillis(idleMs));
        subjectState.update(state);
        emit(evaluation, out);

        long at = timestamp + tickIntervalMs;
        ctx.timerService().registerProcessingTimeTimer(at);
        nextTick.update(at);
    }

    private void clear() {
        subjectState.clear();
        lastEventAt.clear();
        nextTick.clear();
    }

    private void emit(Evaluation evaluation, Collector<Alert> out) {
        for (Alert alert : evaluation.getAlerts()) {
            out.collect(alert);
            LOG.info("Alert fired: rule={} subject={} severity={}",
                    alert.getRuleName(), alert.getSubjectId(), alert.getSeverity());
        }
        metrics.incrementAlertsFired(evaluation.getAlerts().size());
        metrics.incrementAlertsSuppressed(evaluation.getSuppressed());
    }
}
