package com.behaviourmonitor.core.engine;

import com.behaviourmonitor.core.config.EngineSettings;
import com.behaviourmonitor.core.config.MonitoringConfig;
import com.behaviourmonitor.core.dispatch.AlertChannel;
import com.behaviourmonitor.core.dispatch.AlertDispatcher;
import com.behaviourmonitor.core.dispatch.DispatchResult;
import com.behaviourmonitor.core.intake.EventIntake;
import com.behaviourmonitor.core.intake.EventValidationException;
import com.behaviourmonitor.core.model.Alert;
import com.behaviourmonitor.core.model.Event;
import com.behaviourmonitor.core.model.RawEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process monitoring pipeline: intake, rule evaluation and dispatch, with
 * per-subject state kept in memory.
 *
 * <pre>
 *   RawEvent
 *     -&gt; EventIntake (validate, normalise)
 *     -&gt; RuleEngine   (per-subject windows, rules, cooldowns)
 *     -&gt; AlertDispatcher (dedup, channels)
 * </pre>
 *
 * <p>
 * This class is thread-safe. Events for the same subject are evaluated one
 * at a time; different subjects proceed in parallel.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitoringEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MonitoringEngine.class);

    private final EventIntake intake;
    private final RuleEngine ruleEngine;
    private final AlertDispatcher dispatcher;
    private final EngineStatistics statistics = new EngineStatistics();
    private final Map<String, SubjectState> states = new ConcurrentHashMap<>();
    private final Clock clock;

    public MonitoringEngine(MonitoringConfig config, EngineSettings settings,
            Collection<? extends AlertChannel> channels) {
        this(config, settings, channels, Clock.systemUTC());
    }

    /**
     * @param config   validated rules and subjects
     * @param settings engine defaults
     * @param channels alert channels available to the dispatcher
     * @param clock    clock used as ingestion time
     */
    public MonitoringEngine(MonitoringConfig config, EngineSettings settings,
            Collection<? extends AlertChannel> channels, Clock clock) {
        Objects.requireNonNull(config, "MonitoringConfig must not be null");
        Objects.requireNonNull(settings, "EngineSettings must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");

        SubjectRegistry registry = new SubjectRegistry(config.getSubjects());
        this.intake = new EventIntake(settings);
        this.ruleEngine = new RuleEngine(config.getRules(), registry, settings);
        this.dispatcher = new AlertDispatcher(channels, registry, settings);
    }

    /**
     * Validate, evaluate and dispatch one raw event.
     *
     * @param raw raw event
     * @return alerts that were newly dispatched
     * @throws EventValidationException if the event is rejected by intake
     */
    public List<Alert> submit(RawEvent raw) {
        Event event;
        try {
            event = intake.normalize(raw, clock.instant());
        } catch (EventValidationException e) {
            statistics.eventRejected();
            LOG.warn("Rejected event: {}", e.getMessage());
            throw e;
        }
        return submit(event);
    }

    /**
     * Evaluate and dispatch one already normalised event.
     *
     * @param event normalised event
     * @return alerts that were newly dispatched
     */
    public List<Alert> submit(Event event) {
        Objects.requireNonNull(event, "Event must not be null");
        SubjectState state = states.computeIfAbsent(event.getSubjectId(), ruleEngine::newState);
        Evaluation evaluation;
        synchronized (state) {
            evaluation = ruleEngine.evaluate(state, event);
        }
        statistics.eventProcessed();
        return dispatchAll(evaluation);
    }

    /**
     * Run the time-driven rules for every known subject.
     *
     * @param now current time
     * @return alerts that were newly dispatched
     */
    public List<Alert> tick(Instant now) {
        List<Alert> dispatched = new ArrayList<>();
        for (SubjectState state : states.values()) {
            Evaluation evaluation;
            synchronized (state) {
                evaluation = ruleEngine.tick(state, now);
            }
            dispatched.addAll(dispatchAll(evaluation));
        }
        return dispatched;
    }

    /**
     * Forget subjects not seen within the retention period.
     *
     * @param now       current time
     * @param retention how long an idle subject's state is kept
     * @return number of subjects evicted
     */
    public int evictIdleSubjects(Instant now, Duration retention) {
        Instant cutoff = now.minus(retention);
        int evicted = 0;
        Iterator<SubjectState> it = states.values().iterator();
        while (it.hasNext()) {
            SubjectState state = it.next();
            Instant lastSeen = state.getLastSeen();
            if (lastSeen != null && lastSeen.isBefore(cutoff)) {
                it.remove();
                evicted++;
            }
        }
        if (evicted > 0) {
            LOG.info("Evicted {} idle subject(s) not seen since {}", evicted, cutoff);
        }
        return evicted;
    }

    public EngineStatistics statistics() {
        return statistics;
    }

    public void resetStatistics() {
        statistics.reset();
        LOG.info("Statistics reset");
    }

    public SubjectRegistry registry() {
        return ruleEngine.getRegistry();
    }

    public int trackedSubjects() {
        return states.size();
    }

    private List<Alert> dispatchAll(Evaluation evaluation) {
        statistics.alertsSuppressed(evaluation.getSuppressed());
        List<Alert> dispatched = new ArrayList<>();
        for (Alert alert : evaluation.getAlerts()) {
            statistics.alertFired(alert.getRuleName());
            DispatchResult result = dispatcher.dispatch(alert);
            if (result.isDuplicate()) {
                statistics.alertDuplicate();
            } else {
                statistics.alertDispatched();
                dispatched.add(alert);
            }
        }
        return dispatched;
    }
}
