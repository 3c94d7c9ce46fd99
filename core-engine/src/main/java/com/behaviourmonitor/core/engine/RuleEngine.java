package com.behaviourmonitor.core.engine;

import com.behaviourmonitor.core.config.EngineSettings;
import com.behaviourmonitor.core.model.Alert;
import com.behaviourmonitor.core.model.Event;
import com.behaviourmonitor.core.model.MonitoringRule;
import com.behaviourmonitor.core.model.Subject;
import com.behaviourmonitor.core.rules.EvaluatorFactory;
import com.behaviourmonitor.core.rules.RuleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Evaluates the configured rules against one subject's events.
 *
 * <p>
 * The engine itself holds only configuration; all mutable state lives in the
 * {@link SubjectState} passed to each call, which lets the Flink job keep it
 * in keyed state and the in-process {@link MonitoringEngine} keep it in a map.
 * </p>
 *
 * <h3>Evaluation</h3>
 * <ol>
 * <li>Each enabled rule whose event-type and subject filters match is run.
 * An evaluator that throws is logged and skipped; the others still run.</li>
 * <li>An alert for a rule that already fired for the subject less than its
 * cooldown ago is suppressed and counted.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public class RuleEngine implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(RuleEngine.class);

    private final Map<String, MonitoringRule> rules = new LinkedHashMap<>();
    private final EngineSettings settings;
    private final SubjectRegistry registry;

    /**
     * @param rules    validated rules; disabled rules are ignored
     * @param registry subject registry used for subject filters
     * @param settings engine defaults
     * @throws IllegalArgumentException if two rules share a name
     */
    public RuleEngine(List<MonitoringRule> rules, SubjectRegistry registry, EngineSettings settings) {
        Objects.requireNonNull(rules, "Rules must not be null");
        this.registry = Objects.requireNonNull(registry, "SubjectRegistry must not be null");
        this.settings = Objects.requireNonNull(settings, "EngineSettings must not be null");
        for (MonitoringRule rule : rules) {
            if (!rule.isEnabled()) {
                LOG.info("Rule [{}] is disabled - skipping", rule.getName());
                continue;
            }
            if (this.rules.putIfAbsent(rule.getName(), rule) != null) {
                throw new IllegalArgumentException("Duplicate rule name: " + rule.getName());
            }
        }
        LOG.info("Rule engine initialised with {} active rule(s)", this.rules.size());
    }

    /**
     * Create fresh state for a subject, with one evaluator per active rule.
     *
     * @param subjectId subject id
     * @return new state
     */
    public SubjectState newState(String subjectId) {
        return new SubjectState(subjectId, EvaluatorFactory.createAll(new ArrayList<>(rules.values()), settings));
    }

    /**
     * Evaluate one event for the subject the state belongs to.
     *
     * @param state subject state; updated in place
     * @param event normalised event for the same subject
     * @return fired alerts and the number suppressed by cooldowns
     * @throws IllegalArgumentException if the event belongs to another subject
     */
    public Evaluation evaluate(SubjectState state, Event event) {
        Objects.requireNonNull(state, "SubjectState must not be null");
        Objects.requireNonNull(event, "Event must not be null");
        if (!state.getSubjectId().equals(event.getSubjectId())) {
            throw new IllegalArgumentException("Event for subject '" + event.getSubjectId()
                    + "' evaluated against state of '" + state.getSubjectId() + "'");
        }

        reconcile(state);
        state.touch(event.getTimestamp());
        Subject subject = registry.find(state.getSubjectId()).orElse(null);

        List<Alert> fired = new ArrayList<>();
        int suppressed = 0;
        for (RuleEvaluator evaluator : state.evaluators()) {
            MonitoringRule rule = rules.get(evaluator.getRuleName());
            if (!rule.matchesEventType(event.getEventType()) || !rule.matchesSubject(subject)) {
                continue;
            }
            Optional<Alert> alert;
            try {
                alert = evaluator.evaluate(event);
            } catch (RuntimeException e) {
                LOG.error("Rule [{}] threw an exception - continuing with next rule",
                        evaluator.getRuleName(), e);
                continue;
            }
            if (alert.isPresent()) {
                if (admit(state, rule, alert.get())) {
                    fired.add(alert.get());
                } else {
                    suppressed++;
                }
            }
        }
        return fired.isEmpty() && suppressed == 0 ? Evaluation.empty() : new Evaluation(fired, suppressed);
    }

    /**
     * Run the time-driven rules (inactivity, dwell) for a subject.
     *
     * @param state subject state; updated in place
     * @param now   current time
     * @return fired alerts and the number suppressed by cooldowns
     */
    public Evaluation tick(SubjectState state, Instant now) {
        Objects.requireNonNull(state, "SubjectState must not be null");
        Objects.requireNonNull(now, "now must not be null");

        reconcile(state);
        Subject subject = registry.find(state.getSubjectId()).orElse(null);

        List<Alert> fired = new ArrayList<>();
        int suppressed = 0;
        for (RuleEvaluator evaluator : state.evaluators()) {
            if (!evaluator.isTimeDriven()) {
                continue;
            }
            MonitoringRule rule = rules.get(evaluator.getRuleName());
            if (!rule.matchesSubject(subject)) {
                continue;
            }
            Optional<Alert> alert;
            try {
                alert = evaluator.onTick(state.getSubjectId(), now);
            } catch (RuntimeException e) {
                LOG.error("Rule [{}] threw an exception on tick - continuing with next rule",
                        evaluator.getRuleName(), e);
                continue;
            }
            if (alert.isPresent()) {
                if (admit(state, rule, alert.get())) {
                    fired.add(alert.get());
                } else {
                    suppressed++;
                }
            }
        }
        return fired.isEmpty() && suppressed == 0 ? Evaluation.empty() : new Evaluation(fired, suppressed);
    }

    /**
     * Tick a subject on its own event-time clock.
     *
     * <p>
     * The tick runs at the subject's newest event timestamp plus
     * {@code idle}, the time the subject has been silent since that event
     * was processed. Replaying a backlog therefore never ticks past the
     * events being replayed. A subject that has seen no events is not
     * ticked.
     * </p>
     *
     * @param state subject state
     * @param idle  time elapsed since the subject's newest event was handled
     * @return alerts fired and the number suppressed by cooldown
     */
    public Evaluation tickAfterIdle(SubjectState state, Duration idle) {
        Objects.requireNonNull(state, "SubjectState must not be null");
        Objects.requireNonNull(idle, "idle must not be null");

        Instant lastSeen = state.getLastSeen();
        if (lastSeen == null) {
            return Evaluation.empty();
        }
        return tick(state, lastSeen.plus(idle.isNegative() ? Duration.ZERO : idle));
    }

    /**
     * @return {@code true} if any active rule needs periodic {@link #tick}s
     */
    public boolean hasTimeDrivenRules() {
        return rules.values().stream().anyMatch(r -> MonitoringRule.TYPE_INACTIVITY.equals(r.getType())
                || MonitoringRule.TYPE_DWELL.equals(r.getType()));
    }

    public List<MonitoringRule> getRules() {
        return List.copyOf(rules.values());
    }

    public SubjectRegistry getRegistry() {
        return registry;
    }

    public EngineSettings getSettings() {
        return settings;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private boolean admit(SubjectState state, MonitoringRule rule, Alert alert) {
        int cooldownSeconds = rule.getCooldownSeconds() != null
                ? rule.getCooldownSeconds()
                : settings.getDefaultCooldownSeconds();
        if (state.admit(rule.getName(), alert.getTimestamp(), cooldownSeconds * 1_000L)) {
            LOG.debug("Alert fired: rule={} subject={}", alert.getRuleName(), alert.getSubjectId());
            return true;
        }
        LOG.debug("Alert suppressed by {}s cooldown: rule={} subject={}",
                cooldownSeconds, alert.getRuleName(), alert.getSubjectId());
        return false;
    }

    /**
     * Align a state's evaluators with the current rule set. State restored
     * from a checkpoint taken under an older configuration may lack new rules
     * or still carry removed ones.
     */
    private void reconcile(SubjectState state) {
        List<RuleEvaluator> evaluators = state.evaluators();
        Set<String> present = evaluators.stream()
                .map(RuleEvaluator::getRuleName)
                .collect(Collectors.toSet());
        if (present.size() == rules.size() && rules.keySet().containsAll(present)) {
            return;
        }
        evaluators.removeIf(e -> !rules.containsKey(e.getRuleName()));
        for (MonitoringRule rule : rules.values()) {
            if (!present.contains(rule.getName())) {
                evaluators.add(EvaluatorFactory.create(rule, settings));
            }
        }
        LOG.info("Reconciled rule evaluators for subject {}: now {}", state.getSubjectId(), evaluators.size());
    }
}
