package com.behaviourmonitor.core.engine;

import com.behaviourmonitor.core.rules.RuleEvaluator;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything the engine remembers about one subject: its rule evaluators,
 * the last firing time per rule (for cooldowns) and when it was last seen.
 *
 * <h3>State</h3>
 * <p>
 * Not thread-safe. In the Flink job one instance lives in keyed state per
 * subject; in {@link MonitoringEngine} access is synchronized on the
 * instance.
 * </p>
 *
 * @since 1.0.0
 */
public class SubjectState implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String subjectId;
    private final List<RuleEvaluator> evaluators;

    /** Rule name to epoch millis of the last admitted alert. */
    private final Map<String, Long> lastFired = new HashMap<>();

    private Instant lastSeen;

    SubjectState(String subjectId, List<RuleEvaluator> evaluators) {
        this.subjectId = Objects.requireNonNull(subjectId, "subjectId must not be null");
        this.evaluators = new ArrayList<>(evaluators);
    }

    public String getSubjectId() {
        return subjectId;
    }

    /**
     * @return time of the newest event seen, or {@code null} if none yet
     */
    public Instant getLastSeen() {
        return lastSeen;
    }

    List<RuleEvaluator> evaluators() {
        return evaluators;
    }

    void touch(Instant timestamp) {
        if (lastSeen == null || timestamp.isAfter(lastSeen)) {
            lastSeen = timestamp;
        }
    }

    /**
     * Admit an alert unless the rule fired for this subject less than
     * {@code cooldownMillis} before {@code timestamp}.
     *
     * @return {@code true} if admitted (and recorded)
     */
    boolean admit(String ruleName, Instant timestamp, long cooldownMillis) {
        long ts = timestamp.toEpochMilli();
        Long previous = lastFired.get(ruleName);
        if (previous != null && ts - previous < cooldownMillis) {
            return false;
        }
        lastFired.put(ruleName, ts);
        return true;
    }

    @Override
    public String toString() {
        return "SubjectState{" +
                "subjectId='" + subjectId + '\'' +
                ", evaluators=" + evaluators.size() +
                ", lastSeen=" + lastSeen +
                '}';
    }
}
