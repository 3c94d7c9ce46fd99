package com.behaviourmonitor.core.rules;

import com.behaviourmonitor.core.model.Alert;
import com.behaviourmonitor.core.model.Event;

import java.io.Serializable;
import java.time.Instant;
import java.util.Optional;

/**
 * Contract for all rule evaluators.
 * <p>
 * Implementations may be <strong>stateful</strong>: each instance is bound
 * to a single subject and accumulates observations across consecutive calls
 * to {@link #evaluate(Event)}.
 * </p>
 * <p>
 * Evaluators must be {@link Serializable} because Flink snapshots them in
 * checkpointed keyed state.
 * </p>
 */
public interface RuleEvaluator extends Serializable {

    /**
     * Evaluate a single event and decide whether the rule fires.
     *
     * @param event the incoming event, already matched against the rule's
     *              filters
     * @return an {@link Alert} if the event triggers the rule, empty otherwise
     */
    Optional<Alert> evaluate(Event event);

    /**
     * Evaluate the passage of time without a new event. Only evaluators that
     * return {@code true} from {@link #isTimeDriven()} do anything here.
     *
     * @param subjectId subject this evaluator belongs to
     * @param now       current time
     * @return an {@link Alert} if the rule fires, empty otherwise
     */
    default Optional<Alert> onTick(String subjectId, Instant now) {
        return Optional.empty();
    }

    /**
     * @return {@code true} if the rule can fire from {@link #onTick}
     */
    default boolean isTimeDriven() {
        return false;
    }

    /**
     * Return the unique name of the rule this evaluator enforces.
     *
     * @return rule name
     */
    String getRuleName();
}
