package com.behaviourmonitor.core.rules;

import com.behaviourmonitor.core.model.Alert;
import com.behaviourmonitor.core.model.Event;
import com.behaviourmonitor.core.model.MonitoringRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ConsecutiveRuleEvaluator}.
 */
class ConsecutiveRuleEvaluatorTest {

    private ConsecutiveRuleEvaluator evaluator;

    @BeforeEach
    void setUp() {
        MonitoringRule rule = new MonitoringRule();
        rule.setName("fall-detected");
        rule.setType("consecutive");
        rule.setField("fallScore");
        rule.setOperator(">");
        rule.setThreshold(0.8);
        rule.setConsecutive(3);
        evaluator = new ConsecutiveRuleEvaluator(rule);
    }

    @Test
    @DisplayName("Should fire only after the required number of hits in a row")
    void shouldFireAfterStreak() {
        assertThat(evaluator.evaluate(pose(0.9))).isEmpty();
        assertThat(evaluator.evaluate(pose(0.95))).isEmpty();
        Optional<Alert> alert = evaluator.evaluate(pose(0.85));

        assertThat(alert).isPresent();
        assertThat(alert.get().getDetails()).contains("for 3 consecutive events");
    }

    @Test
    @DisplayName("A miss should reset the streak")
    void missResetsStreak() {
        evaluator.evaluate(pose(0.9));
        evaluator.evaluate(pose(0.9));
        evaluator.evaluate(pose(0.1));

        assertThat(evaluator.getStreak()).isZero();
        assertThat(evaluator.evaluate(pose(0.9))).isEmpty();
    }

    @Test
    @DisplayName("Firing should reset the streak")
    void firingResetsStreak() {
        for (int i = 0; i < 3; i++) {
            evaluator.evaluate(pose(0.9));
        }

        assertThat(evaluator.getStreak()).isZero();
        assertThat(evaluator.evaluate(pose(0.9))).isEmpty();
    }

    @Test
    @DisplayName("Events without the field should leave the streak untouched")
    void missingFieldKeepsStreak() {
        evaluator.evaluate(pose(0.9));
        evaluator.evaluate(Event.builder().subjectId("p").eventType("pose").timestamp(Instant.now()).build());

        assertThat(evaluator.getStreak()).isEqualTo(1);
    }

    private static Event pose(double fallScore) {
        return Event.builder()
                .subjectId("p")
                .eventType("pose")
                .timestamp(Instant.now())
                .attribute("fallScore", fallScore)
                .build();
    }
}
