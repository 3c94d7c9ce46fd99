package com.behaviourmonitor.flink;

import com.behaviourmonitor.core.config.EngineSettings;
import com.behaviourmonitor.core.engine.SubjectRegistry;
import com.behaviourmonitor.core.model.Alert;
import com.behaviourmonitor.core.model.Severity;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.streaming.api.operators.KeyedProcessOperator;
import org.apache.flink.streaming.util.KeyedOneInputStreamOperatorTestHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AlertDispatchFunction} keyed by alert id.
 */
class AlertDispatchFunctionTest {

    private static final Instant AT = Instant.parse("2024-05-01T10:00:00Z");

    private KeyedOneInputStreamOperatorTestHarness<String, Alert, Alert> harness;

    @BeforeEach
    void setUp() throws Exception {
        AlertDispatchFunction function = new AlertDispatchFunction(
                new SubjectRegistry(), EngineSettings.defaults(), Set.of("security"));
        harness = new KeyedOneInputStreamOperatorTestHarness<>(
                new KeyedProcessOperator<>(function), Alert::getAlertId, Types.STRING);
        harness.open();
    }

    @AfterEach
    void tearDown() throws Exception {
        harness.close();
    }

    @Test
    @DisplayName("Should forward a replayed alert id only once")
    void shouldForwardDuplicatesOnce() throws Exception {
        Alert alert = alert("login-burst", "alice");

        harness.processElement(alert, AT.toEpochMilli());
        harness.processElement(alert, AT.toEpochMilli());

        assertThat(harness.extractOutputValues()).extracting(Alert::getAlertId)
                .containsExactly(alert.getAlertId());
    }

    @Test
    @DisplayName("Should forward distinct alerts, including ones whose names contain colons")
    void shouldForwardDistinctAlerts() throws Exception {
        List<Alert> alerts = List.of(alert("a:b", "c"), alert("a", "b:c"), alert("login-burst", "bob"));

        for (Alert alert : alerts) {
            harness.processElement(alert, AT.toEpochMilli());
        }

        assertThat(harness.extractOutputValues()).hasSize(3);
    }

    @Test
    @DisplayName("Should still forward alerts addressed to a channel the job does not back")
    void shouldForwardUndeliverableAlerts() throws Exception {
        Alert alert = Alert.builder()
                .ruleName("fall")
                .subjectId("p-7")
                .timestamp(AT)
                .severity(Severity.CRITICAL)
                .channels(List.of("pager"))
                .build();

        harness.processElement(alert, AT.toEpochMilli());

        assertThat(harness.extractOutputValues()).extracting(Alert::getRuleName).containsExactly("fall");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Alert alert(String rule, String subject) {
        return Alert.builder()
                .ruleName(rule)
                .subjectId(subject)
                .timestamp(AT)
                .severity(Severity.HIGH)
                .channels(List.of("security"))
                .build();
    }
}
