package com.behaviourmonitor.flink;

import com.behaviourmonitor.core.config.EngineSettings;
import com.behaviourmonitor.core.engine.RuleEngine;
import com.behaviourmonitor.core.engine.SubjectRegistry;
import com.behaviourmonitor.core.model.MonitoringRule;
import com.behaviourmonitor.core.model.Subject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StatusServer}.
 */
class StatusServerTest {

    @Test
    @DisplayName("Status should list active rules and registered subjects")
    void statusBody() {
        MonitoringRule rule = new MonitoringRule();
        rule.setName("idle");
        rule.setType("inactivity");
        rule.setWindowSeconds(60);
        SubjectRegistry registry = new SubjectRegistry(List.of(new Subject("p1", "person", null, null)));
        StatusServer server = new StatusServer(new RuleEngine(List.of(rule), registry, EngineSettings.defaults()));

        Map<String, Object> status = server.status();

        assertThat(status)
                .containsEntry("status", "UP")
                .containsEntry("rules", 1)
                .containsEntry("ruleNames", List.of("idle"))
                .containsEntry("subjects", 1);
        assertThat(server.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should reject ports outside the valid range")
    void shouldRejectInvalidPort() {
        StatusServer server = new StatusServer(
                new RuleEngine(List.of(), new SubjectRegistry(), EngineSettings.defaults()));

        assertThatThrownBy(() -> server.start(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Status port");
    }
}
