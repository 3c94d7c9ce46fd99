package com.behaviourmonitor.flink;

import com.behaviourmonitor.core.config.MonitoringConfig;
import com.behaviourmonitor.core.config.MonitoringConfigLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link BehaviourMonitorJob} helpers.
 */
class BehaviourMonitorJobTest {

    @Test
    @DisplayName("Bundled rules.yml should load and validate")
    void bundledRulesLoad() {
        MonitoringConfig config = MonitoringConfigLoader.fromClasspath("rules.yml");

        assertThat(config.getRules()).hasSize(7);
        assertThat(config.getSubjects()).hasSize(1);
    }

    @Test
    @DisplayName("Should collect channel names from rules and subjects")
    void collectsChannelNames() {
        MonitoringConfig config = MonitoringConfigLoader.fromClasspath("rules.yml");

        assertThat(BehaviourMonitorJob.channelNames(config)).containsExactly("security", "nursing");
    }
}
