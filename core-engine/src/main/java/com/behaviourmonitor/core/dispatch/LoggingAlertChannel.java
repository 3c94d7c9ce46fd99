package com.behaviourmonitor.core.dispatch;

import com.behaviourmonitor.core.model.Alert;
import com.behaviourmonitor.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Channel that writes alerts to the application log. {@code HIGH} and
 * {@code CRITICAL} alerts are logged at WARN, the rest at INFO.
 *
 * @since 1.0.0
 */
public class LoggingAlertChannel implements AlertChannel {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingAlertChannel.class);

    private final String name;

    public LoggingAlertChannel(String name) {
        this.name = Objects.requireNonNull(name, "Channel name must not be null");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void deliver(Alert alert) {
        if (alert.getSeverity().compareTo(Severity.HIGH) >= 0) {
            LOG.warn("[{}] {} ALERT rule={} subject={} at {}: {}", name, alert.getSeverity(),
                    alert.getRuleName(), alert.getSubjectId(), alert.getTimestamp(), alert.getDetails());
        } else {
            LOG.info("[{}] {} alert rule={} subject={} at {}: {}", name, alert.getSeverity(),
                    alert.getRuleName(), alert.getSubjectId(), alert.getTimestamp(), alert.getDetails());
        }
    }
}
