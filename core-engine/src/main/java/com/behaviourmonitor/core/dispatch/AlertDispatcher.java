package com.behaviourmonitor.core.dispatch;

import com.behaviourmonitor.core.config.EngineSettings;
import com.behaviourmonitor.core.engine.SubjectRegistry;
import com.behaviourmonitor.core.model.Alert;
import com.behaviourmonitor.core.model.Subject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Deduplicates alerts and routes them to {@link AlertChannel}s.
 *
 * <h3>Deduplication</h3>
 * <p>
 * Every alert id is recorded in a bounded, least-recently-used ledger before
 * delivery. An alert whose id is still in the ledger is dropped, so each alert
 * is consumed exactly once while it is remembered. The ledger keeps the last
 * {@link EngineSettings#getDedupCapacity()} ids.
 * </p>
 *
 * <h3>Routing</h3>
 * <p>
 * Recipients are the alert's own channels followed by the subject's
 * registered channels, without repeats. When neither names a channel the
 * {@link EngineSettings#getDefaultChannel() default channel} is used. A
 * failing or unknown channel is reported in the {@link DispatchResult} and
 * does not prevent delivery to the others.
 * </p>
 *
 * <p>
 * This class is thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(AlertDispatcher.class);

    private final Map<String, AlertChannel> channels = new LinkedHashMap<>();
    private final SubjectRegistry registry;
    private final String defaultChannel;
    private final Map<String, Boolean> ledger;

    /**
     * @param channels available channels, addressed by {@link AlertChannel#name()}
     * @param registry subject registry used to look up subject channels
     * @param settings engine settings (default channel, ledger capacity)
     * @throws IllegalArgumentException if two channels share a name
     */
    public AlertDispatcher(Collection<? extends AlertChannel> channels,
            SubjectRegistry registry, EngineSettings settings) {
        Objects.requireNonNull(channels, "Channels must not be null");
        this.registry = Objects.requireNonNull(registry, "SubjectRegistry must not be null");
        Objects.requireNonNull(settings, "EngineSettings must not be null");

        for (AlertChannel channel : channels) {
            if (this.channels.putIfAbsent(channel.name(), channel) != null) {
                throw new IllegalArgumentException("Duplicate alert channel name: " + channel.name());
            }
        }
        this.defaultChannel = settings.getDefaultChannel();
        int capacity = settings.getDedupCapacity();
        this.ledger = new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > capacity;
            }
        };
        LOG.info("Alert dispatcher ready with channel(s) {} (default '{}')", this.channels.keySet(), defaultChannel);
    }

    /**
     * Dispatch one alert.
     *
     * @param alert the alert; must not be {@code null}
     * @return what happened to the alert
     */
    public DispatchResult dispatch(Alert alert) {
        Objects.requireNonNull(alert, "Alert must not be null");

        synchronized (ledger) {
            if (ledger.get(alert.getAlertId()) != null) {
                LOG.debug("Dropping duplicate alert {}", alert.getAlertId());
                return DispatchResult.duplicateOf(alert.getAlertId());
            }
            ledger.put(alert.getAlertId(), Boolean.TRUE);
        }

        List<String> delivered = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (String name : recipients(alert)) {
            AlertChannel channel = channels.get(name);
            if (channel == null) {
                LOG.warn("Alert {} addressed to unknown channel '{}'", alert.getAlertId(), name);
                failed.add(name);
                continue;
            }
            try {
                channel.deliver(alert);
                delivered.add(name);
            } catch (RuntimeException e) {
                LOG.error("Channel '{}' failed to deliver alert {} - continuing with next channel",
                        name, alert.getAlertId(), e);
                failed.add(name);
            }
        }
        return new DispatchResult(alert.getAlertId(), false, delivered, failed);
    }

    /**
     * @param alertId alert id
     * @return {@code true} if the id is still remembered as dispatched
     */
    public boolean wasDispatched(String alertId) {
        synchronized (ledger) {
            return ledger.containsKey(alertId);
        }
    }

    Set<String> recipients(Alert alert) {
        Set<String> names = new LinkedHashSet<>(alert.getChannels());
        registry.find(alert.getSubjectId())
                .map(Subject::getChannels)
                .ifPresent(names::addAll);
        if (names.isEmpty()) {
            names.add(defaultChannel);
        }
        return names;
    }
}
