package com.behaviourmonitor.flink;

import com.behaviourmonitor.core.config.EngineSettings;
import com.behaviourmonitor.core.dispatch.AlertChannel;
import com.behaviourmonitor.core.dispatch.AlertDispatcher;
import com.behaviourmonitor.core.dispatch.DispatchResult;
import com.behaviourmonitor.core.dispatch.LoggingAlertChannel;
import com.behaviourmonitor.core.engine.SubjectRegistry;
import com.behaviourmonitor.core.model.Alert;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Dispatches alerts through an {@link AlertDispatcher} and forwards every
 * alert that is not a duplicate to the alerts sink.
 *
 * <p>
 * The stream is keyed by alert id, so all copies of one alert reach the same
 * parallel instance and its dispatcher's dedup ledger. Inside the job every
 * named channel is a {@link LoggingAlertChannel}; actual notification
 * services consume the alerts topic.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertDispatchFunction extends KeyedProcessFunction<String, Alert, Alert> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AlertDispatchFunction.class);

    private final SubjectRegistry registry;
    private final EngineSettings settings;
    private final List<String> channelNames;

    private transient AlertDispatcher dispatcher;
    private transient MonitorMetrics metrics;

    /**
     * @param registry     subject registry for subject channel lookups
     * @param settings     engine settings (default channel, ledger size)
     * @param channelNames every channel name referenced by rules and subjects
     */
    public AlertDispatchFunction(SubjectRegistry registry, EngineSettings settings, Set<String> channelNames) {
        this.registry = Objects.requireNonNull(registry, "SubjectRegistry must not be null");
        this.settings = Objects.requireNonNull(settings, "EngineSettings must not be null");
        Set<String> names = new LinkedHashSet<>(Objects.requireNonNull(channelNames, "channelNames must not be null"));
        names.add(settings.getDefaultChannel());
        this.channelNames = new ArrayList<>(names);
    }

    @Override
    public void open(Configuration parameters) {
        List<AlertChannel> channels = new ArrayList<>();
        for (String name : channelNames) {
            channels.add(new LoggingAlertChannel(name));
        }
        dispatcher = new AlertDispatcher(channels, registry, settings);
        metrics = new MonitorMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("AlertDispatchFunction opened with channel(s) {}", channelNames);
    }

    @Override
    public void processElement(Alert alert,
            KeyedProcessFunction<String, Alert, Alert>.Context ctx,
            Collector<Alert> out) {
        DispatchResult result = dispatcher.dispatch(alert);
        if (result.isDuplicate()) {
            metrics.incrementAlertsDuplicate();
            return;
        }
        if (!result.getFailed().isEmpty()) {
            LOG.warn("Alert {} could not be delivered to {}", alert.getAlertId(), result.getFailed());
        }
        metrics.incrementAlertsDispatched();
        out.collect(alert);
    }
}
