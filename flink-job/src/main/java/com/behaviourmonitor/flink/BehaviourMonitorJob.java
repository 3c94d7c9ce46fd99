package com.behaviourmonitor.flink;

import com.behaviourmonitor.core.config.EngineSettings;
import com.behaviourmonitor.core.config.MonitoringConfig;
import com.behaviourmonitor.core.config.MonitoringConfigLoader;
import com.behaviourmonitor.core.engine.RuleEngine;
import com.behaviourmonitor.core.engine.SubjectRegistry;
import com.behaviourmonitor.core.model.Alert;
import com.behaviourmonitor.core.model.Event;
import com.behaviourmonitor.core.model.MonitoringRule;
import com.behaviourmonitor.core.model.Subject;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Main entry point for the Behaviour Monitor Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (events topic)
 *     -> Deserialize JSON, intake validation -> Event
 *     -> Key by subject id
 *     -> SubjectEvaluationFunction (rules, windows, cooldown, ticks)
 *     -> Key by alert id
 *     -> AlertDispatchFunction (dedup, channel routing)
 *     -> Serialize Alert -> JSON
 *     -> Kafka (alerts topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job settings come from environment variables via {@link JobConfig}; rules
 * and subjects from the YAML file resolved by {@link MonitoringConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class BehaviourMonitorJob {

    private static final Logger LOG = LoggerFactory.getLogger(BehaviourMonitorJob.class);

    private BehaviourMonitorJob() {
    }

    public static void main(String[] args) throws Exception {
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting Behaviour Monitor with config: {}", config);

        MonitoringConfig monitoringConfig = loadConfig(config);
        if (monitoringConfig.getRules().isEmpty()) {
            throw new IllegalStateException(
                    "No monitoring rules defined. Provide rules via "
                            + MonitoringConfigLoader.ENV_RULES_PATH
                            + " or a classpath " + MonitoringConfigLoader.DEFAULT_RESOURCE + " file.");
        }

        EngineSettings settings = config.toEngineSettings();
        SubjectRegistry registry = new SubjectRegistry(monitoringConfig.getSubjects());
        RuleEngine engine = new RuleEngine(monitoringConfig.getRules(), registry, settings);
        LOG.info("Loaded {} rule(s) and {} subject(s)", engine.getRules().size(), registry.size());

        StatusServer statusServer = new StatusServer(engine);
        statusServer.start(config.getAppPort());
        Runtime.getRuntime().addShutdownHook(new Thread(statusServer::stop, "status-shutdown"));

        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setParallelism(config.getParallelism());
        configureCheckpointing(env, config);

        buildPipeline(env, config, engine, channelNames(monitoringConfig));

        env.execute("Behaviour Monitor");
    }

    // ---------------------------------------------------------------
    // Pipeline assembly
    // ---------------------------------------------------------------

    static void buildPipeline(StreamExecutionEnvironment env,
            JobConfig config,
            RuleEngine engine,
            Set<String> channelNames) {
        KafkaSource<Event> kafkaSource = KafkaSource.<Event>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setTopics(config.getKafkaInputTopic())
                .setGroupId(config.getKafkaGroupId())
                .setStartingOffsets(OffsetsInitializer.earliest())
                .setValueOnlyDeserializer(new EventDeserializationSchema(engine.getSettings()))
                .build();

        DataStream<Event> events = env.fromSource(
                kafkaSource,
                WatermarkStrategy.<Event>forBoundedOutOfOrderness(Duration.ofSeconds(5))
                        .withIdleness(Duration.ofMinutes(1)),
                "kafka-events-source");

        DataStream<Alert> fired = events
                .filter(Objects::nonNull)
                .keyBy(Event::getSubjectId)
                .process(new SubjectEvaluationFunction(
                        engine, config.getMonitoringIntervalSeconds(), config.getRetentionDays()))
                .name("rule-evaluation");

        DataStream<Alert> dispatched = fired
                .keyBy(Alert::getAlertId)
                .process(new AlertDispatchFunction(engine.getRegistry(), engine.getSettings(), channelNames))
                .name("alert-dispatch");

        KafkaSink<Alert> kafkaSink = KafkaSink.<Alert>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setRecordSerializer(
                        KafkaRecordSerializationSchema.builder()
                                .setTopic(config.getKafkaAlertTopic())
                                .setValueSerializationSchema(new AlertSerializationSchema())
                                .build())
                .build();

        dispatched.sinkTo(kafkaSink).name("kafka-alerts-sink");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static Set<String> channelNames(MonitoringConfig monitoringConfig) {
        Set<String> names = new LinkedHashSet<>();
        for (MonitoringRule rule : monitoringConfig.getRules()) {
            names.addAll(rule.getChannels());
        }
        for (Subject subject : monitoringConfig.getSubjects()) {
            names.addAll(subject.getChannels());
        }
        return names;
    }

    private static MonitoringConfig loadConfig(JobConfig config) {
        String path = config.getRulesConfigPath();
        if (path != null && !path.isBlank()) {
            return MonitoringConfigLoader.fromFile(path);
        }
        return MonitoringConfigLoader.load();
    }

    private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
        long interval = config.getCheckpointIntervalMs();
        env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

        CheckpointConfig cpConfig = env.getCheckpointConfig();
        cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
        cpConfig.setCheckpointTimeout(interval * 2);
        cpConfig.setMaxConcurrentCheckpoints(1);
        cpConfig.setExternalizedCheckpointCleanup(
                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
    }
}
