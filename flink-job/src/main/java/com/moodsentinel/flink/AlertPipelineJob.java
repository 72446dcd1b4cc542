package com.moodsentinel.flink;

import com.moodsentinel.core.config.AlertingConfig;
import com.moodsentinel.core.config.AlertingConfigLoader;
import com.moodsentinel.core.model.Alert;
import com.moodsentinel.core.model.FeatureSnapshot;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.typeinfo.Types;
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
import java.util.Objects;

/**
 * Entry point of the streaming alert pipeline.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (feature-snapshots)
 *     -> JSON -> FeatureSnapshot
 *     -> keyBy(subjectId)
 *     -> AlertAdmissionFunction (evaluate, gate, persist)
 *     -> Alert -> JSON
 *     -> Kafka (alerts)
 * </pre>
 *
 * <p>
 * Delivery of persisted alerts is not part of this job; it runs on a
 * schedule through {@code SentinelCommand deliver}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertPipelineJob {

    private static final Logger LOG = LoggerFactory.getLogger(AlertPipelineJob.class);

    private AlertPipelineJob() {
        // entry-point class
    }

    public static void main(String[] args) throws Exception {
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting Mood Sentinel alert pipeline with config: {}", config);

        AlertingConfig alerting = loadAlertingConfig(config);

        HealthServer healthServer = new HealthServer();
        healthServer.start(config.getHealthPort());
        Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setParallelism(config.getParallelism());
        configureCheckpointing(env, config);

        buildPipeline(env, config, alerting);
        healthServer.markReady();

        env.execute("Mood Sentinel - Alert Pipeline");
    }

    static void buildPipeline(StreamExecutionEnvironment env, JobConfig config, AlertingConfig alerting) {
        KafkaSource<FeatureSnapshot> source = KafkaSource.<FeatureSnapshot>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setTopics(config.getSnapshotTopic())
                .setGroupId(config.getKafkaGroupId())
                .setStartingOffsets(OffsetsInitializer.earliest())
                .setValueOnlyDeserializer(new FeatureSnapshotDeserializationSchema())
                .build();

        DataStream<FeatureSnapshot> snapshots = env.fromSource(
                source,
                WatermarkStrategy.<FeatureSnapshot>forBoundedOutOfOrderness(Duration.ofSeconds(5))
                        .withTimestampAssigner((s, ts) -> s.getObservedAt().toEpochMilli())
                        .withIdleness(Duration.ofMinutes(1)),
                "kafka-snapshot-source");

        DataStream<Alert> alerts = snapshots
                .filter(Objects::nonNull)
                .name("drop-unreadable")
                .keyBy(FeatureSnapshot::getSubjectId, Types.STRING)
                .process(new AlertAdmissionFunction(alerting))
                .name("alert-admission");

        KafkaSink<Alert> sink = KafkaSink.<Alert>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setRecordSerializer(
                        KafkaRecordSerializationSchema.builder()
                                .setTopic(config.getAlertTopic())
                                .setValueSerializationSchema(new AlertSerializationSchema())
                                .build())
                .build();

        alerts.sinkTo(sink).name("kafka-alert-sink");
    }

    private static AlertingConfig loadAlertingConfig(JobConfig config) {
        String path = config.getAlertingConfigPath();
        if (!path.isBlank()) {
            return AlertingConfigLoader.fromFile(path);
        }
        return AlertingConfigLoader.load();
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
