package com.moodsentinel.flink;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed, immutable configuration for the alert pipeline Flink job.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the job
 * is configured entirely through the deployment environment. Alerting
 * behavior (thresholds, gate, store) lives in the alerting YAML referenced by
 * {@link #getAlertingConfigPath()}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} in production, or the {@link Builder} in
 * tests. The builder validates at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String snapshotTopic;
    private final String alertTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // Alerting / health
    // ---------------------------------------------------------------
    private final String alertingConfigPath;
    private final int healthPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.snapshotTopic = b.snapshotTopic;
        this.alertTopic = b.alertTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.alertingConfigPath = b.alertingConfigPath;
        this.healthPort = b.healthPort;
    }

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .snapshotTopic(env("KAFKA_SNAPSHOT_TOPIC", "feature-snapshots"))
                    .alertTopic(env("KAFKA_ALERT_TOPIC", "alerts"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "mood-sentinel"))
                    .parallelism(parseIntEnv("FLINK_PARALLELISM", "1"))
                    .checkpointIntervalMs(parseLongEnv("FLINK_CHECKPOINT_INTERVAL_MS", "60000"))
                    .alertingConfigPath(env("ALERTING_CONFIG_PATH", ""))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getSnapshotTopic() {
        return snapshotTopic;
    }

    public String getAlertTopic() {
        return alertTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    /**
     * @return YAML path, or blank to use the classpath default
     */
    public String getAlertingConfigPath() {
        return alertingConfigPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    /**
     * Fluent builder for {@link JobConfig}.
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String snapshotTopic = "feature-snapshots";
        private String alertTopic = "alerts";
        private String kafkaGroupId = "mood-sentinel";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String alertingConfigPath = "";
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder snapshotTopic(String v) {
            this.snapshotTopic = v;
            return this;
        }

        public Builder alertTopic(String v) {
            this.alertTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder alertingConfigPath(String v) {
            this.alertingConfigPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(snapshotTopic, "snapshotTopic");
            requireNonBlank(alertTopic, "alertTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            if (snapshotTopic.equals(alertTopic)) {
                throw new IllegalArgumentException("snapshotTopic and alertTopic must differ: " + alertTopic);
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (alertingConfigPath == null) {
                alertingConfigPath = "";
            }
            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", snapshotTopic='" + snapshotTopic + '\'' +
                ", alertTopic='" + alertTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", alertingConfigPath='" + alertingConfigPath + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
