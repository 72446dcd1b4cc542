package com.moodsentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Builder defaults describe a local single-slot job")
    void shouldApplyDefaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getSnapshotTopic()).isEqualTo("feature-snapshots");
        assertThat(config.getAlertTopic()).isEqualTo("alerts");
        assertThat(config.getKafkaGroupId()).isEqualTo("mood-sentinel");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getAlertingConfigPath()).isEmpty();
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldValidateRanges() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> new JobConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
        assertThatThrownBy(() -> new JobConfig.Builder().checkpointIntervalMs(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject blank or identical topics")
    void shouldValidateTopics() {
        assertThatThrownBy(() -> new JobConfig.Builder().snapshotTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("snapshotTopic");
        assertThatThrownBy(() -> new JobConfig.Builder().snapshotTopic("alerts").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must differ");
    }

    @Test
    @DisplayName("fromEnvironment yields a valid configuration")
    void shouldBuildFromEnvironment() {
        assertThat(JobConfig.fromEnvironment()).isNotNull();
    }
}
