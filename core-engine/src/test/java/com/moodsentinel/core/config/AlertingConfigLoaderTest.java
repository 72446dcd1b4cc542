package com.moodsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertingConfigLoader}.
 */
class AlertingConfigLoaderTest {

    @Test
    @DisplayName("Should load test config from classpath, keeping defaults for omitted keys")
    void shouldLoadFromClasspath() {
        AlertingConfig config = AlertingConfigLoader.fromClasspath("test-alerting.yml");

        assertThat(config.getRules().getSentimentThreshold()).isEqualTo(-0.4);
        assertThat(config.getRules().getEngagementThreshold()).isEqualTo(0.3);
        assertThat(config.getRules().getVolumeSpikeThreshold()).isEqualTo(2.0);
        assertThat(config.getGate().cooldown()).isEqualTo(Duration.ofHours(4));
        assertThat(config.getGate().getMaxAlertsPerDay()).isEqualTo(3);
        assertThat(config.getGate().zoneId()).isEqualTo(ZoneId.of("Europe/Berlin"));
        assertThat(config.getDelivery().getMaxAttempts()).isEqualTo(2);
        assertThat(config.getDelivery().getTimeoutMs()).isEqualTo(10_000);
        assertThat(config.getSource().getType()).isEqualTo("jsonl");
    }

    @Test
    @DisplayName("Default classpath config is valid")
    void shouldLoadBundledDefaults() {
        AlertingConfig config = AlertingConfigLoader.fromClasspath(AlertingConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getGate().getCooldownHours()).isEqualTo(2);
        assertThat(config.getGate().getMaxAlertsPerDay()).isEqualTo(5);
        assertThat(config.getDelivery().getChannel()).isEqualTo("log");
    }

    @Test
    @DisplayName("Should report every invalid value at once")
    void shouldCollectAllValidationErrors() {
        assertThatThrownBy(() -> AlertingConfigLoader.fromClasspath("invalid-alerting.yml"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("gate.cooldownHours")
                .hasMessageContaining("gate.maxAlertsPerDay")
                .hasMessageContaining("gate.zone")
                .hasMessageContaining("delivery.batchSize")
                .hasMessageContaining("delivery.maxAttempts");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> AlertingConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> AlertingConfigLoader.fromFile(dir.resolve("nope.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Empty file falls back to defaults")
    void shouldUseDefaultsForEmptyFile(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("empty.yml"), "");

        AlertingConfig config = AlertingConfigLoader.fromFile(file.toString());

        assertThat(config.getRules().getSentimentThreshold()).isEqualTo(-0.5);
        assertThat(config.getStore().getJdbcUrl()).startsWith("jdbc:h2:mem:");
    }

    @Test
    @DisplayName("Unknown keys are rejected as malformed")
    void shouldRejectUnknownKeys(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("bad.yml"), "gate:\n  coolDown: 3\n");

        assertThatThrownBy(() -> AlertingConfigLoader.fromFile(file.toString()))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Malformed");
    }
}
