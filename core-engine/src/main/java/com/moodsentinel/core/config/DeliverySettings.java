package com.moodsentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Settings for the delivery coordinator.
 *
 * <pre>
 * delivery:
 *   channel: log
 *   batchSize: 100
 *   sinceHours: 24
 *   timeoutMs: 10000
 *   maxAttempts: 5
 * </pre>
 *
 * @since 1.0.0
 */
public class DeliverySettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Name of the delivery channel to use. */
    private String channel = "log";

    /** Maximum number of alerts pulled per pass. */
    private int batchSize = 100;

    /** Only alerts created within this many hours are picked up. */
    private int sinceHours = 24;

    /** Upper bound on a single channel call. */
    private long timeoutMs = 10_000;

    /** Transient failures tolerated before an alert is marked FAILED. */
    private int maxAttempts = 5;

    void validate(List<String> errors) {
        if (channel == null || channel.isBlank()) {
            errors.add("delivery.channel is required");
        }
        if (batchSize < 1) {
            errors.add("delivery.batchSize must be >= 1, got: " + batchSize);
        }
        if (sinceHours < 1) {
            errors.add("delivery.sinceHours must be >= 1, got: " + sinceHours);
        }
        if (timeoutMs < 1) {
            errors.add("delivery.timeoutMs must be >= 1, got: " + timeoutMs);
        }
        if (maxAttempts < 1) {
            errors.add("delivery.maxAttempts must be >= 1, got: " + maxAttempts);
        }
    }

    public Duration timeout() {
        return Duration.ofMillis(timeoutMs);
    }

    public Duration lookback() {
        return Duration.ofHours(sinceHours);
    }

    public String getChannel() {
        return channel;
    }

    public void setChannel(String channel) {
        this.channel = channel;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getSinceHours() {
        return sinceHours;
    }

    public void setSinceHours(int sinceHours) {
        this.sinceHours = sinceHours;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    @Override
    public String toString() {
        return "DeliverySettings{" +
                "channel='" + channel + '\'' +
                ", batchSize=" + batchSize +
                ", sinceHours=" + sinceHours +
                ", timeoutMs=" + timeoutMs +
                ", maxAttempts=" + maxAttempts +
                '}';
    }
}
