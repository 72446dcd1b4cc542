package com.moodsentinel.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Firing thresholds for the multi-signal rules.
 *
 * <pre>
 * rules:
 *   sentimentThreshold: -0.5
 *   engagementThreshold: 0.2
 *   volumeSpikeThreshold: 2.0
 * </pre>
 *
 * @since 1.0.0
 */
public class RuleThresholds implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Average sentiment strictly below this value fires NEGATIVE_SENTIMENT. */
    private double sentimentThreshold = -0.5;

    /** Engagement strictly below this value fires LOW_ENGAGEMENT. */
    private double engagementThreshold = 0.2;

    /** Multiplier over the average post volume that counts as a spike. */
    private double volumeSpikeThreshold = 2.0;

    void validate(List<String> errors) {
        if (!Double.isFinite(sentimentThreshold) || sentimentThreshold < -1.0 || sentimentThreshold > 1.0) {
            errors.add("rules.sentimentThreshold must be in [-1, 1], got: " + sentimentThreshold);
        }
        if (!Double.isFinite(engagementThreshold) || engagementThreshold < 0) {
            errors.add("rules.engagementThreshold must be >= 0, got: " + engagementThreshold);
        }
        if (!Double.isFinite(volumeSpikeThreshold) || volumeSpikeThreshold <= 0) {
            errors.add("rules.volumeSpikeThreshold must be > 0, got: " + volumeSpikeThreshold);
        }
    }

    public double getSentimentThreshold() {
        return sentimentThreshold;
    }

    public void setSentimentThreshold(double sentimentThreshold) {
        this.sentimentThreshold = sentimentThreshold;
    }

    public double getEngagementThreshold() {
        return engagementThreshold;
    }

    public void setEngagementThreshold(double engagementThreshold) {
        this.engagementThreshold = engagementThreshold;
    }

    public double getVolumeSpikeThreshold() {
        return volumeSpikeThreshold;
    }

    public void setVolumeSpikeThreshold(double volumeSpikeThreshold) {
        this.volumeSpikeThreshold = volumeSpikeThreshold;
    }

    @Override
    public String toString() {
        return "RuleThresholds{" +
                "sentimentThreshold=" + sentimentThreshold +
                ", engagementThreshold=" + engagementThreshold +
                ", volumeSpikeThreshold=" + volumeSpikeThreshold +
                '}';
    }
}
