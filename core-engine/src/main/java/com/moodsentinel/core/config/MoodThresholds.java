package com.moodsentinel.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Band boundaries for single mood-score classification.
 *
 * <p>
 * Scores lie in {@code [0, 1]}; the thresholds must satisfy
 * {@code critical < warning < recovery}.
 * </p>
 */
public class MoodThresholds implements Serializable {

    private static final long serialVersionUID = 1L;

    private double criticalThreshold = 0.2;
    private double warningThreshold = 0.4;
    private double recoveryThreshold = 0.6;

    void validate(List<String> errors) {
        if (criticalThreshold < 0 || recoveryThreshold > 1) {
            errors.add("mood thresholds must lie in [0, 1]");
        }
        if (!(criticalThreshold < warningThreshold && warningThreshold < recoveryThreshold)) {
            errors.add("mood thresholds must satisfy critical < warning < recovery, got: "
                    + criticalThreshold + ", " + warningThreshold + ", " + recoveryThreshold);
        }
    }

    public double getCriticalThreshold() {
        return criticalThreshold;
    }

    public void setCriticalThreshold(double criticalThreshold) {
        this.criticalThreshold = criticalThreshold;
    }

    public double getWarningThreshold() {
        return warningThreshold;
    }

    public void setWarningThreshold(double warningThreshold) {
        this.warningThreshold = warningThreshold;
    }

    public double getRecoveryThreshold() {
        return recoveryThreshold;
    }

    public void setRecoveryThreshold(double recoveryThreshold) {
        this.recoveryThreshold = recoveryThreshold;
    }

    @Override
    public String toString() {
        return "MoodThresholds{" +
                "criticalThreshold=" + criticalThreshold +
                ", warningThreshold=" + warningThreshold +
                ", recoveryThreshold=" + recoveryThreshold +
                '}';
    }
}
