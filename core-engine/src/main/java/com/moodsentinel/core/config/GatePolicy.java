package com.moodsentinel.core.config;

import java.io.Serializable;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

/**
 * Suppression policy applied by the alert gate.
 *
 * <p>
 * The daily cap resets at local midnight in {@link #getZone()}.
 * </p>
 *
 * @since 1.0.0
 */
public class GatePolicy implements Serializable {

    private static final long serialVersionUID = 1L;

    private int cooldownHours = 2;
    private int maxAlertsPerDay = 5;
    private String zone = "UTC";

    void validate(List<String> errors) {
        if (cooldownHours < 0) {
            errors.add("gate.cooldownHours must be >= 0, got: " + cooldownHours);
        }
        if (maxAlertsPerDay < 1) {
            errors.add("gate.maxAlertsPerDay must be >= 1, got: " + maxAlertsPerDay);
        }
        if (zone == null || zone.isBlank()) {
            errors.add("gate.zone is required");
        } else {
            try {
                ZoneId.of(zone);
            } catch (DateTimeException e) {
                errors.add("gate.zone is not a valid time zone: '" + zone + "'");
            }
        }
    }

    public Duration cooldown() {
        return Duration.ofHours(cooldownHours);
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public int getCooldownHours() {
        return cooldownHours;
    }

    public void setCooldownHours(int cooldownHours) {
        this.cooldownHours = cooldownHours;
    }

    public int getMaxAlertsPerDay() {
        return maxAlertsPerDay;
    }

    public void setMaxAlertsPerDay(int maxAlertsPerDay) {
        this.maxAlertsPerDay = maxAlertsPerDay;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    @Override
    public String toString() {
        return "GatePolicy{" +
                "cooldownHours=" + cooldownHours +
                ", maxAlertsPerDay=" + maxAlertsPerDay +
                ", zone='" + zone + '\'' +
                '}';
    }
}
