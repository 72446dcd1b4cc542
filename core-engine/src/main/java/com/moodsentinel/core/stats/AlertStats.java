package com.moodsentinel.core.stats;

import com.moodsentinel.core.model.Severity;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate counts over the alerts created since a point in time.
 *
 * <p>
 * {@code deliveryRate} is a percentage in {@code [0, 100]}, 0 when no alerts
 * exist in the window.
 * </p>
 */
public final class AlertStats {

    private final Instant since;
    private final int total;
    private final int delivered;
    private final int pending;
    private final int failed;
    private final Map<Severity, Integer> severityBreakdown;
    private final double deliveryRate;

    AlertStats(Instant since, int total, int delivered, int pending, int failed,
            Map<Severity, Integer> severityBreakdown) {
        this.since = since;
        this.total = total;
        this.delivered = delivered;
        this.pending = pending;
        this.failed = failed;
        EnumMap<Severity, Integer> breakdown = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) {
            breakdown.put(s, severityBreakdown.getOrDefault(s, 0));
        }
        this.severityBreakdown = Collections.unmodifiableMap(breakdown);
        this.deliveryRate = total > 0 ? delivered * 100.0 / total : 0.0;
    }

    public Instant getSince() {
        return since;
    }

    public int getTotal() {
        return total;
    }

    public int getDelivered() {
        return delivered;
    }

    public int getPending() {
        return pending;
    }

    public int getFailed() {
        return failed;
    }

    /**
     * @return count per severity, every severity present
     */
    public Map<Severity, Integer> getSeverityBreakdown() {
        return severityBreakdown;
    }

    public double getDeliveryRate() {
        return deliveryRate;
    }

    @Override
    public String toString() {
        return "AlertStats{" +
                "since=" + since +
                ", total=" + total +
                ", delivered=" + delivered +
                ", pending=" + pending +
                ", failed=" + failed +
                ", severityBreakdown=" + severityBreakdown +
                ", deliveryRate=" + deliveryRate +
                '}';
    }
}
