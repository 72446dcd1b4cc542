package com.moodsentinel.core.stats;

/**
 * HIGH/CRITICAL alert counts in the earlier and later half of a window.
 *
 * <p>
 * {@code magnitude} is the absolute difference between the two counts.
 * </p>
 */
public final class AlertTrend {

    private final TrendDirection direction;
    private final int earlierSevere;
    private final int laterSevere;

    AlertTrend(int earlierSevere, int laterSevere) {
        this.earlierSevere = earlierSevere;
        this.laterSevere = laterSevere;
        if (laterSevere > earlierSevere) {
            this.direction = TrendDirection.WORSENING;
        } else if (laterSevere < earlierSevere) {
            this.direction = TrendDirection.IMPROVING;
        } else {
            this.direction = TrendDirection.STABLE;
        }
    }

    public TrendDirection getDirection() {
        return direction;
    }

    public int getMagnitude() {
        return Math.abs(laterSevere - earlierSevere);
    }

    public int getEarlierSevere() {
        return earlierSevere;
    }

    public int getLaterSevere() {
        return laterSevere;
    }

    @Override
    public String toString() {
        return "AlertTrend{direction=" + direction + ", magnitude=" + getMagnitude()
                + ", earlier=" + earlierSevere + ", later=" + laterSevere + '}';
    }
}
