package com.moodsentinel.core.rules;

/**
 * Direction of a mood-score series, with the averages it was derived from.
 */
public final class MoodTrend {

    /** Trend classification. */
    public enum Direction {
        IMPROVING,
        DECLINING,
        STABLE,
        INSUFFICIENT_DATA
    }

    private final Direction direction;
    private final double recentAverage;
    private final double difference;
    private final String message;

    MoodTrend(Direction direction, double recentAverage, double difference, String message) {
        this.direction = direction;
        this.recentAverage = recentAverage;
        this.difference = difference;
        this.message = message;
    }

    public Direction getDirection() {
        return direction;
    }

    /**
     * @return mean of the most recent scores, {@code NaN} without data
     */
    public double getRecentAverage() {
        return recentAverage;
    }

    /**
     * @return recent minus earlier average, 0 when no earlier window exists
     */
    public double getDifference() {
        return difference;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "MoodTrend{direction=" + direction + ", recentAverage=" + recentAverage
                + ", difference=" + difference + '}';
    }
}
