package com.moodsentinel.core.model;

/**
 * Alert severity, ordered from least to most urgent.
 *
 * <p>
 * The {@link #rank()} is used wherever alerts are ordered by urgency
 * (e.g. undelivered alerts are handed to channels CRITICAL first).
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    /**
     * @return numeric rank, higher is more urgent
     */
    public int rank() {
        return rank;
    }

    /**
     * @return {@code true} for HIGH and CRITICAL
     */
    public boolean isSevere() {
        return this == HIGH || this == CRITICAL;
    }
}
