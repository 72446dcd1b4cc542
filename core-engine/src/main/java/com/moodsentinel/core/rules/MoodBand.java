package com.moodsentinel.core.rules;

/**
 * Classification band for a single mood score.
 */
public enum MoodBand {
    CRITICAL,
    WARNING,
    NEUTRAL,
    POSITIVE;

    /**
     * @return {@code true} when the band calls for follow-up
     */
    public boolean isActionRequired() {
        return this == CRITICAL || this == WARNING;
    }
}
