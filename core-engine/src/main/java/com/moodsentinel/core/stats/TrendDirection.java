package com.moodsentinel.core.stats;

/**
 * Direction of severe-alert volume between two halves of a window.
 */
public enum TrendDirection {
    IMPROVING,
    WORSENING,
    STABLE
}
