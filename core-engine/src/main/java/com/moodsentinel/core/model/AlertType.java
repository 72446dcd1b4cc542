package com.moodsentinel.core.model;

/**
 * Kind of anomaly an alert reports. One value per signal rule.
 *
 * @since 1.0.0
 */
public enum AlertType {
    NEGATIVE_SENTIMENT,
    LOW_ENGAGEMENT,
    ACTIVITY_SPIKE,
    CRISIS_KEYWORDS
}
