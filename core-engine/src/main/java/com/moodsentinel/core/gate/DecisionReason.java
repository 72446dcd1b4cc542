package com.moodsentinel.core.gate;

/**
 * Why the gate admitted or suppressed a candidate.
 */
public enum DecisionReason {
    /** CRITICAL severity, admitted without consulting history. */
    CRITICAL_BYPASS,
    /** Passed cooldown and daily cap. */
    ADMITTED,
    /** Same subject, type and severity already alerted within the cooldown. */
    COOLDOWN,
    /** Subject already reached the daily alert limit. */
    DAILY_CAP,
    /** An alert from the same snapshot was already admitted. */
    DUPLICATE
}
