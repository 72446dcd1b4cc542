package com.moodsentinel.core.gate;

import com.moodsentinel.core.model.Alert;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Recent persisted alerts for one subject, as seen at one instant.
 *
 * <p>
 * Derived from the alert store, never stored separately. It must cover at
 * least everything created since {@link AlertGate#historyStart(Instant)} for
 * the gate to decide correctly.
 * </p>
 */
public final class AlertHistory {

    private final String subjectId;
    private final Instant asOf;
    private final List<Alert> alerts;

    public AlertHistory(String subjectId, Instant asOf, List<Alert> alerts) {
        this.subjectId = Objects.requireNonNull(subjectId, "subjectId must not be null");
        this.asOf = Objects.requireNonNull(asOf, "asOf must not be null");
        this.alerts = List.copyOf(alerts);
    }

    /**
     * @param subjectId subject the history belongs to
     * @param asOf      evaluation instant
     * @return a history with no alerts
     */
    public static AlertHistory empty(String subjectId, Instant asOf) {
        return new AlertHistory(subjectId, asOf, List.of());
    }

    public String getSubjectId() {
        return subjectId;
    }

    /**
     * @return the instant the gate treats as "now"
     */
    public Instant getAsOf() {
        return asOf;
    }

    public List<Alert> getAlerts() {
        return alerts;
    }
}
