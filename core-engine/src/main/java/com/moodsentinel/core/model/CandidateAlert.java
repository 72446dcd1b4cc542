package com.moodsentinel.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Alert proposed by a signal rule, not yet subject to suppression policy.
 *
 * <p>
 * Candidates have no identity. They only become visible outside the
 * pipeline once admitted and persisted as an {@link Alert}.
 * </p>
 *
 * <p>
 * {@code observedAt} is the observation instant of the snapshot the candidate
 * came from. Together with subject and type it identifies the origin of an
 * alert, so re-processing the same snapshot yields the same origin.
 * </p>
 *
 * @since 1.0.0
 */
public final class CandidateAlert {

    private final String subjectId;
    private final Instant observedAt;
    private final AlertType type;
    private final Severity severity;
    private final String summary;
    private final List<String> recommendedActions;

    public CandidateAlert(String subjectId, Instant observedAt, AlertType type, Severity severity,
            String summary, List<String> recommendedActions) {
        this.subjectId = Objects.requireNonNull(subjectId, "subjectId must not be null");
        this.observedAt = Objects.requireNonNull(observedAt, "observedAt must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.summary = Objects.requireNonNull(summary, "summary must not be null");
        this.recommendedActions = recommendedActions != null ? List.copyOf(recommendedActions) : List.of();
    }

    public String getSubjectId() {
        return subjectId;
    }

    public Instant getObservedAt() {
        return observedAt;
    }

    public AlertType getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getSummary() {
        return summary;
    }

    public List<String> getRecommendedActions() {
        return recommendedActions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CandidateAlert that))
            return false;
        return subjectId.equals(that.subjectId)
                && observedAt.equals(that.observedAt)
                && type == that.type
                && severity == that.severity
                && summary.equals(that.summary);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subjectId, observedAt, type, severity, summary);
    }

    @Override
    public String toString() {
        return "CandidateAlert{" +
                "subjectId='" + subjectId + '\'' +
                ", observedAt=" + observedAt +
                ", type=" + type +
                ", severity=" + severity +
                ", summary='" + summary + '\'' +
                '}';
    }
}
