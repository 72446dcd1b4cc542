package com.moodsentinel.core.rules;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Result of classifying one mood score.
 */
public final class MoodEvaluation {

    private final String subjectId;
    private final double score;
    private final Instant timestamp;
    private final MoodBand band;
    private final String message;
    private final List<String> recommendations;

    public MoodEvaluation(String subjectId, double score, Instant timestamp, MoodBand band,
            String message, List<String> recommendations) {
        this.subjectId = Objects.requireNonNull(subjectId, "subjectId must not be null");
        this.score = score;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.band = Objects.requireNonNull(band, "band must not be null");
        this.message = message;
        this.recommendations = List.copyOf(recommendations);
    }

    public String getSubjectId() {
        return subjectId;
    }

    public double getScore() {
        return score;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public MoodBand getBand() {
        return band;
    }

    public boolean isActionRequired() {
        return band.isActionRequired();
    }

    public String getMessage() {
        return message;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    @Override
    public String toString() {
        return "MoodEvaluation{" +
                "subjectId='" + subjectId + '\'' +
                ", score=" + score +
                ", band=" + band +
                ", message='" + message + '\'' +
                '}';
    }
}
