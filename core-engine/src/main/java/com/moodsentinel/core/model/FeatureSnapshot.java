package com.moodsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Scored signal snapshot for one subject at one point in time.
 *
 * <p>
 * Produced by an upstream feature source and consumed read-only by the
 * alerting pipeline. Instances are immutable; the keyword list is copied on
 * construction.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code subjectId} and {@code observedAt} are
 * required. Jackson binds snake_case JSON through the same builder.
 * </p>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = FeatureSnapshot.Builder.class)
public final class FeatureSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String subjectId;
    private final Instant observedAt;
    private final double avgSentiment;
    private final double engagementScore;
    private final int postVolume;
    private final double avgPostVolume;
    private final List<String> crisisKeywords;

    private FeatureSnapshot(Builder builder) {
        this.subjectId = Objects.requireNonNull(builder.subjectId, "subjectId must not be null");
        this.observedAt = Objects.requireNonNull(builder.observedAt, "observedAt must not be null");
        this.avgSentiment = builder.avgSentiment;
        this.engagementScore = builder.engagementScore;
        this.postVolume = builder.postVolume;
        this.avgPostVolume = builder.avgPostVolume;
        this.crisisKeywords = Collections.unmodifiableList(new ArrayList<>(builder.crisisKeywords));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link FeatureSnapshot}.
     */
    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String subjectId;
        private Instant observedAt;
        private double avgSentiment;
        private double engagementScore;
        private int postVolume;
        private double avgPostVolume = 1.0;
        private List<String> crisisKeywords = List.of();

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder observedAt(Instant observedAt) {
            this.observedAt = observedAt;
            return this;
        }

        public Builder avgSentiment(double avgSentiment) {
            this.avgSentiment = avgSentiment;
            return this;
        }

        public Builder engagementScore(double engagementScore) {
            this.engagementScore = engagementScore;
            return this;
        }

        public Builder postVolume(int postVolume) {
            this.postVolume = postVolume;
            return this;
        }

        public Builder avgPostVolume(double avgPostVolume) {
            this.avgPostVolume = avgPostVolume;
            return this;
        }

        public Builder crisisKeywords(List<String> crisisKeywords) {
            this.crisisKeywords = crisisKeywords != null ? crisisKeywords : List.of();
            return this;
        }

        /**
         * @return a new immutable snapshot
         * @throws NullPointerException if {@code subjectId} or {@code observedAt}
         *                              is missing
         */
        public FeatureSnapshot build() {
            return new FeatureSnapshot(this);
        }
    }

    public String getSubjectId() {
        return subjectId;
    }

    public Instant getObservedAt() {
        return observedAt;
    }

    public double getAvgSentiment() {
        return avgSentiment;
    }

    public double getEngagementScore() {
        return engagementScore;
    }

    public int getPostVolume() {
        return postVolume;
    }

    public double getAvgPostVolume() {
        return avgPostVolume;
    }

    /**
     * @return unmodifiable list of crisis keywords found, never {@code null}
     */
    public List<String> getCrisisKeywords() {
        return crisisKeywords;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureSnapshot that))
            return false;
        return Double.compare(avgSentiment, that.avgSentiment) == 0
                && Double.compare(engagementScore, that.engagementScore) == 0
                && postVolume == that.postVolume
                && Double.compare(avgPostVolume, that.avgPostVolume) == 0
                && subjectId.equals(that.subjectId)
                && observedAt.equals(that.observedAt)
                && crisisKeywords.equals(that.crisisKeywords);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subjectId, observedAt, avgSentiment, engagementScore,
                postVolume, avgPostVolume, crisisKeywords);
    }

    @Override
    public String toString() {
        return "FeatureSnapshot{" +
                "subjectId='" + subjectId + '\'' +
                ", observedAt=" + observedAt +
                ", avgSentiment=" + avgSentiment +
                ", engagementScore=" + engagementScore +
                ", postVolume=" + postVolume +
                ", avgPostVolume=" + avgPostVolume +
                ", crisisKeywords=" + crisisKeywords +
                '}';
    }
}
