package com.moodsentinel.core;

import com.moodsentinel.core.model.FeatureSnapshot;

import java.time.Instant;

/**
 * Snapshot builders preset to values that trigger no rule.
 */
public final class Snapshots {

    public static final Instant OBSERVED = Instant.parse("2024-05-01T10:00:00Z");

    private Snapshots() {
    }

    public static FeatureSnapshot.Builder calm(String subjectId) {
        return FeatureSnapshot.builder()
                .subjectId(subjectId)
                .observedAt(OBSERVED)
                .avgSentiment(0.3)
                .engagementScore(0.6)
                .postVolume(5)
                .avgPostVolume(5.0);
    }
}
