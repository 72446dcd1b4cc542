package com.moodsentinel.core.rules;

import com.moodsentinel.core.config.MoodThresholds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link MoodClassifier}.
 */
class MoodClassifierTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private MoodClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new MoodClassifier(new MoodThresholds());
    }

    @Test
    @DisplayName("Should map scores to bands at the default boundaries")
    void shouldClassifyBands() {
        assertThat(classifier.classify("u1", 0.2, NOW).getBand()).isEqualTo(MoodBand.CRITICAL);
        assertThat(classifier.classify("u1", 0.21, NOW).getBand()).isEqualTo(MoodBand.WARNING);
        assertThat(classifier.classify("u1", 0.4, NOW).getBand()).isEqualTo(MoodBand.WARNING);
        assertThat(classifier.classify("u1", 0.5, NOW).getBand()).isEqualTo(MoodBand.NEUTRAL);
        assertThat(classifier.classify("u1", 0.6, NOW).getBand()).isEqualTo(MoodBand.POSITIVE);
    }

    @Test
    @DisplayName("Only CRITICAL and WARNING require action")
    void shouldRequireActionForLowMood() {
        MoodEvaluation critical = classifier.classify("u1", 0.1, NOW);
        MoodEvaluation neutral = classifier.classify("u1", 0.5, NOW);

        assertThat(critical.isActionRequired()).isTrue();
        assertThat(critical.getMessage()).isEqualTo("Critical mood detected (score: 0.10)");
        assertThat(critical.getRecommendations()).hasSize(5);
        assertThat(neutral.isActionRequired()).isFalse();
        assertThat(neutral.getRecommendations()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a non-finite score")
    void shouldRejectNaN() {
        assertThatThrownBy(() -> classifier.classify("u1", Double.NaN, NOW))
                .isInstanceOf(EvaluationException.class);
    }

    @Test
    @DisplayName("Fewer than two scores is insufficient data")
    void shouldReportInsufficientData() {
        assertThat(classifier.trend(List.of(0.5)).getDirection())
                .isEqualTo(MoodTrend.Direction.INSUFFICIENT_DATA);
    }

    @Test
    @DisplayName("Without two full windows the trend is stable")
    void shouldBeStableWithShortHistory() {
        MoodTrend trend = classifier.trend(List.of(0.1, 0.9, 0.9));

        assertThat(trend.getDirection()).isEqualTo(MoodTrend.Direction.STABLE);
    }

    @Test
    @DisplayName("Should detect improvement and decline between windows")
    void shouldDetectDirection() {
        List<Double> improving = new ArrayList<>(Collections.nCopies(10, 0.3));
        improving.addAll(Collections.nCopies(10, 0.6));
        List<Double> declining = new ArrayList<>(Collections.nCopies(10, 0.7));
        declining.addAll(Collections.nCopies(10, 0.4));

        MoodTrend up = classifier.trend(improving);
        MoodTrend down = classifier.trend(declining);

        assertThat(up.getDirection()).isEqualTo(MoodTrend.Direction.IMPROVING);
        assertThat(up.getRecentAverage()).isCloseTo(0.6, within(1e-9));
        assertThat(down.getDirection()).isEqualTo(MoodTrend.Direction.DECLINING);
    }

    @Test
    @DisplayName("Changes within the sensitivity are stable")
    void shouldIgnoreSmallChanges() {
        List<Double> scores = new ArrayList<>(Collections.nCopies(10, 0.50));
        scores.addAll(Collections.nCopies(10, 0.55));

        assertThat(classifier.trend(scores).getDirection()).isEqualTo(MoodTrend.Direction.STABLE);
    }
}
