package com.moodsentinel.core.rules;

import com.moodsentinel.core.config.MoodThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Maps a single mood score to a {@link MoodBand}.
 *
 * <p>
 * Independent of the multi-signal rules but shares their severity
 * vocabulary. Scores run from 0 (very negative) to 1 (very positive):
 * </p>
 * <ul>
 * <li>{@code score <= critical} → CRITICAL</li>
 * <li>{@code score <= warning} → WARNING</li>
 * <li>{@code score >= recovery} → POSITIVE</li>
 * <li>otherwise → NEUTRAL</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class MoodClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(MoodClassifier.class);

    /** Number of scores per trend window. */
    static final int TREND_WINDOW = 10;

    /** Minimum average change reported as a direction. */
    static final double TREND_SENSITIVITY = 0.1;

    static final List<String> CRITICAL_RECOMMENDATIONS = List.of(
            "Consider reaching out to a mental health professional",
            "Contact a trusted friend or family member",
            "Use crisis helpline if feeling overwhelmed",
            "Practice grounding techniques (5-4-3-2-1 method)",
            "Ensure you're in a safe environment");

    static final List<String> WARNING_RECOMMENDATIONS = List.of(
            "Take a short break from current activities",
            "Practice deep breathing or meditation",
            "Go for a brief walk or light exercise",
            "Listen to calming music",
            "Consider talking to someone you trust");

    static final List<String> POSITIVE_RECOMMENDATIONS = List.of(
            "Great job maintaining positive mood!",
            "Consider sharing your positive energy with others",
            "Take note of what's contributing to your good mood",
            "This might be a good time for creative activities");

    private final MoodThresholds thresholds;

    /**
     * @param thresholds band boundaries; must not be {@code null}
     */
    public MoodClassifier(MoodThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "MoodThresholds must not be null");
    }

    /**
     * Classify one score.
     *
     * @param subjectId subject the score belongs to
     * @param score     mood score in [0, 1]
     * @param timestamp when the mood was observed
     * @return the evaluation
     * @throws EvaluationException if {@code score} is not a finite number
     */
    public MoodEvaluation classify(String subjectId, double score, Instant timestamp) {
        if (!Double.isFinite(score)) {
            throw new EvaluationException("Mood score for '" + subjectId + "' is not a finite number");
        }

        MoodEvaluation evaluation;
        if (score <= thresholds.getCriticalThreshold()) {
            evaluation = new MoodEvaluation(subjectId, score, timestamp, MoodBand.CRITICAL,
                    format("Critical mood detected (score: %.2f)", score), CRITICAL_RECOMMENDATIONS);
        } else if (score <= thresholds.getWarningThreshold()) {
            evaluation = new MoodEvaluation(subjectId, score, timestamp, MoodBand.WARNING,
                    format("Low mood detected (score: %.2f)", score), WARNING_RECOMMENDATIONS);
        } else if (score >= thresholds.getRecoveryThreshold()) {
            evaluation = new MoodEvaluation(subjectId, score, timestamp, MoodBand.POSITIVE,
                    format("Positive mood detected (score: %.2f)", score), POSITIVE_RECOMMENDATIONS);
        } else {
            evaluation = new MoodEvaluation(subjectId, score, timestamp, MoodBand.NEUTRAL,
                    format("Neutral mood (score: %.2f)", score), List.of());
        }

        LOG.info("Mood evaluation for {}: {} - {}", subjectId, evaluation.getBand(), evaluation.getMessage());
        return evaluation;
    }

    /**
     * Analyse a chronological series of scores.
     *
     * <p>
     * The last {@value #TREND_WINDOW} scores are compared with the
     * {@value #TREND_WINDOW} before them; without that earlier window the trend
     * is {@code STABLE}.
     * </p>
     *
     * @param scores mood scores, oldest first
     * @return the trend
     */
    public MoodTrend trend(List<Double> scores) {
        Objects.requireNonNull(scores, "Scores must not be null");
        if (scores.size() < 2) {
            return new MoodTrend(MoodTrend.Direction.INSUFFICIENT_DATA, Double.NaN, 0,
                    "Not enough data for trend analysis");
        }

        int size = scores.size();
        double recentAverage = average(scores.subList(Math.max(0, size - TREND_WINDOW), size));
        if (size < 2 * TREND_WINDOW) {
            return new MoodTrend(MoodTrend.Direction.STABLE, recentAverage, 0,
                    format("Recent average mood: %.2f", recentAverage));
        }

        double earlierAverage = average(scores.subList(size - 2 * TREND_WINDOW, size - TREND_WINDOW));
        double difference = recentAverage - earlierAverage;

        if (difference > TREND_SENSITIVITY) {
            return new MoodTrend(MoodTrend.Direction.IMPROVING, recentAverage, difference,
                    format("Mood trending upward (improvement: +%.2f)", difference));
        }
        if (difference < -TREND_SENSITIVITY) {
            return new MoodTrend(MoodTrend.Direction.DECLINING, recentAverage, difference,
                    format("Mood trending downward (decline: %.2f)", difference));
        }
        return new MoodTrend(MoodTrend.Direction.STABLE, recentAverage, difference,
                format("Recent average mood: %.2f", recentAverage));
    }

    private static double average(List<Double> values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    private static String format(String pattern, double value) {
        return String.format(Locale.ROOT, pattern, value);
    }
}
