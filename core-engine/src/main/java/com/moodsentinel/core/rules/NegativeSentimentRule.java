package com.moodsentinel.core.rules;

import com.moodsentinel.core.config.RuleThresholds;
import com.moodsentinel.core.model.AlertType;
import com.moodsentinel.core.model.CandidateAlert;
import com.moodsentinel.core.model.FeatureSnapshot;
import com.moodsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Fires when average sentiment drops below the configured threshold.
 *
 * <p>
 * Severity is {@code HIGH} below {@value #HIGH_SEVERITY_CUTOFF}, otherwise
 * {@code MEDIUM}.
 * </p>
 *
 * @since 1.0.0
 */
public class NegativeSentimentRule implements SignalRule {

    private static final Logger LOG = LoggerFactory.getLogger(NegativeSentimentRule.class);

    static final double HIGH_SEVERITY_CUTOFF = -0.8;

    static final List<String> ACTIONS = List.of(
            "Monitor user closely for signs of distress",
            "Consider reaching out with support resources",
            "Track sentiment trends over time");

    @Override
    public Optional<CandidateAlert> evaluate(FeatureSnapshot snapshot, RuleThresholds thresholds) {
        double sentiment = snapshot.getAvgSentiment();
        if (sentiment >= thresholds.getSentimentThreshold()) {
            return Optional.empty();
        }

        Severity severity = sentiment < HIGH_SEVERITY_CUTOFF ? Severity.HIGH : Severity.MEDIUM;
        LOG.debug("Rule [{}] fired for {}: sentiment={} < {}",
                getType(), snapshot.getSubjectId(), sentiment, thresholds.getSentimentThreshold());

        return Optional.of(new CandidateAlert(
                snapshot.getSubjectId(),
                snapshot.getObservedAt(),
                getType(),
                severity,
                String.format(Locale.ROOT, "Negative sentiment detected: %.2f", sentiment),
                ACTIONS));
    }

    @Override
    public AlertType getType() {
        return AlertType.NEGATIVE_SENTIMENT;
    }
}
