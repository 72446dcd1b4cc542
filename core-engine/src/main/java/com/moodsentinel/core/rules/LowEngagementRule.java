package com.moodsentinel.core.rules;

import com.moodsentinel.core.config.RuleThresholds;
import com.moodsentinel.core.model.AlertType;
import com.moodsentinel.core.model.CandidateAlert;
import com.moodsentinel.core.model.FeatureSnapshot;
import com.moodsentinel.core.model.Severity;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Fires a {@code LOW} alert when engagement falls below the threshold.
 */
public class LowEngagementRule implements SignalRule {

    static final List<String> ACTIONS = List.of(
            "Monitor for social withdrawal patterns",
            "Check if user needs support or encouragement");

    @Override
    public Optional<CandidateAlert> evaluate(FeatureSnapshot snapshot, RuleThresholds thresholds) {
        double engagement = snapshot.getEngagementScore();
        if (engagement >= thresholds.getEngagementThreshold()) {
            return Optional.empty();
        }
        return Optional.of(new CandidateAlert(
                snapshot.getSubjectId(),
                snapshot.getObservedAt(),
                getType(),
                Severity.LOW,
                String.format(Locale.ROOT, "Low engagement detected: %.2f", engagement),
                ACTIONS));
    }

    @Override
    public AlertType getType() {
        return AlertType.LOW_ENGAGEMENT;
    }
}
