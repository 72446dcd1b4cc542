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
 * Activity spike rule.
 *
 * <p>
 * Fires a {@code MEDIUM} alert when the post volume is strictly greater than
 * {@code avgPostVolume * volumeSpikeThreshold}.
 * </p>
 *
 * @since 1.0.0
 */
public class ActivitySpikeRule implements SignalRule {

    private static final Logger LOG = LoggerFactory.getLogger(ActivitySpikeRule.class);

    static final List<String> ACTIONS = List.of(
            "Review recent posts for concerning content",
            "Check if spike indicates manic episode or crisis");

    @Override
    public Optional<CandidateAlert> evaluate(FeatureSnapshot snapshot, RuleThresholds thresholds) {
        double limit = snapshot.getAvgPostVolume() * thresholds.getVolumeSpikeThreshold();
        if (snapshot.getPostVolume() <= limit) {
            return Optional.empty();
        }

        LOG.debug("Rule [{}] fired for {}: volume={} > {}",
                getType(), snapshot.getSubjectId(), snapshot.getPostVolume(), limit);

        return Optional.of(new CandidateAlert(
                snapshot.getSubjectId(),
                snapshot.getObservedAt(),
                getType(),
                Severity.MEDIUM,
                String.format(Locale.ROOT, "Unusual activity spike: %d posts (avg: %.1f)",
                        snapshot.getPostVolume(), snapshot.getAvgPostVolume()),
                ACTIONS));
    }

    @Override
    public AlertType getType() {
        return AlertType.ACTIVITY_SPIKE;
    }
}
