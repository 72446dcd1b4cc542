package com.moodsentinel.core.rules;

import com.moodsentinel.core.config.RuleThresholds;
import com.moodsentinel.core.model.AlertType;
import com.moodsentinel.core.model.CandidateAlert;
import com.moodsentinel.core.model.FeatureSnapshot;
import com.moodsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Crisis keyword rule.
 *
 * <p>
 * Any crisis keyword in the snapshot yields exactly one {@code CRITICAL}
 * candidate. No threshold applies, and downstream suppression never drops
 * {@code CRITICAL} alerts.
 * </p>
 *
 * @since 1.0.0
 */
public class CrisisKeywordRule implements SignalRule {

    private static final Logger LOG = LoggerFactory.getLogger(CrisisKeywordRule.class);

    static final List<String> ACTIONS = List.of(
            "IMMEDIATE attention required",
            "Contact crisis intervention team",
            "Reach out to user directly",
            "Monitor continuously");

    @Override
    public Optional<CandidateAlert> evaluate(FeatureSnapshot snapshot, RuleThresholds thresholds) {
        List<String> keywords = snapshot.getCrisisKeywords();
        if (keywords.isEmpty()) {
            return Optional.empty();
        }

        LOG.warn("Crisis keywords detected for {}: {}", snapshot.getSubjectId(), keywords);

        return Optional.of(new CandidateAlert(
                snapshot.getSubjectId(),
                snapshot.getObservedAt(),
                getType(),
                Severity.CRITICAL,
                "Crisis keywords detected: " + String.join(", ", keywords),
                ACTIONS));
    }

    @Override
    public AlertType getType() {
        return AlertType.CRISIS_KEYWORDS;
    }
}
