package com.moodsentinel.core.rules;

import com.moodsentinel.core.config.RuleThresholds;
import com.moodsentinel.core.model.AlertType;
import com.moodsentinel.core.model.CandidateAlert;
import com.moodsentinel.core.model.FeatureSnapshot;

import java.util.Optional;

/**
 * Contract for all signal rules.
 * <p>
 * Rules are <strong>stateless</strong> and side-effect free: the same
 * snapshot and thresholds always yield the same result. Each rule produces at
 * most one candidate per snapshot.
 * </p>
 */
public interface SignalRule {

    /**
     * Evaluate a snapshot against this rule.
     *
     * @param snapshot   the scored signals
     * @param thresholds the firing thresholds
     * @return a candidate alert if the rule fires, empty otherwise
     */
    Optional<CandidateAlert> evaluate(FeatureSnapshot snapshot, RuleThresholds thresholds);

    /**
     * @return the alert type this rule produces
     */
    AlertType getType();
}
