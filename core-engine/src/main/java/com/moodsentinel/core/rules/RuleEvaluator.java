package com.moodsentinel.core.rules;

import com.moodsentinel.core.config.RuleThresholds;
import com.moodsentinel.core.model.CandidateAlert;
import com.moodsentinel.core.model.FeatureSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts a snapshot into candidate alerts by running every signal rule.
 *
 * <p>
 * Rules are independent and all of them run on every call, so several may fire
 * for one snapshot. No candidate is ever discarded here; suppression belongs
 * to the gate. Evaluation performs no I/O and has no side effects beyond
 * logging.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(RuleEvaluator.class);

    private final List<SignalRule> rules;

    /**
     * Evaluator running every built-in rule.
     */
    public RuleEvaluator() {
        this(SignalRules.all());
    }

    /**
     * @param rules rules to run; must not be {@code null}
     */
    public RuleEvaluator(List<SignalRule> rules) {
        Objects.requireNonNull(rules, "Rules list must not be null");
        this.rules = List.copyOf(rules);
    }

    /**
     * Evaluate a snapshot against every rule.
     *
     * @param snapshot   the scored signals; must not be {@code null}
     * @param thresholds firing thresholds; must not be {@code null}
     * @return candidates in rule order, possibly empty
     * @throws EvaluationException if the snapshot carries malformed values
     */
    public List<CandidateAlert> evaluate(FeatureSnapshot snapshot, RuleThresholds thresholds) {
        Objects.requireNonNull(snapshot, "Snapshot must not be null");
        Objects.requireNonNull(thresholds, "Thresholds must not be null");
        checkWellFormed(snapshot);

        List<CandidateAlert> candidates = new ArrayList<>();
        for (SignalRule rule : rules) {
            rule.evaluate(snapshot, thresholds).ifPresent(candidates::add);
        }

        if (candidates.isEmpty()) {
            LOG.debug("No candidates for {}", snapshot.getSubjectId());
        } else {
            LOG.info("Generated {} candidate alert(s) for {}", candidates.size(), snapshot.getSubjectId());
        }
        return candidates;
    }

    private static void checkWellFormed(FeatureSnapshot snapshot) {
        List<String> errors = new ArrayList<>();
        if (!Double.isFinite(snapshot.getAvgSentiment())) {
            errors.add("avgSentiment is not a finite number");
        }
        if (!Double.isFinite(snapshot.getEngagementScore())) {
            errors.add("engagementScore is not a finite number");
        }
        if (!Double.isFinite(snapshot.getAvgPostVolume()) || snapshot.getAvgPostVolume() < 0) {
            errors.add("avgPostVolume must be a finite number >= 0");
        }
        if (snapshot.getPostVolume() < 0) {
            errors.add("postVolume must be >= 0");
        }
        if (snapshot.getSubjectId().isBlank()) {
            errors.add("subjectId is blank");
        }
        if (!errors.isEmpty()) {
            throw new EvaluationException("Malformed snapshot for '" + snapshot.getSubjectId()
                    + "': " + String.join("; ", errors));
        }
    }
}
