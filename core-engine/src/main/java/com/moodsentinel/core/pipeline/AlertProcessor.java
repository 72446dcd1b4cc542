package com.moodsentinel.core.pipeline;

import com.moodsentinel.core.config.RuleThresholds;
import com.moodsentinel.core.gate.AlertGate;
import com.moodsentinel.core.gate.AlertHistory;
import com.moodsentinel.core.gate.GateDecision;
import com.moodsentinel.core.model.Alert;
import com.moodsentinel.core.model.CandidateAlert;
import com.moodsentinel.core.model.FeatureSnapshot;
import com.moodsentinel.core.rules.EvaluationException;
import com.moodsentinel.core.rules.RuleEvaluator;
import com.moodsentinel.core.gate.DecisionReason;
import com.moodsentinel.core.source.FeatureSource;
import com.moodsentinel.core.store.AlertStore;
import com.moodsentinel.core.store.DuplicateAlertException;
import com.moodsentinel.core.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Wires evaluation, admission and persistence for incoming snapshots.
 *
 * <h3>Flow per snapshot</h3>
 * <ol>
 * <li>Run the {@link RuleEvaluator} to get candidates.</li>
 * <li>Under the subject's lock, for each candidate skip it if an alert from
 * the same snapshot is already stored, otherwise load the subject's recent
 * history, ask the {@link AlertGate}, and persist if admitted.</li>
 * </ol>
 *
 * <p>
 * The history is reloaded for every candidate so an alert admitted earlier
 * in the same snapshot counts towards cooldown and the daily cap. Re-processing
 * a snapshot (a stream replay after restart, or the same file evaluated twice)
 * admits nothing new: the store keys alerts by subject, type and observation
 * instant.
 * </p>
 *
 * <p>
 * Subjects map onto a fixed set of lock stripes, which makes
 * read-decide-persist atomic per subject within this process. Across
 * processes only the per-snapshot key is enforced by the store; cooldown and
 * the daily cap assume a single admitting process per store, so the caller
 * must route each subject to one processor.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(AlertProcessor.class);

    static final int LOCK_STRIPES = 64;

    private final RuleEvaluator evaluator;
    private final RuleThresholds thresholds;
    private final AlertGate gate;
    private final AlertStore store;
    private final Clock clock;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public AlertProcessor(RuleEvaluator evaluator, RuleThresholds thresholds, AlertGate gate,
            AlertStore store, Clock clock) {
        this.evaluator = Objects.requireNonNull(evaluator, "RuleEvaluator must not be null");
        this.thresholds = Objects.requireNonNull(thresholds, "RuleThresholds must not be null");
        this.gate = Objects.requireNonNull(gate, "AlertGate must not be null");
        this.store = Objects.requireNonNull(store, "AlertStore must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    /**
     * Evaluate one snapshot and persist the admitted candidates.
     *
     * @param snapshot the snapshot; must not be {@code null}
     * @return admitted alerts and suppressed candidates
     * @throws EvaluationException if the snapshot is malformed
     * @throws StoreException      if the store fails; candidates not yet
     *                             persisted are dropped
     */
    public ProcessingResult process(FeatureSnapshot snapshot) {
        List<CandidateAlert> candidates = evaluator.evaluate(snapshot, thresholds);
        String subjectId = snapshot.getSubjectId();
        if (candidates.isEmpty()) {
            return ProcessingResult.empty(subjectId);
        }

        List<Alert> admitted = new ArrayList<>();
        List<ProcessingResult.Suppression> suppressed = new ArrayList<>();

        ReentrantLock lock = lockFor(subjectId);
        lock.lock();
        try {
            for (CandidateAlert candidate : candidates) {
                Optional<Alert> existing = store.findByOrigin(subjectId, candidate.getType(),
                        candidate.getObservedAt());
                if (existing.isPresent()) {
                    LOG.info("Alert {} already admitted for {} from snapshot at {}",
                            existing.get().getId(), subjectId, candidate.getObservedAt());
                    suppressed.add(duplicate(candidate));
                    continue;
                }

                Instant now = clock.instant();
                List<Alert> recent = store.history(subjectId, gate.historyStart(now));
                GateDecision decision = gate.admit(candidate, new AlertHistory(subjectId, now, recent));

                if (!decision.isAllowed()) {
                    suppressed.add(new ProcessingResult.Suppression(candidate, decision));
                    continue;
                }

                long id;
                try {
                    id = store.persist(candidate);
                } catch (DuplicateAlertException e) {
                    // another process admitted the same snapshot in between
                    suppressed.add(duplicate(candidate));
                    continue;
                }
                Alert alert = store.get(id)
                        .orElseThrow(() -> new StoreException("Alert " + id + " vanished after insert"));
                admitted.add(alert);
                LOG.info("Admitted alert {} ({} {}) for {} [{}]",
                        id, candidate.getType(), candidate.getSeverity(), subjectId, decision.getReason());
            }
        } finally {
            lock.unlock();
        }

        ProcessingResult result = new ProcessingResult(subjectId, admitted, suppressed);
        LOG.debug("Processed snapshot for {}: {}", subjectId, result);
        return result;
    }

    ReentrantLock lockFor(String subjectId) {
        return locks[Math.floorMod(subjectId.hashCode(), locks.length)];
    }

    private static ProcessingResult.Suppression duplicate(CandidateAlert candidate) {
        return new ProcessingResult.Suppression(candidate, GateDecision.deny(DecisionReason.DUPLICATE));
    }

    /**
     * Process a batch, continuing past snapshots that fail.
     *
     * @param snapshots snapshots in arrival order
     * @return batch totals
     */
    public CycleReport processAll(List<FeatureSnapshot> snapshots) {
        Objects.requireNonNull(snapshots, "Snapshots must not be null");
        int admitted = 0;
        int suppressed = 0;
        int errors = 0;

        for (FeatureSnapshot snapshot : snapshots) {
            try {
                ProcessingResult result = process(snapshot);
                admitted += result.getAdmitted().size();
                suppressed += result.getSuppressed().size();
            } catch (EvaluationException e) {
                LOG.warn("Skipping malformed snapshot: {}", e.getMessage());
                errors++;
            } catch (StoreException e) {
                LOG.error("Failed to store alerts for {}", snapshot.getSubjectId(), e);
                errors++;
            }
        }

        CycleReport report = new CycleReport(snapshots.size(), admitted, suppressed, errors);
        LOG.info("Processing cycle finished: {}", report);
        return report;
    }

    /**
     * Pull up to {@code limit} snapshots from a source and process them.
     *
     * @param source the feature source
     * @param limit  maximum snapshots to pull
     * @return batch totals
     */
    public CycleReport runCycle(FeatureSource source, int limit) {
        Objects.requireNonNull(source, "FeatureSource must not be null");
        List<FeatureSnapshot> snapshots = source.extract(limit);
        LOG.info("Extracted {} snapshot(s) from {}", snapshots.size(), source.describe());
        return processAll(snapshots);
    }
}
