package com.moodsentinel.core.pipeline;

import com.moodsentinel.core.gate.GateDecision;
import com.moodsentinel.core.model.Alert;
import com.moodsentinel.core.model.CandidateAlert;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of processing a single snapshot: the alerts that were persisted and
 * the candidates the gate turned away.
 */
public final class ProcessingResult {

    private final String subjectId;
    private final List<Alert> admitted;
    private final List<Suppression> suppressed;

    ProcessingResult(String subjectId, List<Alert> admitted, List<Suppression> suppressed) {
        this.subjectId = subjectId;
        this.admitted = List.copyOf(admitted);
        this.suppressed = List.copyOf(suppressed);
    }

    static ProcessingResult empty(String subjectId) {
        return new ProcessingResult(subjectId, List.of(), List.of());
    }

    public String getSubjectId() {
        return subjectId;
    }

    /**
     * @return persisted alerts in candidate order
     */
    public List<Alert> getAdmitted() {
        return admitted;
    }

    public List<Suppression> getSuppressed() {
        return suppressed;
    }

    public int candidateCount() {
        return admitted.size() + suppressed.size();
    }

    @Override
    public String toString() {
        return "ProcessingResult{subjectId='" + subjectId + "', admitted=" + admitted.size()
                + ", suppressed=" + suppressed.size() + '}';
    }

    /**
     * A candidate the gate denied, with the reason.
     */
    public static final class Suppression {

        private final CandidateAlert candidate;
        private final GateDecision decision;

        Suppression(CandidateAlert candidate, GateDecision decision) {
            this.candidate = Objects.requireNonNull(candidate);
            this.decision = Objects.requireNonNull(decision);
        }

        public CandidateAlert getCandidate() {
            return candidate;
        }

        public GateDecision getDecision() {
            return decision;
        }

        @Override
        public String toString() {
            return candidate.getType() + "/" + candidate.getSeverity() + " -> " + decision;
        }
    }
}
