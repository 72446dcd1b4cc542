package com.moodsentinel.core.gate;

import com.moodsentinel.core.config.GatePolicy;
import com.moodsentinel.core.model.Alert;
import com.moodsentinel.core.model.CandidateAlert;
import com.moodsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Admission policy between candidate generation and persistence.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>{@code CRITICAL} candidates are always admitted.</li>
 * <li>If the subject already has an alert of the same type and severity
 * created within the cooldown, deny with {@link DecisionReason#COOLDOWN}.</li>
 * <li>If the subject already has {@code maxAlertsPerDay} alerts (any type)
 * on the current calendar day, deny with
 * {@link DecisionReason#DAILY_CAP}.</li>
 * <li>Otherwise admit.</li>
 * </ol>
 *
 * <p>
 * The calendar day is evaluated in the policy's zone and resets at local
 * midnight. Decisions are pure functions of the candidate and the history;
 * callers serialize admission per subject so the history they pass is not
 * stale.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertGate {

    private static final Logger LOG = LoggerFactory.getLogger(AlertGate.class);

    private final Duration cooldown;
    private final int maxAlertsPerDay;
    private final ZoneId zone;

    /**
     * @param policy suppression settings; must not be {@code null}
     */
    public AlertGate(GatePolicy policy) {
        Objects.requireNonNull(policy, "GatePolicy must not be null");
        this.cooldown = policy.cooldown();
        this.maxAlertsPerDay = policy.getMaxAlertsPerDay();
        this.zone = policy.zoneId();
    }

    /**
     * Earliest creation time the gate may look at when deciding at
     * {@code now}: the start of the cooldown or of the calendar day, whichever
     * is earlier.
     *
     * @param now evaluation instant
     * @return lower bound for the history query
     */
    public Instant historyStart(Instant now) {
        Instant cooldownStart = now.minus(cooldown);
        Instant dayStart = startOfDay(now);
        return cooldownStart.isBefore(dayStart) ? cooldownStart : dayStart;
    }

    /**
     * Decide whether a candidate may be persisted.
     *
     * @param candidate the candidate; must not be {@code null}
     * @param history   recent alerts of the candidate's subject
     * @return the decision
     */
    public GateDecision admit(CandidateAlert candidate, AlertHistory history) {
        Objects.requireNonNull(candidate, "Candidate must not be null");
        Objects.requireNonNull(history, "History must not be null");

        if (candidate.getSeverity() == Severity.CRITICAL) {
            return GateDecision.allow(DecisionReason.CRITICAL_BYPASS);
        }

        Instant now = history.getAsOf();
        Instant cooldownStart = now.minus(cooldown);
        boolean inCooldown = history.getAlerts().stream()
                .filter(a -> a.getSubjectId().equals(candidate.getSubjectId()))
                .anyMatch(a -> a.getType() == candidate.getType()
                        && a.getSeverity() == candidate.getSeverity()
                        && a.getCreatedAt().isAfter(cooldownStart));
        if (inCooldown) {
            LOG.info("Alert {}/{} for {} suppressed due to cooldown",
                    candidate.getType(), candidate.getSeverity(), candidate.getSubjectId());
            return GateDecision.deny(DecisionReason.COOLDOWN);
        }

        Instant dayStart = startOfDay(now);
        Instant dayEnd = startOfNextDay(now);
        long today = history.getAlerts().stream()
                .filter(a -> a.getSubjectId().equals(candidate.getSubjectId()))
                .map(Alert::getCreatedAt)
                .filter(t -> !t.isBefore(dayStart) && t.isBefore(dayEnd))
                .count();
        if (today >= maxAlertsPerDay) {
            LOG.warn("Daily alert limit reached for {} ({} >= {})",
                    candidate.getSubjectId(), today, maxAlertsPerDay);
            return GateDecision.deny(DecisionReason.DAILY_CAP);
        }

        return GateDecision.allow(DecisionReason.ADMITTED);
    }

    private Instant startOfDay(Instant now) {
        return now.atZone(zone).toLocalDate().atStartOfDay(zone).toInstant();
    }

    private Instant startOfNextDay(Instant now) {
        ZonedDateTime today = now.atZone(zone).toLocalDate().atStartOfDay(zone);
        return today.toLocalDate().plusDays(1).atStartOfDay(zone).toInstant();
    }
}
