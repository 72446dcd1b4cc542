package com.moodsentinel.core.store;

import com.moodsentinel.core.model.Alert;
import com.moodsentinel.core.model.AlertType;
import com.moodsentinel.core.model.CandidateAlert;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for admitted alerts and their delivery state machine.
 *
 * <p>
 * Status moves only {@code PENDING -> DELIVERED} or {@code PENDING -> FAILED};
 * {@link #rearm(Collection)} is the single way back from {@code FAILED}.
 * Every state-changing update re-checks the current status in its predicate,
 * so repeating a call is harmless and returns 0.
 * </p>
 *
 * <p>
 * Implementations must be thread-safe and give row-level atomicity for
 * {@link #persist(CandidateAlert)} and the mark operations. Every method may
 * throw {@link StoreException}.
 * </p>
 *
 * @since 1.0.0
 */
public interface AlertStore {

    /**
     * Insert an admitted candidate as a {@code PENDING} alert created now.
     *
     * @param candidate the admitted candidate
     * @return the assigned id
     * @throws DuplicateAlertException if an alert with the same subject, type
     *                                 and observation instant exists
     */
    long persist(CandidateAlert candidate);

    /**
     * The alert admitted from a given snapshot, if any.
     *
     * @param subjectId  subject
     * @param type       alert type
     * @param observedAt observation instant of the snapshot
     * @return the stored alert, or empty
     */
    Optional<Alert> findByOrigin(String subjectId, AlertType type, Instant observedAt);

    /**
     * @param id alert id
     * @return the alert, or empty if no such id
     */
    Optional<Alert> get(long id);

    /**
     * Alerts of one subject created at or after {@code since}, oldest first.
     *
     * @param subjectId subject
     * @param since     inclusive lower bound on {@code createdAt}
     * @return matching alerts of every status
     */
    List<Alert> history(String subjectId, Instant since);

    /**
     * Pending alerts created at or after {@code since}, most severe first,
     * then oldest first.
     *
     * @param since inclusive lower bound on {@code createdAt}
     * @param limit maximum number returned
     * @return pending alerts in delivery order
     */
    List<Alert> listUndelivered(Instant since, int limit);

    /**
     * Same as {@link #listUndelivered(Instant, int)} without a limit.
     */
    default List<Alert> listUndelivered(Instant since) {
        return listUndelivered(since, Integer.MAX_VALUE);
    }

    /**
     * Transition pending alerts to {@code DELIVERED} in one atomic update.
     *
     * @param ids     alert ids
     * @param channel name of the acknowledging channel
     * @param sentAt  delivery instant
     * @return number of rows that were {@code PENDING} and are now
     *         {@code DELIVERED}
     */
    int markDelivered(Collection<Long> ids, String channel, Instant sentAt);

    /**
     * Transition pending alerts to {@code FAILED}.
     *
     * @param ids    alert ids
     * @param reason failure reason kept with the row
     * @return number of rows transitioned
     */
    int markFailed(Collection<Long> ids, String reason);

    /**
     * Count one more transient delivery failure against each pending alert.
     *
     * @param ids alert ids
     * @return number of rows updated
     */
    int recordTransientFailure(Collection<Long> ids);

    /**
     * Fail those of the given pending alerts whose transient failures reached
     * the limit.
     *
     * @param ids         alert ids to check
     * @param maxAttempts attempt limit
     * @param reason      failure reason kept with the rows
     * @return number of rows transitioned
     */
    int failExhausted(Collection<Long> ids, int maxAttempts, String reason);

    /**
     * Fail every pending alert created before {@code before}.
     *
     * @param before exclusive upper bound on {@code createdAt}
     * @param reason failure reason kept with the rows
     * @return number of rows transitioned
     */
    int expireStale(Instant before, String reason);

    /**
     * Explicit retry: move failed alerts back to {@code PENDING} with a fresh
     * attempt budget.
     *
     * @param ids alert ids
     * @return number of rows transitioned
     */
    int rearm(Collection<Long> ids);

    /**
     * Read-only filtered listing, newest first.
     *
     * @param query filters and paging
     * @return matching alerts
     */
    List<Alert> query(AlertQuery query);

    /**
     * All alerts created at or after {@code since}, oldest first.
     *
     * @param since inclusive lower bound on {@code createdAt}
     * @return matching alerts of every status
     */
    List<Alert> createdSince(Instant since);
}
