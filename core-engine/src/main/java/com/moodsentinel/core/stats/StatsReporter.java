package com.moodsentinel.core.stats;

import com.moodsentinel.core.model.Alert;
import com.moodsentinel.core.model.Severity;
import com.moodsentinel.core.store.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregates persisted alerts into summaries and trends.
 *
 * <p>
 * Read-only: never changes alert state.
 * </p>
 *
 * @since 1.0.0
 */
public class StatsReporter {

    private static final Logger LOG = LoggerFactory.getLogger(StatsReporter.class);

    private final AlertStore store;
    private final Clock clock;

    public StatsReporter(AlertStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "AlertStore must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Summarise every alert created at or after {@code since}.
     *
     * @param since inclusive window start
     * @return the summary
     */
    public AlertStats summarize(Instant since) {
        Objects.requireNonNull(since, "since must not be null");
        return summarize(since, store.createdSince(since));
    }

    /**
     * Summary over the last {@code days} days.
     *
     * @param days window length in days; must be positive
     * @return the summary
     */
    public AlertStats statistics(int days) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be >= 1, got: " + days);
        }
        AlertStats stats = summarize(clock.instant().minus(Duration.ofDays(days)));
        LOG.info("Alert statistics for the last {} day(s): {}", days, stats);
        return stats;
    }

    /**
     * Compare severe-alert counts between the two halves of
     * {@code [since, now)}.
     *
     * @param since window start
     * @return the trend
     */
    public AlertTrend trend(Instant since) {
        Objects.requireNonNull(since, "since must not be null");
        return trend(store.createdSince(since), since, clock.instant());
    }

    /**
     * Compare HIGH/CRITICAL counts between the earlier and later half of
     * {@code [from, to)}. Alerts outside the window are ignored.
     *
     * @param history alerts to inspect, any order
     * @param from    window start, inclusive
     * @param to      window end, exclusive
     * @return the trend; equal counts are {@link TrendDirection#STABLE}
     */
    public static AlertTrend trend(List<Alert> history, Instant from, Instant to) {
        Objects.requireNonNull(history, "history must not be null");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("window end " + to + " is before start " + from);
        }
        Instant midpoint = from.plus(Duration.between(from, to).dividedBy(2));

        int earlier = 0;
        int later = 0;
        for (Alert alert : history) {
            Instant t = alert.getCreatedAt();
            if (!alert.getSeverity().isSevere() || t.isBefore(from) || !t.isBefore(to)) {
                continue;
            }
            if (t.isBefore(midpoint)) {
                earlier++;
            } else {
                later++;
            }
        }
        return new AlertTrend(earlier, later);
    }

    static AlertStats summarize(Instant since, List<Alert> alerts) {
        int delivered = 0;
        int pending = 0;
        int failed = 0;
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);

        for (Alert alert : alerts) {
            switch (alert.getStatus()) {
                case DELIVERED -> delivered++;
                case PENDING -> pending++;
                case FAILED -> failed++;
            }
            bySeverity.merge(alert.getSeverity(), 1, Integer::sum);
        }
        return new AlertStats(since, alerts.size(), delivered, pending, failed, bySeverity);
    }
}
