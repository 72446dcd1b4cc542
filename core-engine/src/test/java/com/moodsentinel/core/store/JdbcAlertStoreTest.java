package com.moodsentinel.core.store;

import com.moodsentinel.core.MutableClock;
import com.moodsentinel.core.TestStores;
import com.moodsentinel.core.model.Alert;
import com.moodsentinel.core.model.AlertType;
import com.moodsentinel.core.model.CandidateAlert;
import com.moodsentinel.core.model.DeliveryStatus;
import com.moodsentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JdbcAlertStore} against an in-memory H2 database.
 */
class JdbcAlertStoreTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private JdbcAlertStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = TestStores.newStore(clock);
    }

    @Test
    @DisplayName("Persisted alert reads back with every written field")
    void shouldRoundTripPersistedAlert() {
        long id = store.persist(candidate("u1", AlertType.NEGATIVE_SENTIMENT, Severity.HIGH));

        List<Alert> found = store.query(AlertQuery.builder().subjectId("u1").build());

        assertThat(found).singleElement().satisfies(alert -> {
            assertThat(alert.getId()).isEqualTo(id);
            assertThat(alert.getSubjectId()).isEqualTo("u1");
            assertThat(alert.getType()).isEqualTo(AlertType.NEGATIVE_SENTIMENT);
            assertThat(alert.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(alert.getSummary()).isEqualTo("summary for u1");
            assertThat(alert.getCreatedAt()).isEqualTo(START);
            assertThat(alert.getObservedAt()).isEqualTo(START);
            assertThat(alert.getStatus()).isEqualTo(DeliveryStatus.PENDING);
            assertThat(alert.getDeliveredAt()).isNull();
            assertThat(alert.getDeliveryChannel()).isNull();
        });
        assertThat(store.get(id)).contains(found.get(0));
    }

    @Test
    @DisplayName("get() of an unknown id is empty")
    void shouldReturnEmptyForUnknownId() {
        assertThat(store.get(999L)).isEmpty();
    }

    @Test
    @DisplayName("markDelivered is idempotent: second call returns 0")
    void shouldMarkDeliveredOnce() {
        long a = store.persist(candidate("u1", AlertType.LOW_ENGAGEMENT, Severity.LOW));
        long b = store.persist(candidate("u2", AlertType.LOW_ENGAGEMENT, Severity.LOW));
        Instant sentAt = START.plusSeconds(60);

        int first = store.markDelivered(List.of(a, b), "log", sentAt);
        int second = store.markDelivered(List.of(a, b), "log", sentAt.plusSeconds(60));

        assertThat(first).isEqualTo(2);
        assertThat(second).isZero();
        Alert delivered = store.get(a).orElseThrow();
        assertThat(delivered.getStatus()).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(delivered.getDeliveredAt()).isEqualTo(sentAt);
        assertThat(delivered.getDeliveryChannel()).isEqualTo("log");
    }

    @Test
    @DisplayName("Empty id collections are a no-op")
    void shouldIgnoreEmptyIds() {
        assertThat(store.markDelivered(List.of(), "log", START)).isZero();
        assertThat(store.markFailed(List.of(), "x")).isZero();
        assertThat(store.rearm(List.of())).isZero();
    }

    @Test
    @DisplayName("Undelivered alerts come most severe first, then oldest first")
    void shouldOrderUndeliveredBySeverityThenAge() {
        long low = store.persist(candidate("u1", AlertType.LOW_ENGAGEMENT, Severity.LOW));
        clock.advance(Duration.ofMinutes(1));
        long highOld = store.persist(candidate("u2", AlertType.NEGATIVE_SENTIMENT, Severity.HIGH));
        clock.advance(Duration.ofMinutes(1));
        long critical = store.persist(candidate("u3", AlertType.CRISIS_KEYWORDS, Severity.CRITICAL));
        clock.advance(Duration.ofMinutes(1));
        long highNew = store.persist(candidate("u4", AlertType.NEGATIVE_SENTIMENT, Severity.HIGH));
        store.markDelivered(List.of(critical), "log", clock.instant());

        List<Alert> pending = store.listUndelivered(START.minus(Duration.ofHours(1)));

        assertThat(pending).extracting(Alert::getId).containsExactly(highOld, highNew, low);
        assertThat(store.listUndelivered(START.minus(Duration.ofHours(1)), 2))
                .extracting(Alert::getId).containsExactly(highOld, highNew);
    }

    @Test
    @DisplayName("listUndelivered excludes alerts created before the lower bound")
    void shouldRespectSince() {
        store.persist(candidate("u1", AlertType.LOW_ENGAGEMENT, Severity.LOW));
        clock.advance(Duration.ofHours(2));
        long recent = store.persist(candidate("u1", AlertType.ACTIVITY_SPIKE, Severity.MEDIUM));

        assertThat(store.listUndelivered(START.plus(Duration.ofHours(1))))
                .extracting(Alert::getId).containsExactly(recent);
    }

    @Test
    @DisplayName("markFailed only affects pending alerts")
    void shouldMarkFailed() {
        long pending = store.persist(candidate("u1", AlertType.LOW_ENGAGEMENT, Severity.LOW));
        long delivered = store.persist(candidate("u2", AlertType.LOW_ENGAGEMENT, Severity.LOW));
        store.markDelivered(List.of(delivered), "log", START);

        int updated = store.markFailed(List.of(pending, delivered), "rejected");

        assertThat(updated).isEqualTo(1);
        assertThat(store.get(pending).orElseThrow().getStatus()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(store.get(delivered).orElseThrow().getStatus()).isEqualTo(DeliveryStatus.DELIVERED);
    }

    @Test
    @DisplayName("Transient failures accumulate until the attempt limit fails the alert")
    void shouldFailAlertsThatExhaustedAttempts() {
        long id = store.persist(candidate("u1", AlertType.LOW_ENGAGEMENT, Severity.LOW));

        store.recordTransientFailure(List.of(id));
        assertThat(store.failExhausted(List.of(id), 2, "retry limit exceeded")).isZero();
        store.recordTransientFailure(List.of(id));
        assertThat(store.failExhausted(List.of(id), 2, "retry limit exceeded")).isEqualTo(1);

        assertThat(store.get(id).orElseThrow().getStatus()).isEqualTo(DeliveryStatus.FAILED);
    }

    @Test
    @DisplayName("rearm moves FAILED back to PENDING with a fresh attempt budget")
    void shouldRearmFailedAlerts() {
        long id = store.persist(candidate("u1", AlertType.LOW_ENGAGEMENT, Severity.LOW));
        store.recordTransientFailure(List.of(id));
        store.failExhausted(List.of(id), 1, "retry limit exceeded");

        assertThat(store.rearm(List.of(id))).isEqualTo(1);
        assertThat(store.rearm(List.of(id))).isZero();
        assertThat(store.get(id).orElseThrow().getStatus()).isEqualTo(DeliveryStatus.PENDING);
        assertThat(store.failExhausted(List.of(id), 1, "retry limit exceeded")).isZero();
    }

    @Test
    @DisplayName("failExhausted only fails the given alerts")
    void shouldLimitFailExhaustedToGivenIds() {
        long mine = store.persist(candidate("u1", AlertType.LOW_ENGAGEMENT, Severity.LOW));
        long other = store.persist(candidate("u2", AlertType.LOW_ENGAGEMENT, Severity.LOW));
        store.recordTransientFailure(List.of(mine, other));

        assertThat(store.failExhausted(List.of(mine), 1, "retry limit exceeded")).isEqualTo(1);
        assertThat(store.failExhausted(List.of(), 1, "retry limit exceeded")).isZero();

        assertThat(store.get(mine).orElseThrow().getStatus()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(store.get(other).orElseThrow().getStatus()).isEqualTo(DeliveryStatus.PENDING);
    }

    @Test
    @DisplayName("expireStale fails pending alerts created before the bound and nothing else")
    void shouldExpireStalePendingAlerts() {
        long stale = store.persist(candidate("u1", AlertType.LOW_ENGAGEMENT, Severity.LOW));
        long staleDelivered = store.persist(candidate("u2", AlertType.LOW_ENGAGEMENT, Severity.LOW));
        store.markDelivered(List.of(staleDelivered), "log", START);
        clock.advance(Duration.ofHours(2));
        long fresh = store.persist(candidate("u1", AlertType.ACTIVITY_SPIKE, Severity.MEDIUM));

        assertThat(store.expireStale(START.plus(Duration.ofHours(1)), "expired")).isEqualTo(1);
        assertThat(store.expireStale(START.plus(Duration.ofHours(1)), "expired")).isZero();

        assertThat(store.get(stale).orElseThrow().getStatus()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(store.get(staleDelivered).orElseThrow().getStatus()).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(store.get(fresh).orElseThrow().getStatus()).isEqualTo(DeliveryStatus.PENDING);
    }

    @Test
    @DisplayName("A second alert of the same subject, type and observation instant is rejected")
    void shouldRejectDuplicateOrigin() {
        CandidateAlert crisis = candidate("u1", AlertType.CRISIS_KEYWORDS, Severity.CRITICAL);
        long id = store.persist(crisis);
        clock.advance(Duration.ofSeconds(30));

        assertThatThrownBy(() -> store.persist(crisis)).isInstanceOf(DuplicateAlertException.class);
        assertThat(store.findByOrigin("u1", AlertType.CRISIS_KEYWORDS, START))
                .map(Alert::getId).contains(id);
        assertThat(store.findByOrigin("u1", AlertType.NEGATIVE_SENTIMENT, START)).isEmpty();
        assertThat(store.createdSince(Instant.EPOCH)).hasSize(1);
    }

    @Test
    @DisplayName("history returns one subject's alerts since a point, oldest first")
    void shouldReturnSubjectHistory() {
        store.persist(candidate("u1", AlertType.LOW_ENGAGEMENT, Severity.LOW));
        clock.advance(Duration.ofHours(3));
        long second = store.persist(candidate("u1", AlertType.ACTIVITY_SPIKE, Severity.MEDIUM));
        store.persist(candidate("u2", AlertType.ACTIVITY_SPIKE, Severity.MEDIUM));
        clock.advance(Duration.ofMinutes(5));
        long third = store.persist(candidate("u1", AlertType.NEGATIVE_SENTIMENT, Severity.HIGH));
        store.markDelivered(List.of(second), "log", clock.instant());

        List<Alert> history = store.history("u1", START.plus(Duration.ofHours(1)));

        assertThat(history).extracting(Alert::getId).containsExactly(second, third);
    }

    @Test
    @DisplayName("query filters by type, status and time range, newest first")
    void shouldFilterQuery() {
        long a = store.persist(candidate("u1", AlertType.LOW_ENGAGEMENT, Severity.LOW));
        clock.advance(Duration.ofHours(1));
        long b = store.persist(candidate("u1", AlertType.LOW_ENGAGEMENT, Severity.LOW));
        clock.advance(Duration.ofHours(1));
        store.persist(candidate("u1", AlertType.ACTIVITY_SPIKE, Severity.MEDIUM));
        store.markDelivered(List.of(a), "log", clock.instant());

        assertThat(store.query(AlertQuery.builder().type(AlertType.LOW_ENGAGEMENT).build()))
                .extracting(Alert::getId).containsExactly(b, a);
        assertThat(store.query(AlertQuery.builder()
                .type(AlertType.LOW_ENGAGEMENT)
                .status(DeliveryStatus.PENDING)
                .build()))
                .extracting(Alert::getId).containsExactly(b);
        assertThat(store.query(AlertQuery.builder()
                .from(START.plus(Duration.ofMinutes(30)))
                .to(START.plus(Duration.ofMinutes(90)))
                .build()))
                .extracting(Alert::getId).containsExactly(b);
        assertThat(store.query(AlertQuery.builder().limit(1).offset(1).build()))
                .extracting(Alert::getId).containsExactly(b);
    }

    @Test
    @DisplayName("createdSince spans every subject and status")
    void shouldListCreatedSince() {
        long a = store.persist(candidate("u1", AlertType.LOW_ENGAGEMENT, Severity.LOW));
        long b = store.persist(candidate("u2", AlertType.CRISIS_KEYWORDS, Severity.CRITICAL));
        store.markFailed(List.of(b), "rejected");

        assertThat(store.createdSince(START)).extracting(Alert::getId).containsExactly(a, b);
        assertThat(store.createdSince(START.plusSeconds(1))).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private CandidateAlert candidate(String subject, AlertType type, Severity severity) {
        return new CandidateAlert(subject, clock.instant(), type, severity, "summary for " + subject, List.of());
    }
}
