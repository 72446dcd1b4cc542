package com.moodsentinel.core.pipeline;

import com.moodsentinel.core.MutableClock;
import com.moodsentinel.core.Snapshots;
import com.moodsentinel.core.TestStores;
import com.moodsentinel.core.config.DeliverySettings;
import com.moodsentinel.core.config.GatePolicy;
import com.moodsentinel.core.config.RuleThresholds;
import com.moodsentinel.core.delivery.DeliveryCoordinator;
import com.moodsentinel.core.delivery.DeliveryReport;
import com.moodsentinel.core.delivery.LoggingDeliveryChannel;
import com.moodsentinel.core.gate.AlertGate;
import com.moodsentinel.core.gate.DecisionReason;
import com.moodsentinel.core.model.Alert;
import com.moodsentinel.core.model.AlertType;
import com.moodsentinel.core.model.DeliveryStatus;
import com.moodsentinel.core.model.FeatureSnapshot;
import com.moodsentinel.core.model.Severity;
import com.moodsentinel.core.rules.EvaluationException;
import com.moodsentinel.core.rules.RuleEvaluator;
import com.moodsentinel.core.source.InMemoryFeatureSource;
import com.moodsentinel.core.store.JdbcAlertStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertProcessor}.
 */
class AlertProcessorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private MutableClock clock;
    private JdbcAlertStore store;
    private AlertProcessor processor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = TestStores.newStore(clock);
        processor = new AlertProcessor(new RuleEvaluator(), new RuleThresholds(),
                new AlertGate(new GatePolicy()), store, clock);
    }

    @Test
    @DisplayName("Negative snapshot is persisted PENDING, then delivered and gone from the pending list")
    void shouldCarryAlertFromSnapshotToDelivery() {
        FeatureSnapshot snapshot = FeatureSnapshot.builder()
                .subjectId("u1")
                .observedAt(NOW)
                .avgSentiment(-0.9)
                .engagementScore(0.5)
                .postVolume(10)
                .avgPostVolume(10)
                .build();

        ProcessingResult result = processor.process(snapshot);

        assertThat(result.getAdmitted()).singleElement().satisfies(alert -> {
            assertThat(alert.getType()).isEqualTo(AlertType.NEGATIVE_SENTIMENT);
            assertThat(alert.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(alert.getStatus()).isEqualTo(DeliveryStatus.PENDING);
        });
        long id = result.getAdmitted().get(0).getId();

        DeliveryReport report;
        try (DeliveryCoordinator coordinator = new DeliveryCoordinator(store, new DeliverySettings(), clock)) {
            report = coordinator.runOnce(new LoggingDeliveryChannel());
        }

        assertThat(report.getSent()).isEqualTo(1);
        assertThat(store.get(id).orElseThrow().getStatus()).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(store.listUndelivered(NOW.minus(Duration.ofDays(1)))).isEmpty();
    }

    @Test
    @DisplayName("A repeated identical candidate inside the cooldown is suppressed")
    void shouldSuppressDuplicateWithinCooldown() {
        FeatureSnapshot snapshot = Snapshots.calm("u1").avgSentiment(-0.9).build();
        FeatureSnapshot later = Snapshots.calm("u1")
                .observedAt(Snapshots.OBSERVED.plus(Duration.ofMinutes(30)))
                .avgSentiment(-0.9)
                .build();

        ProcessingResult first = processor.process(snapshot);
        clock.advance(Duration.ofMinutes(30));
        ProcessingResult second = processor.process(later);

        assertThat(first.getAdmitted()).hasSize(1);
        assertThat(second.getAdmitted()).isEmpty();
        assertThat(second.getSuppressed()).singleElement()
                .satisfies(s -> assertThat(s.getDecision().getReason()).isEqualTo(DecisionReason.COOLDOWN));
        assertThat(store.history("u1", NOW)).hasSize(1);
    }

    @Test
    @DisplayName("Candidates admitted earlier in the same snapshot count towards the daily cap")
    void shouldApplyCapWithinOneSnapshot() {
        GatePolicy policy = new GatePolicy();
        policy.setMaxAlertsPerDay(2);
        processor = new AlertProcessor(new RuleEvaluator(), new RuleThresholds(), new AlertGate(policy), store, clock);
        FeatureSnapshot snapshot = Snapshots.calm("u1")
                .avgSentiment(-0.9)
                .engagementScore(0.1)
                .postVolume(30)
                .avgPostVolume(10)
                .crisisKeywords(List.of("hopeless"))
                .build();

        ProcessingResult result = processor.process(snapshot);

        assertThat(result.candidateCount()).isEqualTo(4);
        assertThat(result.getAdmitted()).extracting(Alert::getType).containsExactly(
                AlertType.NEGATIVE_SENTIMENT, AlertType.LOW_ENGAGEMENT, AlertType.CRISIS_KEYWORDS);
        assertThat(result.getSuppressed()).singleElement()
                .satisfies(s -> assertThat(s.getDecision().getReason()).isEqualTo(DecisionReason.DAILY_CAP));
    }

    @Test
    @DisplayName("Crisis keywords are admitted even when cooldown and cap would deny")
    void shouldAlwaysAdmitCritical() {
        GatePolicy policy = new GatePolicy();
        policy.setMaxAlertsPerDay(1);
        processor = new AlertProcessor(new RuleEvaluator(), new RuleThresholds(), new AlertGate(policy), store, clock);
        FeatureSnapshot crisis = Snapshots.calm("u1").crisisKeywords(List.of("goodbye")).build();
        FeatureSnapshot nextCrisis = Snapshots.calm("u1")
                .observedAt(Snapshots.OBSERVED.plus(Duration.ofMinutes(1)))
                .crisisKeywords(List.of("goodbye"))
                .build();

        processor.process(crisis);
        clock.advance(Duration.ofMinutes(1));
        ProcessingResult again = processor.process(nextCrisis);

        assertThat(again.getAdmitted()).singleElement()
                .satisfies(a -> assertThat(a.getSeverity()).isEqualTo(Severity.CRITICAL));
    }

    @Test
    @DisplayName("Re-processing the same crisis snapshot admits nothing new")
    void shouldNotReadmitReplayedCrisisSnapshot() {
        FeatureSnapshot crisis = Snapshots.calm("u1").crisisKeywords(List.of("hopeless")).build();

        ProcessingResult first = processor.process(crisis);
        clock.advance(Duration.ofSeconds(30));
        ProcessingResult replay = processor.process(crisis);

        assertThat(first.getAdmitted()).singleElement()
                .satisfies(a -> assertThat(a.getObservedAt()).isEqualTo(Snapshots.OBSERVED));
        assertThat(replay.getAdmitted()).isEmpty();
        assertThat(replay.getSuppressed()).singleElement()
                .satisfies(s -> assertThat(s.getDecision().getReason()).isEqualTo(DecisionReason.DUPLICATE));
        assertThat(store.createdSince(Instant.EPOCH)).hasSize(1);
    }

    @Test
    @DisplayName("Two processors sharing a store admit a replayed crisis snapshot once")
    void shouldAdmitSnapshotOnceAcrossProcessors() {
        AlertProcessor other = new AlertProcessor(new RuleEvaluator(), new RuleThresholds(),
                new AlertGate(new GatePolicy()), store, clock);
        FeatureSnapshot crisis = Snapshots.calm("u1").crisisKeywords(List.of("hopeless")).build();

        int admitted = processor.process(crisis).getAdmitted().size()
                + other.process(crisis).getAdmitted().size();

        assertThat(admitted).isEqualTo(1);
        assertThat(store.createdSince(Instant.EPOCH)).hasSize(1);
    }

    @Test
    @DisplayName("Subject locks come from a fixed set of stripes")
    void shouldStripeSubjectLocks() {
        Set<ReentrantLock> locks = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = 0; i < 10_000; i++) {
            locks.add(processor.lockFor("subject-" + i));
        }

        assertThat(processor.lockFor("u1")).isSameAs(processor.lockFor("u1"));
        assertThat(locks).hasSizeLessThanOrEqualTo(AlertProcessor.LOCK_STRIPES);
    }

    @Test
    @DisplayName("Snapshots without signals produce nothing")
    void shouldIgnoreCalmSnapshot() {
        ProcessingResult result = processor.process(Snapshots.calm("u1").build());

        assertThat(result.candidateCount()).isZero();
        assertThat(store.createdSince(NOW.minus(Duration.ofDays(1)))).isEmpty();
    }

    @Test
    @DisplayName("process() surfaces malformed snapshots")
    void shouldPropagateEvaluationError() {
        assertThatThrownBy(() -> processor.process(Snapshots.calm("u1").engagementScore(Double.NaN).build()))
                .isInstanceOf(EvaluationException.class);
    }

    @Test
    @DisplayName("processAll skips malformed snapshots and keeps going")
    void shouldContinuePastBadSnapshots() {
        List<FeatureSnapshot> batch = List.of(
                Snapshots.calm("u1").avgSentiment(-0.9).build(),
                Snapshots.calm("u2").avgSentiment(Double.POSITIVE_INFINITY).build(),
                Snapshots.calm("u3").engagementScore(0.05).build());

        CycleReport report = processor.processAll(batch);

        assertThat(report.getSnapshots()).isEqualTo(3);
        assertThat(report.getAdmitted()).isEqualTo(2);
        assertThat(report.getErrors()).isEqualTo(1);
    }

    @Test
    @DisplayName("runCycle drains up to the limit from the source")
    void shouldRunCycleFromSource() {
        InMemoryFeatureSource source = new InMemoryFeatureSource(List.of(
                Snapshots.calm("u1").avgSentiment(-0.9).build(),
                Snapshots.calm("u2").avgSentiment(-0.9).build(),
                Snapshots.calm("u3").avgSentiment(-0.9).build()));

        CycleReport first = processor.runCycle(source, 2);
        CycleReport second = processor.runCycle(source, 2);

        assertThat(first.getSnapshots()).isEqualTo(2);
        assertThat(second.getSnapshots()).isEqualTo(1);
        assertThat(first.getAdmitted() + second.getAdmitted()).isEqualTo(3);
    }

    @Test
    @DisplayName("Concurrent snapshots for one subject admit a candidate only once")
    void shouldSerializeAdmissionPerSubject() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<ProcessingResult>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                FeatureSnapshot snapshot = Snapshots.calm("u1")
                        .observedAt(Snapshots.OBSERVED.plusSeconds(i))
                        .avgSentiment(-0.9)
                        .build();
                tasks.add(() -> processor.process(snapshot));
            }
            int admitted = 0;
            for (Future<ProcessingResult> f : pool.invokeAll(tasks)) {
                admitted += f.get().getAdmitted().size();
            }

            assertThat(admitted).isEqualTo(1);
            assertThat(store.history("u1", NOW.minus(Duration.ofHours(1)))).hasSize(1);
        } finally {
            pool.shutdown();
            pool.awaitTermination(5, TimeUnit.SECONDS);
        }
    }
}
