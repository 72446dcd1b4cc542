package com.moodsentinel.core.delivery;

import com.moodsentinel.core.config.DeliverySettings;
import com.moodsentinel.core.model.Alert;
import com.moodsentinel.core.store.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Moves pending alerts to an external channel.
 *
 * <h3>Pass</h3>
 * <ol>
 * <li>Mark pending alerts older than the lookback window FAILED with reason
 * {@value #EXPIRED_REASON}.</li>
 * <li>Pull a batch of pending alerts (most severe first) created within the
 * lookback window.</li>
 * <li>Deliver each message, bounded by the configured timeout.</li>
 * <li>Mark every acknowledged alert DELIVERED with one batch update.</li>
 * <li>Mark permanent failures FAILED.</li>
 * <li>Count transient failures against each alert; alerts that used up
 * {@code maxAttempts} are marked FAILED, the rest stay PENDING.</li>
 * </ol>
 *
 * <h3>Guarantees</h3>
 * <p>
 * Delivery is at-least-once. An alert is only marked DELIVERED after the
 * channel acknowledged it, and the store's {@code status = 'PENDING'}
 * predicate stops a racing coordinator from counting it twice. A channel-side
 * duplicate is possible when two passes overlap or when the process stops
 * between delivery and marking.
 * </p>
 *
 * <p>
 * Every alert therefore ends DELIVERED or FAILED: the attempt limit bounds
 * retries and the lookback window bounds age.
 * </p>
 *
 * <p>
 * Channel calls run on at most {@value #MAX_CHANNEL_WORKERS} worker threads.
 * A call that ignores cancellation after a timeout keeps its worker; once all
 * workers are stuck, further calls fail transiently without starting a
 * thread.
 * </p>
 *
 * <p>
 * If the calling thread is interrupted mid-batch, the alerts acknowledged so
 * far are still marked DELIVERED, the rest stay PENDING, and the interrupt
 * flag is restored.
 * </p>
 *
 * @since 1.0.0
 */
public class DeliveryCoordinator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DeliveryCoordinator.class);

    static final String RETRY_LIMIT_REASON = "retry limit exceeded";
    static final String EXPIRED_REASON = "expired";
    static final int MAX_CHANNEL_WORKERS = 4;

    private final AlertStore store;
    private final Clock clock;
    private final int batchSize;
    private final Duration lookback;
    private final Duration timeout;
    private final int maxAttempts;
    private final ExecutorService executor;

    /**
     * @param store    the alert store; must not be {@code null}
     * @param settings delivery settings; must not be {@code null}
     * @param clock    time source; must not be {@code null}
     */
    public DeliveryCoordinator(AlertStore store, DeliverySettings settings, Clock clock) {
        this.store = Objects.requireNonNull(store, "AlertStore must not be null");
        Objects.requireNonNull(settings, "DeliverySettings must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.batchSize = settings.getBatchSize();
        this.lookback = settings.lookback();
        this.timeout = settings.timeout();
        this.maxAttempts = settings.getMaxAttempts();

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(0, MAX_CHANNEL_WORKERS, 60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(), r -> {
                    Thread t = new Thread(r, "delivery-channel-" + threadCount.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    /**
     * Run one delivery pass.
     *
     * @param channel the channel to deliver through; must not be {@code null}
     * @return counts for this pass
     * @throws com.moodsentinel.core.store.StoreException if the store fails;
     *                                                   unmarked alerts stay
     *                                                   PENDING
     */
    public DeliveryReport runOnce(DeliveryChannel channel) {
        Objects.requireNonNull(channel, "DeliveryChannel must not be null");

        Instant since = clock.instant().minus(lookback);
        int expired = store.expireStale(since, EXPIRED_REASON);
        List<Alert> batch = store.listUndelivered(since, batchSize);
        if (batch.isEmpty()) {
            LOG.debug("No undelivered alerts since {}", since);
            return expired == 0 ? DeliveryReport.EMPTY : new DeliveryReport(0, 0, 0, 0, expired);
        }
        LOG.info("Delivering {} alert(s) via {}", batch.size(), channel.getName());

        List<Long> acknowledged = new ArrayList<>();
        List<Long> transientFailures = new ArrayList<>();
        Map<String, List<Long>> permanentFailures = new LinkedHashMap<>();
        int attempted = 0;
        boolean interrupted = false;

        for (Alert alert : batch) {
            if (Thread.currentThread().isInterrupted()) {
                interrupted = true;
                break;
            }
            DeliveryResult result;
            try {
                attempted++;
                result = attempt(channel, AlertMessageFormatter.format(alert));
            } catch (InterruptedException e) {
                LOG.warn("Delivery pass interrupted after {} alert(s)", attempted - 1);
                interrupted = true;
                break;
            }

            switch (result.getOutcome()) {
                case ACK -> acknowledged.add(alert.getId());
                case TRANSIENT_FAILURE -> {
                    LOG.warn("Transient failure delivering alert {}: {}", alert.getId(), result.getDetail());
                    transientFailures.add(alert.getId());
                }
                case PERMANENT_FAILURE -> {
                    LOG.error("Permanent failure delivering alert {}: {}", alert.getId(), result.getDetail());
                    permanentFailures.computeIfAbsent(reasonOf(result), k -> new ArrayList<>()).add(alert.getId());
                }
            }
        }

        try {
            int sent = store.markDelivered(acknowledged, channel.getName(), clock.instant());

            int failed = 0;
            for (Map.Entry<String, List<Long>> e : permanentFailures.entrySet()) {
                failed += store.markFailed(e.getValue(), e.getKey());
            }

            int retried = 0;
            if (!transientFailures.isEmpty()) {
                store.recordTransientFailure(transientFailures);
                int exhausted = store.failExhausted(transientFailures, maxAttempts, RETRY_LIMIT_REASON);
                failed += exhausted;
                retried = Math.max(0, transientFailures.size() - exhausted);
            }

            DeliveryReport report = new DeliveryReport(attempted, sent, failed, retried, expired);
            LOG.info("Delivery pass via {} finished: {}", channel.getName(), report);
            return report;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private DeliveryResult attempt(DeliveryChannel channel, String message) throws InterruptedException {
        Future<DeliveryResult> future;
        try {
            future = executor.submit(() -> channel.deliver(message));
        } catch (RejectedExecutionException e) {
            return DeliveryResult.transientFailure("no delivery worker available");
        }
        try {
            DeliveryResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : DeliveryResult.transientFailure("channel returned no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            return DeliveryResult.transientFailure("timed out after " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof DeliveryException de && !de.isTransient()) {
                return DeliveryResult.permanentFailure(de.getMessage());
            }
            return DeliveryResult.transientFailure(String.valueOf(cause));
        }
    }

    private static String reasonOf(DeliveryResult result) {
        return result.getDetail() != null ? result.getDetail() : "rejected by channel";
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
