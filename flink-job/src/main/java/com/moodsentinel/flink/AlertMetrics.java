package com.moodsentinel.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Flink metrics of the admission operator, exposed through the cluster's
 * configured reporters under the {@code mood_sentinel} group.
 *
 * <ul>
 * <li>{@code snapshots_processed_total}</li>
 * <li>{@code alerts_admitted_total}</li>
 * <li>{@code alerts_suppressed_total}</li>
 * <li>{@code snapshots_rejected_total}: malformed snapshots</li>
 * <li>{@code processing_latency_ms}: per-snapshot latency histogram</li>
 * </ul>
 */
public class AlertMetrics {

    private final Counter snapshotsProcessed;
    private final Counter alertsAdmitted;
    private final Counter alertsSuppressed;
    private final Counter snapshotsRejected;
    private final Histogram processingLatency;

    public AlertMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("mood_sentinel");

        this.snapshotsProcessed = group.counter("snapshots_processed_total");
        this.alertsAdmitted = group.counter("alerts_admitted_total");
        this.alertsSuppressed = group.counter("alerts_suppressed_total");
        this.snapshotsRejected = group.counter("snapshots_rejected_total");
        this.processingLatency = group
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void snapshotProcessed(int admitted, int suppressed, long latencyMs) {
        snapshotsProcessed.inc();
        alertsAdmitted.inc(admitted);
        alertsSuppressed.inc(suppressed);
        processingLatency.update(latencyMs);
    }

    public void snapshotRejected() {
        snapshotsRejected.inc();
    }
}
