package com.moodsentinel.flink;

import com.moodsentinel.core.config.AlertingConfig;
import com.moodsentinel.core.gate.AlertGate;
import com.moodsentinel.core.model.Alert;
import com.moodsentinel.core.model.FeatureSnapshot;
import com.moodsentinel.core.pipeline.AlertProcessor;
import com.moodsentinel.core.pipeline.ProcessingResult;
import com.moodsentinel.core.rules.EvaluationException;
import com.moodsentinel.core.rules.RuleEvaluator;
import com.moodsentinel.core.store.JdbcAlertStore;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Keyed operator that evaluates snapshots and admits alerts for one subject
 * at a time.
 *
 * <p>
 * The stream is keyed by subject id, so every subject is handled by exactly
 * one parallel instance; that instance's {@link AlertProcessor} serializes
 * admission for the subject against the shared alert store. Admitted alerts
 * are already persisted as {@code PENDING} when emitted downstream.
 * </p>
 *
 * <h3>Failure handling</h3>
 * <p>
 * Malformed snapshots are logged, counted and dropped. Store failures
 * propagate so Flink restarts the task and replays from the last checkpoint.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertAdmissionFunction extends KeyedProcessFunction<String, FeatureSnapshot, Alert> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AlertAdmissionFunction.class);

    private final AlertingConfig config;

    private transient AlertProcessor processor;
    private transient AlertMetrics metrics;

    /**
     * @param config validated alerting configuration; must not be {@code null}
     */
    public AlertAdmissionFunction(AlertingConfig config) {
        this.config = Objects.requireNonNull(config, "AlertingConfig must not be null");
    }

    @Override
    public void open(Configuration parameters) {
        Clock clock = Clock.systemUTC();
        JdbcAlertStore store = JdbcAlertStore.open(config.getStore(), clock);
        processor = new AlertProcessor(new RuleEvaluator(), config.getRules(),
                new AlertGate(config.getGate()), store, clock);
        metrics = new AlertMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("AlertAdmissionFunction opened (subtask {})", getRuntimeContext().getIndexOfThisSubtask());
    }

    @Override
    public void processElement(FeatureSnapshot snapshot,
            KeyedProcessFunction<String, FeatureSnapshot, Alert>.Context ctx,
            Collector<Alert> out) {
        long startNanos = System.nanoTime();

        ProcessingResult result;
        try {
            result = processor.process(snapshot);
        } catch (EvaluationException e) {
            LOG.warn("Dropping malformed snapshot for {}: {}", ctx.getCurrentKey(), e.getMessage());
            metrics.snapshotRejected();
            return;
        }

        result.getAdmitted().forEach(out::collect);
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        metrics.snapshotProcessed(result.getAdmitted().size(), result.getSuppressed().size(), durationMs);
    }
}
