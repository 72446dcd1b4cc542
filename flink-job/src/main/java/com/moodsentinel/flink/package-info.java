/**
 * Apache Flink streaming job that turns feature snapshots from Kafka into
 * persisted alerts, keyed by subject.
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.moodsentinel.flink.AlertPipelineJob}: main entry point</li>
 * <li>{@link com.moodsentinel.flink.AlertAdmissionFunction}: keyed admission
 * operator</li>
 * <li>{@link com.moodsentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.moodsentinel.flink.HealthServer}: health and readiness
 * probes</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.moodsentinel.flink;
