/**
 * Domain model classes for Mood Sentinel.
 *
 * <p>
 * This package contains the value types that flow through the alerting
 * pipeline:
 * </p>
 * <ul>
 * <li>{@link com.moodsentinel.core.model.FeatureSnapshot}: immutable scored
 * signals for one subject</li>
 * <li>{@link com.moodsentinel.core.model.CandidateAlert}: alert proposed by a
 * rule, without identity</li>
 * <li>{@link com.moodsentinel.core.model.Alert}: persisted alert with its
 * delivery state</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.moodsentinel.core.model;
