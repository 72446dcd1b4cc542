/**
 * Signal rules that turn feature snapshots into candidate alerts.
 *
 * <p>
 * All rules implement {@link com.moodsentinel.core.rules.SignalRule} and are
 * created by {@link com.moodsentinel.core.rules.SignalRules}. Built-in rules:
 * </p>
 * <ul>
 * <li>{@link com.moodsentinel.core.rules.NegativeSentimentRule}</li>
 * <li>{@link com.moodsentinel.core.rules.LowEngagementRule}</li>
 * <li>{@link com.moodsentinel.core.rules.ActivitySpikeRule}</li>
 * <li>{@link com.moodsentinel.core.rules.CrisisKeywordRule}</li>
 * </ul>
 *
 * <p>
 * {@link com.moodsentinel.core.rules.MoodClassifier} is a separate helper that
 * bands a single mood score.
 * </p>
 *
 * @since 1.0.0
 */
package com.moodsentinel.core.rules;
