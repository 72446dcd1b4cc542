/**
 * Configuration loading and validation for Mood Sentinel.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.moodsentinel.core.config.AlertingConfigLoader} into an
 * {@link com.moodsentinel.core.config.AlertingConfig}. Validation runs
 * right after parsing and reports every problem in one
 * {@link com.moodsentinel.core.config.ConfigException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.moodsentinel.core.config;
