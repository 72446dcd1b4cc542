/**
 * Read-only summaries of persisted alerts.
 *
 * @since 1.0.0
 */
package com.moodsentinel.core.stats;
