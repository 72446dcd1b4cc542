/**
 * Snapshot-to-alert flow: evaluation, per-subject admission and persistence.
 *
 * @since 1.0.0
 */
package com.moodsentinel.core.pipeline;
