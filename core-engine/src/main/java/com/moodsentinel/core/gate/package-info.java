/**
 * Admission gate: cooldown, daily cap and critical bypass.
 *
 * <p>
 * {@link com.moodsentinel.core.gate.AlertGate} decides each candidate against
 * an {@link com.moodsentinel.core.gate.AlertHistory} derived from the store.
 * </p>
 *
 * @since 1.0.0
 */
package com.moodsentinel.core.gate;
