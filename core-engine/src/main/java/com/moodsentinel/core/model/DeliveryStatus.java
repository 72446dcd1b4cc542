package com.moodsentinel.core.model;

/**
 * Delivery state of a persisted alert.
 *
 * <p>
 * Legal transitions are {@code PENDING -> DELIVERED} and
 * {@code PENDING -> FAILED}. A {@code FAILED} alert only returns to
 * {@code PENDING} through an explicit re-arm.
 * </p>
 */
public enum DeliveryStatus {
    PENDING,
    DELIVERED,
    FAILED
}
