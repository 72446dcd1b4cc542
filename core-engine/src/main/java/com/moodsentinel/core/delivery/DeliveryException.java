package com.moodsentinel.core.delivery;

/**
 * Delivery failure thrown by a channel instead of returning a
 * {@link DeliveryResult}.
 *
 * <p>
 * The {@code transient} flag decides whether the alert is retried on a later
 * pass or failed permanently.
 * </p>
 */
public class DeliveryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final boolean transientFailure;

    public DeliveryException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public DeliveryException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
