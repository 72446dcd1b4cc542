package com.moodsentinel.core.delivery;

import java.util.Objects;

/**
 * Outcome of one channel call.
 *
 * <p>
 * Channels classify their own failures: a transient failure leaves the alert
 * pending for a later pass, a permanent one fails it for good.
 * </p>
 *
 * @since 1.0.0
 */
public final class DeliveryResult {

    /** Classification of a delivery attempt. */
    public enum Outcome {
        ACK,
        TRANSIENT_FAILURE,
        PERMANENT_FAILURE
    }

    private static final DeliveryResult ACK = new DeliveryResult(Outcome.ACK, "ok");

    private final Outcome outcome;
    private final String detail;

    private DeliveryResult(Outcome outcome, String detail) {
        this.outcome = Objects.requireNonNull(outcome, "outcome must not be null");
        this.detail = detail;
    }

    public static DeliveryResult ack() {
        return ACK;
    }

    public static DeliveryResult transientFailure(String detail) {
        return new DeliveryResult(Outcome.TRANSIENT_FAILURE, detail);
    }

    public static DeliveryResult permanentFailure(String detail) {
        return new DeliveryResult(Outcome.PERMANENT_FAILURE, detail);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getDetail() {
        return detail;
    }

    public boolean isAck() {
        return outcome == Outcome.ACK;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DeliveryResult that))
            return false;
        return outcome == that.outcome && Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(outcome, detail);
    }

    @Override
    public String toString() {
        return outcome + "(" + detail + ")";
    }
}
