package com.moodsentinel.core.delivery;

/**
 * Counts from one delivery pass.
 *
 * <ul>
 * <li>{@code attempted}: alerts handed to the channel</li>
 * <li>{@code sent}: alerts this pass moved to DELIVERED</li>
 * <li>{@code failed}: alerts this pass moved to FAILED</li>
 * <li>{@code retried}: alerts left PENDING after a transient failure</li>
 * <li>{@code expired}: pending alerts older than the lookback window, moved to
 * FAILED without an attempt</li>
 * </ul>
 */
public final class DeliveryReport {

    static final DeliveryReport EMPTY = new DeliveryReport(0, 0, 0, 0, 0);

    private final int attempted;
    private final int sent;
    private final int failed;
    private final int retried;
    private final int expired;

    public DeliveryReport(int attempted, int sent, int failed, int retried, int expired) {
        this.attempted = attempted;
        this.sent = sent;
        this.failed = failed;
        this.retried = retried;
        this.expired = expired;
    }

    public int getAttempted() {
        return attempted;
    }

    public int getSent() {
        return sent;
    }

    public int getFailed() {
        return failed;
    }

    public int getRetried() {
        return retried;
    }

    public int getExpired() {
        return expired;
    }

    @Override
    public String toString() {
        return "DeliveryReport{attempted=" + attempted + ", sent=" + sent
                + ", failed=" + failed + ", retried=" + retried + ", expired=" + expired + '}';
    }
}
