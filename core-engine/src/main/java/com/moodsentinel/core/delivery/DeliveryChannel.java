package com.moodsentinel.core.delivery;

/**
 * External channel that alert messages are delivered to.
 *
 * <p>
 * Implementations own their transport and must classify failures as transient
 * or permanent, either through the returned {@link DeliveryResult} or by
 * throwing {@link DeliveryException}. Any other exception is treated as
 * transient.
 * </p>
 */
public interface DeliveryChannel {

    /**
     * @return channel name recorded on delivered alerts
     */
    String getName();

    /**
     * Deliver one message.
     *
     * @param message formatted alert text
     * @return the outcome
     */
    DeliveryResult deliver(String message);
}
