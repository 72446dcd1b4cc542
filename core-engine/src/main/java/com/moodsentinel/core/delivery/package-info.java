/**
 * Delivery of persisted alerts to external channels.
 *
 * <p>
 * {@link com.moodsentinel.core.delivery.DeliveryCoordinator} runs one pass per
 * call; scheduling passes is left to the caller.
 * </p>
 *
 * @since 1.0.0
 */
package com.moodsentinel.core.delivery;
