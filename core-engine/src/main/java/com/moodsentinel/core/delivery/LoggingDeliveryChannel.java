package com.moodsentinel.core.delivery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Channel that writes each message to the application log and acknowledges
 * it.
 */
public class LoggingDeliveryChannel implements DeliveryChannel {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingDeliveryChannel.class);

    public static final String NAME = "log";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DeliveryResult deliver(String message) {
        LOG.info("Alert notification:\n{}", message);
        return DeliveryResult.ack();
    }
}
