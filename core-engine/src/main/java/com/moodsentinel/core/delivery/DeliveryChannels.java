package com.moodsentinel.core.delivery;

import com.moodsentinel.core.config.ConfigException;

import java.util.Locale;
import java.util.Objects;

/**
 * Factory resolving a configured channel name to a {@link DeliveryChannel}.
 */
public final class DeliveryChannels {

    private DeliveryChannels() {
        // utility class
    }

    /**
     * @param name configured channel name; must not be {@code null}
     * @return the channel
     * @throws ConfigException if the name is unknown
     */
    public static DeliveryChannel create(String name) {
        Objects.requireNonNull(name, "Channel name must not be null");
        return switch (name.toLowerCase(Locale.ROOT)) {
            case LoggingDeliveryChannel.NAME -> new LoggingDeliveryChannel();
            default -> throw new ConfigException(
                    "Unknown delivery channel: '" + name + "'. Supported: " + LoggingDeliveryChannel.NAME);
        };
    }
}
