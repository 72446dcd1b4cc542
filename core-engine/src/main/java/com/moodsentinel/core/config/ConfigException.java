package com.moodsentinel.core.config;

/**
 * Raised when threshold or policy configuration is malformed or out of range.
 *
 * <p>
 * Configuration errors are fatal at startup and never retried.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
