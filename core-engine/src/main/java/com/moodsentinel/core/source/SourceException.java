package com.moodsentinel.core.source;

/**
 * Thrown when a feature source cannot be read.
 */
public class SourceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
