package com.moodsentinel.core.rules;

/**
 * Raised when a single snapshot cannot be evaluated (malformed input).
 *
 * <p>
 * Callers isolate it per snapshot: the snapshot is logged and skipped, the
 * rest of the batch proceeds.
 * </p>
 */
public class EvaluationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EvaluationException(String message) {
        super(message);
    }
}
