package com.moodsentinel.core.store;

/**
 * Persistence or query failure in the alert store.
 *
 * <p>
 * The failed operation leaves no partial row behind. Callers abort the
 * current admission attempt; the next cycle re-evaluates from scratch.
 * </p>
 *
 * @since 1.0.0
 */
public class StoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
