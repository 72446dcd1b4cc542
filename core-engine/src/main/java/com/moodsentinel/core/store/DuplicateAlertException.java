package com.moodsentinel.core.store;

/**
 * An alert with the same subject, type and snapshot observation instant is
 * already stored.
 *
 * @since 1.0.0
 */
public class DuplicateAlertException extends StoreException {

    private static final long serialVersionUID = 1L;

    public DuplicateAlertException(String message, Throwable cause) {
        super(message, cause);
    }
}
