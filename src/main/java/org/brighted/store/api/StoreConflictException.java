package org.brighted.store.api;

/**
 * Thrown when a transaction lost a race (lock timeout, deadlock, concurrent update).
 * The transaction was rolled back and may be retried as a whole.
 */
public class StoreConflictException extends StoreException {

    public StoreConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
