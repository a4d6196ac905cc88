package org.brighted.store.api;

import java.time.Instant;

/**
 * A transient error recorded by a store for monitoring.
 *
 * @param timestamp when the error occurred
 * @param errorType category, e.g. {@code "ROLLBACK_FAILED"}
 * @param message   human-readable description
 * @param details   additional context
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
