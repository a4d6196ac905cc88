package org.brighted.practicals;

import org.brighted.config.EngineSettings.RetrySettings;
import org.brighted.store.api.StoreConflictException;
import org.brighted.store.api.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Retries whole store transactions that lost a race.
 * <p>
 * Only {@link StoreConflictException} is retried, with exponential backoff capped at the
 * configured maximum. Engine exceptions and other store failures propagate at once.
 */
public class TransactionRetry {

    private static final Logger log = LoggerFactory.getLogger(TransactionRetry.class);

    /**
     * Waits between attempts. Replaced in tests to avoid real sleeps.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final RetrySettings settings;
    private final Sleeper sleeper;

    public TransactionRetry(RetrySettings settings) {
        this(settings, Thread::sleep);
    }

    public TransactionRetry(RetrySettings settings, Sleeper sleeper) {
        this.settings = settings;
        this.sleeper = sleeper;
    }

    /**
     * Runs the action until it succeeds, fails with a non-conflict error, or attempts run out.
     *
     * @param operation label for logs
     * @param action    the transaction to run
     * @param <T>       result type
     * @return the action's result
     * @throws StoreConflictException the last conflict once all attempts are used
     */
    public <T> T run(String operation, Supplier<T> action) {
        long backoff = settings.initialBackoff().toMillis();
        final long maxBackoff = settings.maxBackoff().toMillis();
        int attempt = 1;
        while (true) {
            try {
                return action.get();
            } catch (StoreConflictException e) {
                if (attempt >= settings.maxAttempts()) {
                    log.warn("{} failed after {} attempt(s): {}", operation, attempt, e.getMessage());
                    throw e;
                }
                log.debug("{} conflicted (attempt {}/{}): {}, retrying in {}ms",
                        operation, attempt, settings.maxAttempts(), e.getMessage(), backoff);
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.debug("Interrupted during retry backoff, aborting {}", operation);
                    throw new StoreException("Interrupted while retrying " + operation, ie);
                }
                backoff = Math.min(backoff * 2, maxBackoff);
                attempt++;
            }
        }
    }
}
