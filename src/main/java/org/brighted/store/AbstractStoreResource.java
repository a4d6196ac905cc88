package org.brighted.store;

import com.typesafe.config.Config;
import org.brighted.store.api.IGameStateStore;
import org.brighted.store.api.OperationalError;
import org.brighted.store.api.StoreConflictException;
import org.brighted.store.api.TransactionWork;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base class for {@link IGameStateStore} implementations, providing name and options
 * handling, transaction counters and a bounded operational-error log.
 * <p>
 * <strong>Error handling for stores:</strong>
 * <ul>
 *   <li>Transient errors the store survives (a failed rollback, a lost lock race):
 *       {@code log.warn(...)} without the exception and {@link #recordError}.</li>
 *   <li>Fatal errors (pool or schema cannot be initialized): {@code log.error(...)} and throw.</li>
 *   <li>Retries belong to the caller; a lost race surfaces as {@link StoreConflictException}.</li>
 * </ul>
 */
public abstract class AbstractStoreResource implements IGameStateStore {

    protected final String storeName;
    protected final Config options;

    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    protected final AtomicLong transactionsCommitted = new AtomicLong(0);
    protected final AtomicLong transactionsRolledBack = new AtomicLong(0);
    protected final AtomicLong conflicts = new AtomicLong(0);

    /**
     * @param name    store instance name, used in logs and metrics
     * @param options store options from {@code brighted.store.options}
     */
    protected AbstractStoreResource(String name, Config options) {
        this.storeName = Objects.requireNonNull(name, "Store name cannot be null");
        this.options = Objects.requireNonNull(options, "Store options cannot be null");
    }

    /**
     * Maximum number of errors kept in memory; the oldest are dropped first.
     */
    protected int getMaxErrors() {
        return 1000;
    }

    @Override
    public String getStoreName() {
        return storeName;
    }

    public Config getOptions() {
        return options;
    }

    @Override
    public final <T> T inTransaction(TransactionWork<T> work) {
        Objects.requireNonNull(work, "work");
        try {
            T result = doInTransaction(work);
            transactionsCommitted.incrementAndGet();
            return result;
        } catch (StoreConflictException e) {
            conflicts.incrementAndGet();
            transactionsRolledBack.incrementAndGet();
            throw e;
        } catch (RuntimeException e) {
            transactionsRolledBack.incrementAndGet();
            throw e;
        }
    }

    /**
     * Runs the work, commits on normal return and rolls back when it throws.
     * Implementations translate driver failures into store exceptions.
     */
    protected abstract <T> T doInTransaction(TransactionWork<T> work);

    /**
     * Records a transient error. Use only for errors the store keeps working after.
     *
     * @param code    category, e.g. {@code "ROLLBACK_FAILED"}
     * @param message human-readable message
     * @param details additional context
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    @Override
    public boolean isHealthy() {
        return errors.isEmpty();
    }

    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        metrics.put("transactions_committed", transactionsCommitted.get());
        metrics.put("transactions_rolled_back", transactionsRolledBack.get());
        metrics.put("conflicts", conflicts.get());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook for store-specific metrics. Overrides should call {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics mutable map already holding the base metrics
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }
}
