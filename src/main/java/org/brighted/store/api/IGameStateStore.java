package org.brighted.store.api;

/**
 * Persistence boundary of the practicals engine.
 * <p>
 * Every request runs its reads and writes through one {@link #inTransaction} call. The
 * work either commits as a whole or, when it throws, leaves no trace. Implementations
 * serialize concurrent transactions touching the same session or user, so a read inside
 * the work is stable until the work returns.
 */
public interface IGameStateStore extends IMonitorable, AutoCloseable {

    /**
     * Runs the given work in a single transaction.
     *
     * @param work the transactional unit
     * @param <T>  result type
     * @return the work's result after a successful commit
     * @throws StoreConflictException if the transaction lost a race and may be retried
     * @throws StoreException         on any other persistence failure
     * @throws RuntimeException       anything thrown by the work itself, after rollback
     */
    <T> T inTransaction(TransactionWork<T> work);

    /**
     * Returns the configured name of this store instance.
     */
    String getStoreName();

    @Override
    void close();
}
