package org.brighted.store.api;

/**
 * Unit of work executed by {@link IGameStateStore#inTransaction(TransactionWork)}.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface TransactionWork<T> {

    T execute(IStoreTransaction tx);
}
