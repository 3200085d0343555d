package io.dbscope;

/**
 * Work executed inside a transaction scope.
 *
 * @param <T> result type
 * @param <E> checked exception the body may throw; it reaches the caller unchanged
 * @see TransactionManager#runInTransaction(DbConnection, TransactionBody)
 */
@FunctionalInterface
public interface TransactionBody<T, E extends Exception> {
    T execute(DbConnection connection) throws E;
}
