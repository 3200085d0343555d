package io.dbscope;

/**
 * Thrown when the driver fails to begin, commit, roll back or savepoint a transaction.
 */
public final class TransactionException extends DbScopeException {

    public TransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
