package io.dbscope;

/**
 * Thrown when a transaction-only operation is attempted on a connection that is not
 * inside a transaction scope.
 */
public final class NoActiveTransactionException extends DbScopeException {

    public NoActiveTransactionException(String message) {
        super(message);
    }
}
