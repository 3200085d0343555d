package io.dbscope;

/**
 * Unchecked exception wrapping JDBC errors thrown while executing a statement.
 */
public final class StatementException extends DbScopeException {

    public StatementException(String message, Throwable cause) {
        super(message, cause);
    }
}
