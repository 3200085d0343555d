package io.dbscope;

/**
 * Base type of every error raised by dbscope. Unchecked: JDBC {@link java.sql.SQLException}s
 * are wrapped and chained as the cause.
 */
public class DbScopeException extends RuntimeException {

    public DbScopeException(String message) {
        super(message);
    }

    public DbScopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
