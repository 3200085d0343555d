package io.dbscope;

/**
 * Thrown when a raw connection cannot be opened or configured.
 */
public final class ConnectionException extends DbScopeException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
