package io.dbscope;

/**
 * Thrown when no JDBC driver can be resolved for a descriptor, either because the
 * subprotocol is not registered or because the driver class cannot be loaded.
 */
public final class UnknownDriverException extends DbScopeException {

    public UnknownDriverException(String message) {
        super(message);
    }

    public UnknownDriverException(String message, Throwable cause) {
        super(message, cause);
    }
}
