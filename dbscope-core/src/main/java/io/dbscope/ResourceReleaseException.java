package io.dbscope;

/**
 * Thrown when closing a connection or query result fails.
 *
 * <p>When a scoped body has already failed, this exception is attached to the body's
 * error as a suppressed exception instead of being thrown.
 *
 * @see Resources#withScoped(Resources.Acquirer, Resources.ScopedBody)
 */
public final class ResourceReleaseException extends DbScopeException {

    public ResourceReleaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
