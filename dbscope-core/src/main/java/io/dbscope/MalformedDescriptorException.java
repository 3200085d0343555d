package io.dbscope;

/**
 * Thrown when a connection descriptor has an unsupported shape or cannot be parsed.
 */
public final class MalformedDescriptorException extends DbScopeException {

    public MalformedDescriptorException(String message) {
        super(message);
    }

    public MalformedDescriptorException(String message, Throwable cause) {
        super(message, cause);
    }
}
