package io.dbscope;

import java.util.Objects;

/**
 * Settings applied to the raw connection for the duration of an outermost transaction and
 * restored afterwards. Ignored by nested scopes.
 */
public final class TransactionOptions {
    /** Keeps the connection's current isolation level and read-only mode. */
    public static final TransactionOptions DEFAULTS = new TransactionOptions(IsolationLevel.NONE, false);

    private final IsolationLevel isolationLevel;
    private final boolean readOnly;

    private TransactionOptions(IsolationLevel isolationLevel, boolean readOnly) {
        this.isolationLevel = isolationLevel;
        this.readOnly = readOnly;
    }

    public static TransactionOptions isolation(IsolationLevel isolationLevel) {
        return DEFAULTS.withIsolationLevel(isolationLevel);
    }

    public static TransactionOptions readOnly() {
        return DEFAULTS.withReadOnly(true);
    }

    /**
     * @param isolationLevel level for the transaction; {@link IsolationLevel#NONE} keeps the current one
     */
    public TransactionOptions withIsolationLevel(IsolationLevel isolationLevel) {
        return new TransactionOptions(Objects.requireNonNull(isolationLevel, "isolationLevel"), readOnly);
    }

    public TransactionOptions withReadOnly(boolean readOnly) {
        return new TransactionOptions(isolationLevel, readOnly);
    }

    public IsolationLevel isolationLevel() {
        return isolationLevel;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    boolean isDefault() {
        return isolationLevel == IsolationLevel.NONE && !readOnly;
    }

    @Override
    public String toString() {
        return "TransactionOptions{isolationLevel=" + isolationLevel.key() + ", readOnly=" + readOnly + '}';
    }
}
