package io.dbscope;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Savepoint;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs code in possibly nested transaction scopes on a {@link DbConnection}.
 *
 * <p>The outermost scope begins a real transaction (auto-commit off) and decides its
 * outcome: commit on normal completion, rollback on error or when the connection has been
 * marked rollback-only. Nested scopes run inside a savepoint: it is released on normal
 * completion, and on error the scope rolls back to it, marks the connection rollback-only
 * and rethrows. A failure anywhere therefore aborts the whole outer unit of work, even if
 * an enclosing body catches the error.
 *
 * <p>Nesting depth is not stored: a scope is outermost iff the connection was not in a
 * transaction when the scope was entered. Savepoint names are unique within one outer
 * transaction.
 *
 * <p>The manager holds no per-connection state and may be shared.
 *
 * <pre>{@code
 * TransactionManager tx = new TransactionManager();
 * tx.runInTransaction(conn, c -> {
 *     SqlExecutor.update(c, "INSERT INTO accounts (id, balance) VALUES (?, ?)", 1, 100);
 *     tx.runInTransaction(c, inner -> SqlExecutor.update(inner, "UPDATE accounts SET balance = 0"));
 *     return null;
 * });
 * }</pre>
 */
public final class TransactionManager {
    private static final Logger logger = Logger.getLogger(TransactionManager.class.getName());

    private final TransactionOptions defaults;

    public TransactionManager() {
        this(TransactionOptions.DEFAULTS);
    }

    /**
     * @param defaults options used by {@link #runInTransaction(DbConnection, TransactionBody)}
     */
    public TransactionManager(TransactionOptions defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    /**
     * Runs {@code body} in a transaction scope with this manager's default options.
     *
     * @see #runInTransaction(DbConnection, TransactionOptions, TransactionBody)
     */
    public <T, E extends Exception> T runInTransaction(DbConnection connection, TransactionBody<T, E> body)
            throws E {
        return runInTransaction(connection, defaults, body);
    }

    /**
     * Runs {@code body} in a transaction scope.
     *
     * <p>Errors thrown by {@code body} reach the caller unchanged, after the rollback
     * (to the savepoint when nested, of the whole transaction when outermost). Failures of
     * that rollback are attached as suppressed exceptions.
     *
     * @param options applied when this scope is outermost, ignored otherwise
     * @return the body's result
     * @throws TransactionException  if the driver fails to begin, savepoint or commit
     * @throws IllegalStateException if the connection is closed
     */
    public <T, E extends Exception> T runInTransaction(DbConnection connection, TransactionOptions options,
            TransactionBody<T, E> body) throws E {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(body, "body");
        connection.ensureOpen();
        if (connection.isInTransaction()) {
            if (!options.isDefault()) {
                logger.log(Level.FINE, "Ignoring {0} in nested transaction scope", options);
            }
            return runNested(connection, body);
        }
        return runOutermost(connection, options, body);
    }

    /**
     * Forces the enclosing outermost scope to roll back even if every body completes normally.
     *
     * @throws NoActiveTransactionException if the connection is not in a transaction
     */
    public void markRollbackOnly(DbConnection connection) {
        requireActive(connection, "mark rollback-only");
        connection.setRollbackOnly(true);
    }

    /**
     * Clears the rollback-only mark, letting the outermost scope commit again.
     *
     * @throws NoActiveTransactionException if the connection is not in a transaction
     */
    public void unmarkRollbackOnly(DbConnection connection) {
        requireActive(connection, "unmark rollback-only");
        connection.setRollbackOnly(false);
    }

    public boolean isRollbackOnly(DbConnection connection) {
        Objects.requireNonNull(connection, "connection");
        return connection.isRollbackOnly();
    }

    private <T, E extends Exception> T runOutermost(DbConnection connection, TransactionOptions options,
            TransactionBody<T, E> body) throws E {
        Connection raw = connection.raw();
        SessionState previous = begin(raw, options);
        connection.beginTransaction();
        T result;
        try {
            result = body.execute(connection);
        } catch (Throwable t) {
            rollbackAfter(raw, t);
            logger.log(Level.FINE, "Rolled back {0} transaction after error", connection.vendor());
            finish(connection, raw, previous, t);
            throw t;
        }
        try {
            complete(connection, raw);
        } catch (TransactionException e) {
            finish(connection, raw, previous, e);
            throw e;
        }
        finish(connection, raw, previous, null);
        return result;
    }

    private <T, E extends Exception> T runNested(DbConnection connection, TransactionBody<T, E> body) throws E {
        Connection raw = connection.raw();
        String name = connection.nextSavepointName();
        Savepoint savepoint;
        try {
            savepoint = raw.setSavepoint(name);
        } catch (SQLException e) {
            connection.setRollbackOnly(true);
            throw new TransactionException("Failed to create savepoint " + name, e);
        }
        T result;
        try {
            result = body.execute(connection);
        } catch (Throwable t) {
            try {
                raw.rollback(savepoint);
            } catch (SQLException e) {
                t.addSuppressed(e);
            }
            connection.setRollbackOnly(true);
            logger.log(Level.FINE, "Rolled back to savepoint {0}, transaction is now rollback-only", name);
            throw t;
        }
        try {
            raw.releaseSavepoint(savepoint);
        } catch (SQLFeatureNotSupportedException e) {
            logger.log(Level.FINE, "Driver cannot release savepoint " + name + ", left to the outer transaction", e);
        } catch (SQLException e) {
            connection.setRollbackOnly(true);
            throw new TransactionException("Failed to release savepoint " + name, e);
        }
        return result;
    }

    private static SessionState begin(Connection raw, TransactionOptions options) {
        SessionState previous = new SessionState();
        try {
            IsolationLevel isolation = options.isolationLevel();
            if (isolation != IsolationLevel.NONE) {
                int current = raw.getTransactionIsolation();
                if (current != isolation.jdbcLevel()) {
                    raw.setTransactionIsolation(isolation.jdbcLevel());
                    previous.isolation = current;
                }
            }
            if (options.isReadOnly() && !raw.isReadOnly()) {
                raw.setReadOnly(true);
                previous.readOnly = false;
            }
            if (raw.getAutoCommit()) {
                raw.setAutoCommit(false);
                previous.autoCommit = true;
            }
        } catch (SQLException e) {
            TransactionException failure = new TransactionException("Failed to begin transaction", e);
            try {
                previous.restore(raw);
            } catch (SQLException restoreFailure) {
                failure.addSuppressed(restoreFailure);
            }
            throw failure;
        }
        return previous;
    }

    private static void complete(DbConnection connection, Connection raw) {
        if (connection.isRollbackOnly()) {
            try {
                raw.rollback();
            } catch (SQLException e) {
                throw new TransactionException("Failed to roll back rollback-only transaction", e);
            }
            logger.log(Level.FINE, "Rolled back rollback-only {0} transaction", connection.vendor());
            return;
        }
        try {
            raw.commit();
        } catch (SQLException e) {
            TransactionException failure = new TransactionException("Failed to commit transaction", e);
            rollbackAfter(raw, failure);
            throw failure;
        }
        logger.log(Level.FINE, "Committed {0} transaction", connection.vendor());
    }

    private static void finish(DbConnection connection, Connection raw, SessionState previous, Throwable primary) {
        connection.endTransaction();
        if (connection.isClosed()) {
            return;
        }
        try {
            previous.restore(raw);
        } catch (SQLException e) {
            if (primary != null) {
                primary.addSuppressed(e);
            } else {
                throw new TransactionException("Failed to restore connection settings after transaction", e);
            }
        }
    }

    private static void rollbackAfter(Connection raw, Throwable primary) {
        try {
            raw.rollback();
        } catch (SQLException e) {
            primary.addSuppressed(e);
        }
    }

    private static void requireActive(DbConnection connection, String operation) {
        Objects.requireNonNull(connection, "connection");
        if (!connection.isInTransaction()) {
            throw new NoActiveTransactionException("Cannot " + operation + ": no active transaction on " + connection);
        }
    }

    /**
     * Connection settings changed by {@link #begin}; {@code null} fields were left untouched.
     */
    private static final class SessionState {
        private Boolean autoCommit;
        private Integer isolation;
        private Boolean readOnly;

        void restore(Connection raw) throws SQLException {
            SQLException failure = null;
            if (autoCommit != null) {
                try {
                    raw.setAutoCommit(autoCommit);
                } catch (SQLException e) {
                    failure = e;
                }
            }
            if (isolation != null) {
                try {
                    raw.setTransactionIsolation(isolation);
                } catch (SQLException e) {
                    if (failure == null) failure = e; else failure.addSuppressed(e);
                }
            }
            if (readOnly != null) {
                try {
                    raw.setReadOnly(readOnly);
                } catch (SQLException e) {
                    if (failure == null) failure = e; else failure.addSuppressed(e);
                }
            }
            if (failure != null) {
                throw failure;
            }
        }
    }
}
