package io.dbscope;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An open database session wrapping an exclusively owned JDBC connection.
 *
 * <p>Created by {@link ConnectionFactory}. The transaction flags are changed only by
 * {@link TransactionManager}; statements run through {@link SqlExecutor}. Neither the
 * raw handle nor the flag mutators are visible outside this package.
 *
 * <p>{@link #close()} is idempotent. The first call closes every lazy {@link QueryResult}
 * still open on this connection, then the raw handle; later calls do nothing.
 *
 * <p>Not thread-safe: one owner at a time.
 */
public final class DbConnection implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(DbConnection.class.getName());

    static final String SAVEPOINT_PREFIX = "dbscope_sp_";

    private final Connection raw;
    private final String vendor;
    private final int queryTimeoutSeconds;
    private final Set<QueryResult<?>> openResults = Collections.newSetFromMap(new IdentityHashMap<>());

    private boolean inTransaction;
    private boolean rollbackOnly;
    private int savepointSequence;
    private boolean closed;

    DbConnection(Connection raw, String vendor, int queryTimeoutSeconds) {
        this.raw = raw;
        this.vendor = vendor;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    /**
     * Vendor tag: the descriptor's subprotocol, or the driver's product name.
     */
    public String vendor() {
        return vendor;
    }

    public boolean isInTransaction() {
        return inTransaction;
    }

    public boolean isRollbackOnly() {
        return rollbackOnly;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Statement timeout in seconds; {@code 0} means none.
     */
    public int queryTimeout() {
        return queryTimeoutSeconds;
    }

    /**
     * Closes open lazy results and the raw connection. Subsequent calls are no-ops.
     *
     * @throws ResourceReleaseException if the raw connection or a result fails to close;
     *                                  the handle is considered released regardless
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        ResourceReleaseException failure = null;
        for (QueryResult<?> result : new ArrayList<>(openResults)) {
            try {
                result.close();
            } catch (ResourceReleaseException e) {
                if (failure == null) failure = e; else failure.addSuppressed(e);
            }
        }
        openResults.clear();
        try {
            raw.close();
        } catch (SQLException e) {
            ResourceReleaseException closeFailure = new ResourceReleaseException("Failed to close connection", e);
            if (failure != null) closeFailure.addSuppressed(failure);
            failure = closeFailure;
        }
        if (failure != null) {
            throw failure;
        }
        logger.log(Level.FINE, "Closed {0} connection", vendor);
    }

    @Override
    public String toString() {
        return "DbConnection{vendor=" + vendor + ", inTransaction=" + inTransaction +
                ", rollbackOnly=" + rollbackOnly + ", closed=" + closed + '}';
    }

    Connection raw() {
        ensureOpen();
        return raw;
    }

    void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Connection is closed");
        }
    }

    void beginTransaction() {
        inTransaction = true;
        rollbackOnly = false;
        savepointSequence = 0;
    }

    void endTransaction() {
        inTransaction = false;
        rollbackOnly = false;
        savepointSequence = 0;
    }

    void setRollbackOnly(boolean rollbackOnly) {
        this.rollbackOnly = rollbackOnly;
    }

    String nextSavepointName() {
        return SAVEPOINT_PREFIX + (++savepointSequence);
    }

    void register(QueryResult<?> result) {
        openResults.add(result);
    }

    void unregister(QueryResult<?> result) {
        openResults.remove(result);
    }

    List<QueryResult<?>> openResults() {
        return List.copyOf(openResults);
    }
}
