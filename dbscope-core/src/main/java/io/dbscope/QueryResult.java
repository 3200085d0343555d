package io.dbscope;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Result of a query: the statement and result set that produced it, plus the rows.
 *
 * <p>An <em>eager</em> result holds its rows in {@link #data()}; both handles are already
 * closed when it is returned. A <em>lazy</em> result keeps the handles open and yields rows
 * once through {@link #iterator()} or {@link #stream()}; the handles are closed when the
 * rows are exhausted, when {@link #close()} is called, or when the owning
 * {@link DbConnection} closes, whichever comes first.
 *
 * @param <T> row type
 * @see SqlExecutor#query(DbConnection, String, RowMapper, Object...)
 * @see SqlExecutor#lazyQuery(DbConnection, String, RowMapper, Object...)
 */
public final class QueryResult<T> implements AutoCloseable, Iterable<T> {
    private final DbConnection owner;
    private final Statement statement;
    private final ResultSet resultSet;
    private final RowMapper<T> mapper;
    private final boolean lazy;
    private final List<T> data;
    private boolean iterated;
    private boolean closed;

    private QueryResult(DbConnection owner, Statement statement, ResultSet resultSet,
            RowMapper<T> mapper, boolean lazy, List<T> data) {
        this.owner = owner;
        this.statement = statement;
        this.resultSet = resultSet;
        this.mapper = mapper;
        this.lazy = lazy;
        this.data = data;
    }

    /**
     * Reads every row, then closes the result set and statement.
     */
    static <T> QueryResult<T> materialize(Statement statement, ResultSet resultSet, RowMapper<T> mapper)
            throws SQLException {
        List<T> rows = new ArrayList<>();
        QueryResult<T> result = new QueryResult<>(null, statement, resultSet, mapper, false,
                Collections.unmodifiableList(rows));
        try {
            while (resultSet.next()) {
                rows.add(mapper.map(resultSet));
            }
        } catch (SQLException | RuntimeException e) {
            result.closeAfter(e);
            throw e;
        }
        result.close();
        return result;
    }

    /**
     * Wraps open handles; rows are read on demand. The result registers with its
     * connection so that closing the connection closes it too.
     */
    static <T> QueryResult<T> lazy(DbConnection owner, Statement statement, ResultSet resultSet,
            RowMapper<T> mapper) {
        QueryResult<T> result = new QueryResult<>(owner, statement, resultSet, mapper, true, null);
        owner.register(result);
        return result;
    }

    public boolean isLazy() {
        return lazy;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Returns the materialized rows.
     *
     * @throws IllegalStateException if this result is lazy
     */
    public List<T> data() {
        if (lazy) {
            throw new IllegalStateException("Lazy query result has no materialized data");
        }
        return data;
    }

    /**
     * Iterates the rows. A lazy result can be iterated once, and only while open.
     *
     * @throws StatementException from {@code hasNext()}/{@code next()} if reading a lazy row fails;
     *                            the result is closed first
     */
    @Override
    public Iterator<T> iterator() {
        if (!lazy) {
            return data.iterator();
        }
        if (closed) {
            throw new IllegalStateException("Query result is closed");
        }
        if (iterated) {
            throw new IllegalStateException("Lazy query result can only be iterated once");
        }
        iterated = true;
        return new RowIterator();
    }

    /**
     * Streams the rows. Closing the stream closes this result.
     */
    public Stream<T> stream() {
        Spliterator<T> spliterator = Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED);
        return StreamSupport.stream(spliterator, false).onClose(this::close);
    }

    /**
     * Closes the result set, then the statement. Subsequent calls are no-ops.
     *
     * @throws ResourceReleaseException if either handle fails to close
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (owner != null) {
            owner.unregister(this);
        }
        SQLException failure = null;
        try {
            resultSet.close();
        } catch (SQLException e) {
            failure = e;
        }
        try {
            statement.close();
        } catch (SQLException e) {
            if (failure == null) failure = e; else failure.addSuppressed(e);
        }
        if (failure != null) {
            throw new ResourceReleaseException("Failed to close query result", failure);
        }
    }

    private void closeAfter(Throwable primary) {
        try {
            close();
        } catch (ResourceReleaseException e) {
            primary.addSuppressed(e);
        }
    }

    private final class RowIterator implements Iterator<T> {
        private boolean fetched;
        private boolean hasRow;

        @Override
        public boolean hasNext() {
            if (fetched) {
                return hasRow;
            }
            if (closed) {
                return false;
            }
            try {
                hasRow = resultSet.next();
            } catch (SQLException e) {
                StatementException failure = new StatementException("Failed to read next row", e);
                closeAfter(failure);
                throw failure;
            }
            fetched = true;
            if (!hasRow) {
                close();
            }
            return hasRow;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            fetched = false;
            try {
                return mapper.map(resultSet);
            } catch (SQLException e) {
                StatementException failure = new StatementException("Failed to map row", e);
                closeAfter(failure);
                throw failure;
            } catch (RuntimeException e) {
                closeAfter(e);
                throw e;
            }
        }
    }
}
