package io.dbscope;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lightweight JDBC helper for running statements on a {@link DbConnection}.
 *
 * <p>Every {@link SQLException} is wrapped in a {@link StatementException} and the
 * statement is closed before the exception leaves. Inside
 * {@link TransactionManager#runInTransaction} such an error triggers the scope's rollback.
 * The connection's query timeout is applied to every statement.
 */
public final class SqlExecutor {

    /** Execute a plain SQL statement, return rows affected (0 for DDL or queries). */
    public static int execute(DbConnection conn, String sql) {
        Objects.requireNonNull(sql, "sql");
        Connection raw = conn.raw();
        try (Statement st = raw.createStatement()) {
            applyTimeout(st, conn);
            st.execute(sql);
            return Math.max(st.getUpdateCount(), 0);
        } catch (SQLException e) {
            throw new StatementException("Failed to execute statement: " + sql, e);
        }
    }

    /** Execute several plain SQL statements as one batch, return rows affected per statement. */
    public static int[] executeBatch(DbConnection conn, String... sqls) {
        Objects.requireNonNull(sqls, "sqls");
        Connection raw = conn.raw();
        try (Statement st = raw.createStatement()) {
            applyTimeout(st, conn);
            for (String sql : sqls) {
                st.addBatch(Objects.requireNonNull(sql, "sql"));
            }
            return st.executeBatch();
        } catch (SQLException e) {
            throw new StatementException("Failed to execute batch of " + sqls.length + " statements", e);
        }
    }

    /**
     * Execute a prepared statement once per parameter group, as one batch.
     *
     * @return rows affected per group; empty if {@code paramGroups} is empty
     */
    public static int[] executePrepared(DbConnection conn, String sql, List<? extends List<?>> paramGroups) {
        Objects.requireNonNull(sql, "sql");
        Objects.requireNonNull(paramGroups, "paramGroups");
        Connection raw = conn.raw();
        if (paramGroups.isEmpty()) {
            return new int[0];
        }
        try (PreparedStatement ps = raw.prepareStatement(sql)) {
            applyTimeout(ps, conn);
            for (List<?> group : paramGroups) {
                bindParams(ps, group.toArray());
                ps.addBatch();
            }
            return ps.executeBatch();
        } catch (SQLException e) {
            throw new StatementException("Failed to execute prepared batch: " + sql, e);
        }
    }

    /** Execute a prepared UPDATE/INSERT/DELETE, return rows affected. */
    public static int update(DbConnection conn, String sql, Object... params) {
        Objects.requireNonNull(sql, "sql");
        Connection raw = conn.raw();
        try (PreparedStatement ps = raw.prepareStatement(sql)) {
            applyTimeout(ps, conn);
            bindParams(ps, params);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StatementException("Failed to execute update: " + sql, e);
        }
    }

    /** Execute SELECT, materialize rows as maps keyed by lower-cased column label. */
    public static QueryResult<Map<String, Object>> query(DbConnection conn, String sql, Object... params) {
        return query(conn, sql, RowMapper.columnMap(), params);
    }

    /** Execute SELECT, materialize mapped rows. The returned result is already closed. */
    public static <T> QueryResult<T> query(DbConnection conn, String sql, RowMapper<T> mapper, Object... params) {
        Objects.requireNonNull(mapper, "mapper");
        PreparedStatement ps = prepareQuery(conn, sql, params);
        try {
            return QueryResult.materialize(ps, ps.executeQuery(), mapper);
        } catch (SQLException e) {
            StatementException failure = new StatementException("Failed to execute query: " + sql, e);
            closeAfter(ps, failure);
            throw failure;
        }
    }

    /**
     * Execute SELECT and return a lazy result holding the open cursor. The caller must
     * close it (or exhaust it); closing the connection closes it too.
     */
    public static <T> QueryResult<T> lazyQuery(DbConnection conn, String sql, RowMapper<T> mapper, Object... params) {
        Objects.requireNonNull(mapper, "mapper");
        PreparedStatement ps = prepareQuery(conn, sql, params);
        ResultSet rs;
        try {
            rs = ps.executeQuery();
        } catch (SQLException e) {
            StatementException failure = new StatementException("Failed to execute query: " + sql, e);
            closeAfter(ps, failure);
            throw failure;
        }
        return QueryResult.lazy(conn, ps, rs, mapper);
    }

    /** Execute SELECT lazily, hand the open result to {@code body}, close it afterwards. */
    public static <T, R, E extends Exception> R withQuery(DbConnection conn, String sql, RowMapper<T> mapper,
            Resources.ScopedBody<? super QueryResult<T>, R, E> body, Object... params) throws E {
        return Resources.withScoped(() -> lazyQuery(conn, sql, mapper, params), body);
    }

    private static PreparedStatement prepareQuery(DbConnection conn, String sql, Object... params) {
        Objects.requireNonNull(sql, "sql");
        Connection raw = conn.raw();
        PreparedStatement ps;
        try {
            ps = raw.prepareStatement(sql);
        } catch (SQLException e) {
            throw new StatementException("Failed to prepare query: " + sql, e);
        }
        try {
            applyTimeout(ps, conn);
            bindParams(ps, params);
        } catch (SQLException e) {
            StatementException failure = new StatementException("Failed to bind query parameters: " + sql, e);
            closeAfter(ps, failure);
            throw failure;
        }
        return ps;
    }

    private static void applyTimeout(Statement st, DbConnection conn) throws SQLException {
        if (conn.queryTimeout() > 0) {
            st.setQueryTimeout(conn.queryTimeout());
        }
    }

    private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
        if (params == null) {
            return;
        }
        for (int i = 0; i < params.length; i++) {
            Object param = params[i];
            if (param == null) {
                ps.setObject(i + 1, null);
            } else if (param instanceof String s) {
                ps.setString(i + 1, s);
            } else if (param instanceof Integer n) {
                ps.setInt(i + 1, n);
            } else if (param instanceof Long n) {
                ps.setLong(i + 1, n);
            } else if (param instanceof Timestamp ts) {
                ps.setTimestamp(i + 1, ts);
            } else {
                ps.setObject(i + 1, param);
            }
        }
    }

    private static void closeAfter(Statement st, Throwable primary) {
        try {
            st.close();
        } catch (SQLException e) {
            primary.addSuppressed(e);
        }
    }

    private SqlExecutor() {}
}
