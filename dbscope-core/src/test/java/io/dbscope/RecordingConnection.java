package io.dbscope;

import javax.sql.DataSource;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Proxy-backed JDBC connection that records every call made on it and on the statements
 * and savepoints it hands out. Calls can be made to fail with {@link #failOn}.
 */
final class RecordingConnection {
    final List<String> calls = new ArrayList<>();
    final List<String> savepoints = new ArrayList<>();
    final List<Integer> queryTimeouts = new ArrayList<>();

    private final Map<String, SQLException> failures = new HashMap<>();
    private final Connection proxy;
    private boolean autoCommit = true;
    private int isolation = Connection.TRANSACTION_READ_COMMITTED;
    private boolean readOnly;
    private boolean closed;

    RecordingConnection() {
        proxy = proxy(Connection.class, this::onConnection);
    }

    Connection connection() {
        return proxy;
    }

    /**
     * Makes the named call fail. Statement calls are named {@code "Statement.<method>"},
     * result set calls {@code "ResultSet.<method>"}.
     */
    RecordingConnection failOn(String call, SQLException failure) {
        failures.put(call, failure);
        return this;
    }

    DataSource dataSource() {
        return proxy(DataSource.class, (self, method, args) -> {
            if (method.getName().equals("getConnection")) {
                return proxy;
            }
            return defaultValue(self, method, args);
        });
    }

    /**
     * Pooled descriptor handing out this connection.
     */
    DbSpec spec() {
        return DbSpec.builder().subprotocol("mock").dataSource(dataSource()).build();
    }

    int count(String call) {
        int n = 0;
        for (String c : calls) {
            if (c.equals(call)) n++;
        }
        return n;
    }

    boolean autoCommit() {
        return autoCommit;
    }

    int isolation() {
        return isolation;
    }

    private Object onConnection(Object self, Method method, Object[] args) throws Throwable {
        String name = method.getName();
        if (isObjectMethod(name)) {
            return defaultValue(self, method, args);
        }
        record(name);
        switch (name) {
            case "getAutoCommit":
                return autoCommit;
            case "setAutoCommit":
                autoCommit = (Boolean) args[0];
                return null;
            case "getTransactionIsolation":
                return isolation;
            case "setTransactionIsolation":
                isolation = (Integer) args[0];
                return null;
            case "isReadOnly":
                return readOnly;
            case "setReadOnly":
                readOnly = (Boolean) args[0];
                return null;
            case "isClosed":
                return closed;
            case "close":
                closed = true;
                return null;
            case "setSavepoint":
                String savepointName = args == null ? "unnamed" : (String) args[0];
                savepoints.add(savepointName);
                return proxy(Savepoint.class, (sp, m, a) ->
                        m.getName().equals("getSavepointName") ? savepointName : defaultValue(sp, m, a));
            case "createStatement":
                return proxy(Statement.class, this::onStatement);
            case "prepareStatement":
                return proxy(PreparedStatement.class, this::onStatement);
            default:
                return defaultValue(self, method, args);
        }
    }

    private Object onStatement(Object self, Method method, Object[] args) throws Throwable {
        String name = method.getName();
        if (isObjectMethod(name)) {
            return defaultValue(self, method, args);
        }
        record("Statement." + name);
        switch (name) {
            case "setQueryTimeout":
                queryTimeouts.add((Integer) args[0]);
                return null;
            case "executeUpdate":
            case "getUpdateCount":
                return 1;
            case "executeBatch":
                return new int[]{1};
            case "executeQuery":
                return proxy(ResultSet.class, (rs, m, a) -> {
                    if (isObjectMethod(m.getName())) {
                        return defaultValue(rs, m, a);
                    }
                    record("ResultSet." + m.getName());
                    return defaultValue(rs, m, a);
                });
            default:
                return defaultValue(self, method, args);
        }
    }

    private void record(String call) throws SQLException {
        calls.add(call);
        SQLException failure = failures.get(call);
        if (failure != null) {
            throw failure;
        }
    }

    private static boolean isObjectMethod(String name) {
        return name.equals("hashCode") || name.equals("equals") || name.equals("toString");
    }

    private static Object defaultValue(Object self, Method method, Object[] args) {
        switch (method.getName()) {
            case "hashCode":
                return System.identityHashCode(self);
            case "equals":
                return self == args[0];
            case "toString":
                return "Recording" + method.getDeclaringClass().getSimpleName();
            default:
                break;
        }
        Class<?> type = method.getReturnType();
        if (type == boolean.class) return false;
        if (type == int.class) return 0;
        if (type == long.class) return 0L;
        return null;
    }

    private static <T> T proxy(Class<T> type, InvocationHandler handler) {
        return type.cast(Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[]{type}, handler));
    }
}
