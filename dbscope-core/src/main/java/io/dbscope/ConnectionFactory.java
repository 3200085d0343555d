package io.dbscope;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Driver;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Opens {@link DbConnection}s from connection descriptors.
 *
 * <p>The raw handle comes from the descriptor's data source when it is pooled, otherwise
 * from a {@link Driver} instantiated from the descriptor's {@code driver-class} or from
 * the {@link DriverRegistry} entry for its subprotocol. Drivers are instantiated directly
 * and never registered with {@link java.sql.DriverManager}.
 *
 * <p>After opening, the factory applies the {@code read-only} extra and the isolation level
 * ({@link IsolationLevel#NONE} leaves the vendor default untouched).
 *
 * <pre>{@code
 * ConnectionFactory factory = new ConnectionFactory();
 * try (DbConnection conn = factory.open("h2:mem:app;DB_CLOSE_DELAY=-1")) {
 *     SqlExecutor.execute(conn, "CREATE TABLE users (id INT PRIMARY KEY)");
 * }
 * }</pre>
 */
public final class ConnectionFactory {
    private static final Logger logger = Logger.getLogger(ConnectionFactory.class.getName());

    private static final Set<String> RESERVED_EXTRAS = Set.of(DbSpec.READ_ONLY, DbSpec.QUERY_TIMEOUT, DbSpec.POOL);

    private final DriverRegistry drivers;
    private final Map<String, Driver> loadedDrivers = new ConcurrentHashMap<>();

    public ConnectionFactory() {
        this(DriverRegistry.defaults());
    }

    public ConnectionFactory(DriverRegistry drivers) {
        this.drivers = Objects.requireNonNull(drivers, "drivers");
    }

    /**
     * Normalizes {@code descriptor} and opens a connection for it.
     *
     * @param descriptor any shape accepted by {@link DbSpecs#normalize(Object)}
     * @return an open connection, outside any transaction
     * @throws MalformedDescriptorException if the descriptor is malformed
     * @throws UnknownDriverException       if no driver can be resolved
     * @throws ConnectionException          if the driver or data source fails
     */
    public DbConnection open(Object descriptor) {
        DbSpec spec = DbSpecs.normalize(descriptor);
        int queryTimeout = queryTimeout(spec);
        Connection raw = spec.isPooled() ? openFromDataSource(spec) : openFromDriver(spec);
        try {
            configure(raw, spec);
            String vendor = vendor(raw, spec);
            logger.log(Level.FINE, "Opened {0} connection{1}",
                    new Object[]{vendor, spec.isPooled() ? " from pool" : ""});
            return new DbConnection(raw, vendor, queryTimeout);
        } catch (SQLException e) {
            ConnectionException failure = new ConnectionException("Failed to configure connection for " + spec, e);
            closeAfter(raw, failure);
            throw failure;
        } catch (RuntimeException e) {
            closeAfter(raw, e);
            throw e;
        }
    }

    /**
     * Opens a connection, runs {@code body} with it and closes it on every exit path.
     *
     * @see Resources#withScoped(Resources.Acquirer, Resources.ScopedBody)
     */
    public <T, E extends Exception> T withConnection(Object descriptor,
            Resources.ScopedBody<? super DbConnection, T, E> body) throws E {
        return Resources.withScoped(() -> open(descriptor), body);
    }

    private Connection openFromDataSource(DbSpec spec) {
        Connection raw;
        try {
            raw = spec.dataSource().getConnection();
        } catch (SQLException e) {
            throw new ConnectionException("Failed to obtain connection from data source for " + spec, e);
        }
        if (raw == null) {
            throw new ConnectionException("Data source returned no connection for " + spec);
        }
        return raw;
    }

    private Connection openFromDriver(DbSpec spec) {
        String url = DbSpecs.toJdbcUrl(spec);
        String driverClass = drivers.resolve(spec);
        Driver driver = loadedDrivers.computeIfAbsent(driverClass, ConnectionFactory::instantiate);
        Connection raw;
        try {
            raw = driver.connect(url, driverProperties(spec));
        } catch (SQLException e) {
            throw new ConnectionException("Failed to open connection to " + url, e);
        }
        if (raw == null) {
            throw new ConnectionException("Driver " + driverClass + " does not accept URL " + url);
        }
        return raw;
    }

    private static void configure(Connection raw, DbSpec spec) throws SQLException {
        if (Boolean.parseBoolean(spec.extra(DbSpec.READ_ONLY))) {
            raw.setReadOnly(true);
        }
        IsolationLevel level = spec.isolationLevel();
        if (level != IsolationLevel.NONE) {
            raw.setTransactionIsolation(level.jdbcLevel());
        }
    }

    private static String vendor(Connection raw, DbSpec spec) throws SQLException {
        if (spec.subprotocol() != null) {
            return spec.subprotocol();
        }
        DatabaseMetaData meta = raw.getMetaData();
        String product = meta == null ? null : meta.getDatabaseProductName();
        return product == null ? "unknown" : product.toLowerCase(Locale.ROOT);
    }

    private static Properties driverProperties(DbSpec spec) {
        Properties props = new Properties();
        if (spec.user() != null) props.setProperty(DbSpec.USER, spec.user());
        if (spec.password() != null) props.setProperty(DbSpec.PASSWORD, spec.password());
        for (Map.Entry<String, String> extra : spec.extras().entrySet()) {
            if (!RESERVED_EXTRAS.contains(extra.getKey())) {
                props.setProperty(extra.getKey(), extra.getValue());
            }
        }
        return props;
    }

    private static int queryTimeout(DbSpec spec) {
        String value = spec.extra(DbSpec.QUERY_TIMEOUT);
        if (value == null) {
            return 0;
        }
        try {
            int seconds = Integer.parseInt(value.trim());
            if (seconds < 0) {
                throw new MalformedDescriptorException("Descriptor field '" + DbSpec.QUERY_TIMEOUT +
                        "' must not be negative: " + value);
            }
            return seconds;
        } catch (NumberFormatException e) {
            throw new MalformedDescriptorException("Descriptor field '" + DbSpec.QUERY_TIMEOUT +
                    "' must be a number of seconds: " + value, e);
        }
    }

    private static Driver instantiate(String driverClass) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = ConnectionFactory.class.getClassLoader();
        }
        Class<?> type;
        try {
            type = Class.forName(driverClass, true, loader);
        } catch (ClassNotFoundException e) {
            throw new UnknownDriverException("Driver class not found: " + driverClass, e);
        }
        if (!Driver.class.isAssignableFrom(type)) {
            throw new UnknownDriverException("Not a java.sql.Driver: " + driverClass);
        }
        try {
            return (Driver) type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new UnknownDriverException("Cannot instantiate driver: " + driverClass, e);
        }
    }

    private static void closeAfter(Connection raw, Throwable primary) {
        try {
            raw.close();
        } catch (SQLException e) {
            primary.addSuppressed(e);
        }
    }
}
