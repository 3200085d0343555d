package io.dbscope;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable mapping from JDBC subprotocol to driver class name.
 *
 * <p>{@link #defaults()} knows the common open-source and commercial drivers. Derive an
 * extended registry with {@link #with(String, String)}; the receiver is never modified.
 *
 * <pre>{@code
 * DriverRegistry registry = DriverRegistry.defaults()
 *     .with("tidb", "com.mysql.cj.jdbc.Driver");
 * ConnectionFactory factory = new ConnectionFactory(registry);
 * }</pre>
 */
public final class DriverRegistry {

    private static final DriverRegistry DEFAULTS = new DriverRegistry(Map.ofEntries(
            Map.entry("h2", "org.h2.Driver"),
            Map.entry("postgresql", "org.postgresql.Driver"),
            Map.entry("pgsql", "org.postgresql.Driver"),
            Map.entry("mysql", "com.mysql.cj.jdbc.Driver"),
            Map.entry("mariadb", "org.mariadb.jdbc.Driver"),
            Map.entry("sqlite", "org.sqlite.JDBC"),
            Map.entry("hsqldb", "org.hsqldb.jdbc.JDBCDriver"),
            Map.entry("derby", "org.apache.derby.jdbc.EmbeddedDriver"),
            Map.entry("oracle", "oracle.jdbc.OracleDriver"),
            Map.entry("sqlserver", "com.microsoft.sqlserver.jdbc.SQLServerDriver")));

    private final Map<String, String> drivers;

    private DriverRegistry(Map<String, String> drivers) {
        this.drivers = Map.copyOf(drivers);
    }

    /**
     * Returns the built-in registry.
     */
    public static DriverRegistry defaults() {
        return DEFAULTS;
    }

    /**
     * Returns an empty registry; only descriptors with an explicit driver class resolve.
     */
    public static DriverRegistry empty() {
        return new DriverRegistry(Map.of());
    }

    /**
     * Returns a copy of this registry with one mapping added or replaced.
     *
     * @param subprotocol subprotocol (case-insensitive)
     * @param driverClass fully qualified {@link java.sql.Driver} implementation
     */
    public DriverRegistry with(String subprotocol, String driverClass) {
        Objects.requireNonNull(subprotocol, "subprotocol");
        Objects.requireNonNull(driverClass, "driverClass");
        Map<String, String> copy = new LinkedHashMap<>(drivers);
        copy.put(subprotocol.toLowerCase(Locale.ROOT), driverClass);
        return new DriverRegistry(copy);
    }

    /**
     * Looks up the driver class for a subprotocol.
     */
    public Optional<String> lookup(String subprotocol) {
        if (subprotocol == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(drivers.get(subprotocol.toLowerCase(Locale.ROOT)));
    }

    /**
     * Resolves the driver class for a descriptor: its explicit {@code driver-class} if set,
     * otherwise the registered mapping for its subprotocol.
     *
     * @throws UnknownDriverException if neither is available
     */
    public String resolve(DbSpec spec) {
        Objects.requireNonNull(spec, "spec");
        if (spec.driverClass() != null) {
            return spec.driverClass();
        }
        return lookup(spec.subprotocol()).orElseThrow(() -> new UnknownDriverException(
                "No driver registered for subprotocol: " + spec.subprotocol() +
                        ". Available: " + drivers.keySet()));
    }
}
