package io.dbscope.hikari;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.dbscope.ConnectionException;
import io.dbscope.DbSpec;
import io.dbscope.DbSpecs;
import io.dbscope.MalformedDescriptorException;
import io.dbscope.spi.PoolAdapter;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link PoolAdapter} backed by HikariCP.
 *
 * <p>Pool settings are read from the descriptor's extras:
 * <ul>
 *   <li>{@code max-pool-size}: maximum pool size</li>
 *   <li>{@code min-pool-size}: minimum idle connections</li>
 *   <li>{@code max-connection-lifetime}: max lifetime of a connection, ms</li>
 *   <li>{@code max-connection-idle-lifetime}: idle timeout, ms</li>
 *   <li>{@code connection-timeout}: max wait for a connection from the pool, ms</li>
 *   <li>{@code pool-name}: pool name shown in logs and JMX</li>
 * </ul>
 * Every other extra except {@code read-only} and {@code query-timeout} is passed to the
 * driver as a data source property. The returned descriptor keeps isolation level,
 * {@code read-only} and {@code query-timeout}, which {@link io.dbscope.ConnectionFactory}
 * applies on each open.
 *
 * <p>The caller owns the pool; close it through {@link #close(DbSpec)} or by closing the
 * {@link HikariDataSource} directly.
 */
public final class HikariPoolAdapter implements PoolAdapter {
    private static final Logger logger = Logger.getLogger(HikariPoolAdapter.class.getName());

    public static final String NAME = "hikari";

    public static final String MAX_POOL_SIZE = "max-pool-size";
    public static final String MIN_POOL_SIZE = "min-pool-size";
    public static final String MAX_CONNECTION_LIFETIME = "max-connection-lifetime";
    public static final String MAX_CONNECTION_IDLE_LIFETIME = "max-connection-idle-lifetime";
    public static final String CONNECTION_TIMEOUT = "connection-timeout";
    public static final String POOL_NAME = "pool-name";

    private static final Set<String> POOL_SETTINGS = Set.of(
            DbSpec.POOL, MAX_POOL_SIZE, MIN_POOL_SIZE, MAX_CONNECTION_LIFETIME,
            MAX_CONNECTION_IDLE_LIFETIME, CONNECTION_TIMEOUT, POOL_NAME);

    // applied per connection by ConnectionFactory, not by the driver
    private static final Set<String> CONNECTION_SETTINGS = Set.of(DbSpec.READ_ONLY, DbSpec.QUERY_TIMEOUT);

    @Override
    public String name() {
        return NAME;
    }

    /**
     * Starts a pool for the descriptor. Pooled descriptors are returned unchanged.
     *
     * @throws MalformedDescriptorException if a pool setting is not a valid number
     * @throws ConnectionException          if the pool cannot be started
     */
    @Override
    public DbSpec transform(DbSpec spec) {
        Objects.requireNonNull(spec, "spec");
        if (spec.isPooled()) {
            return spec;
        }
        HikariConfig config;
        try {
            config = toConfig(spec);
        } catch (IllegalArgumentException e) {
            // rejected by a HikariConfig setter
            throw new MalformedDescriptorException("Invalid pool settings for " + spec + ": " + e.getMessage(), e);
        }
        HikariDataSource dataSource;
        try {
            dataSource = new HikariDataSource(config);
        } catch (RuntimeException e) {
            throw new ConnectionException("Failed to start connection pool for " + spec, e);
        }
        logger.log(Level.INFO, "Started pool {0} for {1}",
                new Object[]{dataSource.getPoolName(), spec.subprotocol()});

        DbSpec.Builder pooled = spec.toBuilder().dataSource(dataSource);
        for (String key : spec.extras().keySet()) {
            if (!CONNECTION_SETTINGS.contains(key)) {
                pooled.extra(key, null);
            }
        }
        return pooled.build();
    }

    /**
     * Closes the Hikari pool behind a descriptor returned by {@link #transform(DbSpec)}.
     * Does nothing for descriptors without one.
     */
    public static void close(DbSpec pooled) {
        Objects.requireNonNull(pooled, "pooled");
        if (pooled.dataSource() instanceof HikariDataSource ds && !ds.isClosed()) {
            ds.close();
            logger.log(Level.INFO, "Closed pool {0}", ds.getPoolName());
        }
    }

    static HikariConfig toConfig(DbSpec spec) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(DbSpecs.toJdbcUrl(spec));
        if (spec.driverClass() != null) {
            config.setDriverClassName(spec.driverClass());
        }
        if (spec.user() != null) {
            config.setUsername(spec.user());
        }
        if (spec.password() != null) {
            config.setPassword(spec.password());
        }

        Map<String, String> extras = spec.extras();
        if (extras.containsKey(MAX_POOL_SIZE)) {
            config.setMaximumPoolSize(intSetting(extras, MAX_POOL_SIZE));
        }
        if (extras.containsKey(MIN_POOL_SIZE)) {
            config.setMinimumIdle(intSetting(extras, MIN_POOL_SIZE));
        }
        if (extras.containsKey(MAX_CONNECTION_LIFETIME)) {
            config.setMaxLifetime(longSetting(extras, MAX_CONNECTION_LIFETIME));
        }
        if (extras.containsKey(MAX_CONNECTION_IDLE_LIFETIME)) {
            config.setIdleTimeout(longSetting(extras, MAX_CONNECTION_IDLE_LIFETIME));
        }
        if (extras.containsKey(CONNECTION_TIMEOUT)) {
            config.setConnectionTimeout(longSetting(extras, CONNECTION_TIMEOUT));
        }
        if (extras.containsKey(POOL_NAME)) {
            config.setPoolName(extras.get(POOL_NAME));
        }
        for (Map.Entry<String, String> extra : extras.entrySet()) {
            if (!POOL_SETTINGS.contains(extra.getKey()) && !CONNECTION_SETTINGS.contains(extra.getKey())) {
                config.addDataSourceProperty(extra.getKey(), extra.getValue());
            }
        }
        return config;
    }

    private static int intSetting(Map<String, String> extras, String key) {
        long value = longSetting(extras, key);
        if (value > Integer.MAX_VALUE) {
            throw new MalformedDescriptorException("Pool setting '" + key + "' out of range: " + value);
        }
        return (int) value;
    }

    private static long longSetting(Map<String, String> extras, String key) {
        String value = extras.get(key);
        long parsed;
        try {
            parsed = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new MalformedDescriptorException("Pool setting '" + key + "' must be a number, got: " + value, e);
        }
        if (parsed < 0) {
            throw new MalformedDescriptorException("Pool setting '" + key + "' must not be negative: " + value);
        }
        return parsed;
    }
}
