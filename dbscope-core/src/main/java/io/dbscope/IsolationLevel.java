package io.dbscope;

import java.sql.Connection;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Transaction isolation levels accepted in descriptors and transaction options.
 *
 * <p>{@link #NONE} leaves the vendor default untouched.
 */
public enum IsolationLevel {
    NONE("none", Connection.TRANSACTION_NONE),
    READ_UNCOMMITTED("read-uncommitted", Connection.TRANSACTION_READ_UNCOMMITTED),
    READ_COMMITTED("read-committed", Connection.TRANSACTION_READ_COMMITTED),
    REPEATABLE_READ("repeatable-read", Connection.TRANSACTION_REPEATABLE_READ),
    SERIALIZABLE("serializable", Connection.TRANSACTION_SERIALIZABLE);

    private final String key;
    private final int jdbcLevel;

    IsolationLevel(String key, int jdbcLevel) {
        this.key = key;
        this.jdbcLevel = jdbcLevel;
    }

    /**
     * Descriptor key, e.g. {@code "read-committed"}.
     */
    public String key() {
        return key;
    }

    /**
     * The matching {@code Connection.TRANSACTION_*} constant.
     */
    public int jdbcLevel() {
        return jdbcLevel;
    }

    /**
     * Parses a descriptor key. Underscores and case are tolerated
     * ({@code "READ_COMMITTED"} parses like {@code "read-committed"}).
     *
     * @throws MalformedDescriptorException if the key names no level
     */
    public static IsolationLevel fromKey(String key) {
        Objects.requireNonNull(key, "key");
        String normalized = key.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (IsolationLevel level : values()) {
            if (level.key.equals(normalized)) {
                return level;
            }
        }
        throw new MalformedDescriptorException("Unknown isolation level: " + key +
                ". Available: " + Arrays.stream(values()).map(IsolationLevel::key).collect(Collectors.joining(", ")));
    }
}
