package io.dbscope;

import javax.sql.DataSource;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical connection descriptor.
 *
 * <p>Every accepted descriptor shape (structured map, URI string, {@link java.net.URI})
 * normalizes to one of these via {@link DbSpecs#normalize(Object)}. Instances are
 * immutable; use {@link #builder()} or {@link #toBuilder()} to derive new ones.
 *
 * <p>A descriptor carrying a {@link #dataSource()} is a <em>pooled</em> descriptor, as
 * produced by a {@link io.dbscope.spi.PoolAdapter}. Connections are then taken from the
 * data source instead of a driver.
 */
public final class DbSpec {
    public static final String DRIVER_CLASS = "driver-class";
    public static final String SUBPROTOCOL = "subprotocol";
    public static final String SUBNAME = "subname";
    public static final String USER = "user";
    public static final String PASSWORD = "password";
    public static final String ISOLATION_LEVEL = "isolation-level";

    /** Extra: open the connection read-only ({@code "true"}/{@code "false"}). */
    public static final String READ_ONLY = "read-only";
    /** Extra: statement timeout in seconds applied to every statement. */
    public static final String QUERY_TIMEOUT = "query-timeout";
    /** Extra: name of the {@link io.dbscope.spi.PoolAdapter} to apply. */
    public static final String POOL = "pool";

    private final String driverClass;
    private final String subprotocol;
    private final String subname;
    private final String user;
    private final String password;
    private final IsolationLevel isolationLevel;
    private final Map<String, String> extras;
    private final DataSource dataSource;

    private DbSpec(Builder builder) {
        this.driverClass = builder.driverClass;
        this.subprotocol = builder.subprotocol;
        this.subname = builder.subname;
        this.user = builder.user;
        this.password = builder.password;
        this.isolationLevel = builder.isolationLevel;
        this.extras = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extras));
        this.dataSource = builder.dataSource;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with every field of this descriptor.
     */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .driverClass(driverClass)
                .subprotocol(subprotocol)
                .subname(subname)
                .user(user)
                .password(password)
                .isolationLevel(isolationLevel)
                .dataSource(dataSource);
        builder.extras.putAll(extras);
        return builder;
    }

    public String driverClass() {
        return driverClass;
    }

    public String subprotocol() {
        return subprotocol;
    }

    public String subname() {
        return subname;
    }

    public String user() {
        return user;
    }

    public String password() {
        return password;
    }

    /**
     * Never {@code null}; {@link IsolationLevel#NONE} when unset.
     */
    public IsolationLevel isolationLevel() {
        return isolationLevel;
    }

    /**
     * Vendor-specific passthrough fields, in insertion order.
     */
    public Map<String, String> extras() {
        return extras;
    }

    public String extra(String key) {
        return extras.get(key);
    }

    public DataSource dataSource() {
        return dataSource;
    }

    public boolean isPooled() {
        return dataSource != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DbSpec other)) return false;
        return Objects.equals(driverClass, other.driverClass)
                && Objects.equals(subprotocol, other.subprotocol)
                && Objects.equals(subname, other.subname)
                && Objects.equals(user, other.user)
                && Objects.equals(password, other.password)
                && isolationLevel == other.isolationLevel
                && extras.equals(other.extras)
                && dataSource == other.dataSource;
    }

    @Override
    public int hashCode() {
        return Objects.hash(driverClass, subprotocol, subname, user, password, isolationLevel, extras,
                System.identityHashCode(dataSource));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DbSpec{subprotocol=").append(subprotocol)
                .append(", subname=").append(subname);
        if (driverClass != null) sb.append(", driverClass=").append(driverClass);
        if (user != null) sb.append(", user=").append(user);
        if (password != null) sb.append(", password=****");
        if (isolationLevel != IsolationLevel.NONE) sb.append(", isolationLevel=").append(isolationLevel.key());
        if (!extras.isEmpty()) sb.append(", extras=").append(extras.keySet());
        if (dataSource != null) sb.append(", pooled");
        return sb.append('}').toString();
    }

    /**
     * Builder for {@link DbSpec}.
     */
    public static final class Builder {
        private String driverClass;
        private String subprotocol;
        private String subname;
        private String user;
        private String password;
        private IsolationLevel isolationLevel = IsolationLevel.NONE;
        private final Map<String, String> extras = new LinkedHashMap<>();
        private DataSource dataSource;

        private Builder() {
        }

        public Builder driverClass(String driverClass) {
            this.driverClass = driverClass;
            return this;
        }

        public Builder subprotocol(String subprotocol) {
            this.subprotocol = subprotocol;
            return this;
        }

        public Builder subname(String subname) {
            this.subname = subname;
            return this;
        }

        /**
         * @param user the user; an empty name is treated as absent
         */
        public Builder user(String user) {
            this.user = user == null || user.isEmpty() ? null : user;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        /**
         * @param isolationLevel the level; {@code null} resets to {@link IsolationLevel#NONE}
         */
        public Builder isolationLevel(IsolationLevel isolationLevel) {
            this.isolationLevel = isolationLevel == null ? IsolationLevel.NONE : isolationLevel;
            return this;
        }

        /**
         * Sets a passthrough field. A {@code null} value removes the key.
         */
        public Builder extra(String key, String value) {
            Objects.requireNonNull(key, "key");
            if (value == null) {
                extras.remove(key);
            } else {
                extras.put(key, value);
            }
            return this;
        }

        public Builder dataSource(DataSource dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        public DbSpec build() {
            return new DbSpec(this);
        }
    }
}
