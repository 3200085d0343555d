package io.dbscope.pool;

import io.dbscope.DbSpec;
import io.dbscope.spi.PoolAdapter;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of {@link PoolAdapter}s discovered on the class path.
 *
 * <p>Adapters are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.dbscope.spi.PoolAdapter}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // By name
 * PoolAdapter hikari = PoolAdapters.get("hikari");
 *
 * // From the descriptor's "pool" field, pass-through when absent
 * PoolAdapter adapter = PoolAdapters.forSpec(spec);
 * DbSpec pooled = adapter.transform(spec);
 * }</pre>
 */
public final class PoolAdapters {

    private static final List<PoolAdapter> ADAPTERS;
    private static final Map<String, PoolAdapter> BY_NAME = new ConcurrentHashMap<>();

    static {
        ADAPTERS = ServiceLoader.load(PoolAdapter.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (PoolAdapter adapter : ADAPTERS) {
            BY_NAME.put(adapter.name().toLowerCase(Locale.ROOT), adapter);
        }
    }

    private PoolAdapters() {
    }

    /**
     * Returns all registered adapters.
     */
    public static List<PoolAdapter> all() {
        return ADAPTERS;
    }

    /**
     * Gets an adapter by name. {@code "none"} always resolves to {@link PoolAdapter#PASS_THROUGH}.
     *
     * @param name adapter name (case-insensitive)
     * @return the adapter
     * @throws IllegalArgumentException if no adapter is registered under that name
     */
    public static PoolAdapter get(String name) {
        Objects.requireNonNull(name, "name");
        String key = name.toLowerCase(Locale.ROOT);
        if (key.equals(PoolAdapter.PASS_THROUGH.name())) {
            return PoolAdapter.PASS_THROUGH;
        }
        PoolAdapter adapter = BY_NAME.get(key);
        if (adapter == null) {
            throw new IllegalArgumentException("Unknown pool adapter: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return adapter;
    }

    /**
     * Selects the adapter named by the descriptor's {@link DbSpec#POOL} field.
     * Pooled descriptors and descriptors without the field get {@link PoolAdapter#PASS_THROUGH}.
     *
     * @throws IllegalArgumentException if the named adapter is not registered
     */
    public static PoolAdapter forSpec(DbSpec spec) {
        Objects.requireNonNull(spec, "spec");
        String name = spec.extra(DbSpec.POOL);
        if (name == null || spec.isPooled()) {
            return PoolAdapter.PASS_THROUGH;
        }
        return get(name);
    }
}
