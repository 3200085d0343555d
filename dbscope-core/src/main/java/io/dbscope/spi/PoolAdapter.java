package io.dbscope.spi;

import io.dbscope.DbSpec;

/**
 * SPI for connection pool vendors.
 *
 * <p>An adapter turns a canonical descriptor into a pooled descriptor, i.e. one whose
 * {@link DbSpec#dataSource()} hands out pooled connections. The data source belongs to
 * the caller, who closes it when done.
 * Register implementations via {@code META-INF/services/io.dbscope.spi.PoolAdapter}.
 *
 * @see io.dbscope.pool.PoolAdapters
 */
public interface PoolAdapter {

    /**
     * Returns descriptors unchanged. Used when no pool is selected.
     */
    PoolAdapter PASS_THROUGH = new PoolAdapter() {
        @Override
        public String name() {
            return "none";
        }

        @Override
        public DbSpec transform(DbSpec spec) {
            return spec;
        }
    };

    /**
     * Unique identifier, matched against the descriptor's {@code pool} field (e.g. "hikari").
     */
    String name();

    /**
     * Builds a pooled descriptor from a canonical one.
     *
     * @param spec canonical descriptor
     * @return pooled descriptor, or {@code spec} itself if there is nothing to pool
     */
    DbSpec transform(DbSpec spec);
}
