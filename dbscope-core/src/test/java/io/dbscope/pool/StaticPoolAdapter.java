package io.dbscope.pool;

import io.dbscope.DbSpec;
import io.dbscope.spi.PoolAdapter;

/**
 * Test adapter registered through {@code META-INF/services}. Marks transformed
 * descriptors with a {@code pooled-by} extra.
 */
public class StaticPoolAdapter implements PoolAdapter {

    @Override
    public String name() {
        return "Static";
    }

    @Override
    public DbSpec transform(DbSpec spec) {
        return spec.toBuilder().extra(DbSpec.POOL, null).extra("pooled-by", name()).build();
    }
}
