package io.dbscope.hikari;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.dbscope.ConnectionException;
import io.dbscope.DbSpec;
import io.dbscope.DbSpecs;
import io.dbscope.IsolationLevel;
import io.dbscope.MalformedDescriptorException;
import io.dbscope.pool.PoolAdapters;
import io.dbscope.spi.PoolAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class HikariPoolAdapterTest {
    private final HikariPoolAdapter adapter = new HikariPoolAdapter();
    private final List<DbSpec> pools = new ArrayList<>();

    @AfterEach
    void tearDown() {
        pools.forEach(HikariPoolAdapter::close);
    }

    @Test
    void discoveredThroughServiceLoader() {
        assertInstanceOf(HikariPoolAdapter.class, PoolAdapters.get("hikari"));
        assertInstanceOf(HikariPoolAdapter.class, PoolAdapters.forSpec(DbSpecs.normalize("h2:mem:x?pool=hikari")));
        assertSame(PoolAdapter.PASS_THROUGH, PoolAdapters.forSpec(DbSpecs.normalize("h2:mem:x")));
    }

    @Test
    void configTakesPoolSettingsFromExtras() {
        DbSpec spec = DbSpec.builder()
                .subprotocol("postgresql")
                .subname("//localhost:5432/app")
                .user("app")
                .password("secret")
                .driverClass("org.h2.Driver")
                .extra(DbSpec.POOL, "hikari")
                .extra(HikariPoolAdapter.MAX_POOL_SIZE, "7")
                .extra(HikariPoolAdapter.MIN_POOL_SIZE, "2")
                .extra(HikariPoolAdapter.MAX_CONNECTION_LIFETIME, "600000")
                .extra(HikariPoolAdapter.MAX_CONNECTION_IDLE_LIFETIME, "120000")
                .extra(HikariPoolAdapter.CONNECTION_TIMEOUT, "5000")
                .extra(HikariPoolAdapter.POOL_NAME, "orders-pool")
                .extra(DbSpec.READ_ONLY, "true")
                .extra("ssl", "true")
                .build();

        HikariConfig config = HikariPoolAdapter.toConfig(spec);

        assertEquals("jdbc:postgresql://localhost:5432/app", config.getJdbcUrl());
        assertEquals("org.h2.Driver", config.getDriverClassName());
        assertEquals("app", config.getUsername());
        assertEquals("secret", config.getPassword());
        assertEquals(7, config.getMaximumPoolSize());
        assertEquals(2, config.getMinimumIdle());
        assertEquals(600_000L, config.getMaxLifetime());
        assertEquals(120_000L, config.getIdleTimeout());
        assertEquals(5_000L, config.getConnectionTimeout());
        assertEquals("orders-pool", config.getPoolName());
        Properties props = config.getDataSourceProperties();
        assertEquals("true", props.getProperty("ssl"));
        assertEquals(1, props.size());
    }

    @Test
    void malformedPoolSettingsAreRejected() {
        DbSpec base = DbSpecs.normalize("h2:mem:x?pool=hikari");

        assertThrows(MalformedDescriptorException.class, () ->
                adapter.transform(base.toBuilder().extra(HikariPoolAdapter.MAX_POOL_SIZE, "many").build()));
        assertThrows(MalformedDescriptorException.class, () ->
                adapter.transform(base.toBuilder().extra(HikariPoolAdapter.CONNECTION_TIMEOUT, "-5").build()));
        assertThrows(MalformedDescriptorException.class, () ->
                adapter.transform(base.toBuilder().extra(HikariPoolAdapter.MAX_POOL_SIZE, "0").build()));
    }

    @Test
    void transformStartsPoolAndStripsPoolSettings() {
        DbSpec spec = h2Spec()
                .isolationLevel(IsolationLevel.READ_COMMITTED)
                .extra(HikariPoolAdapter.MAX_POOL_SIZE, "3")
                .extra(HikariPoolAdapter.POOL_NAME, "strip-pool")
                .extra(DbSpec.QUERY_TIMEOUT, "5")
                .build();

        DbSpec pooled = pooled(spec);

        assertTrue(pooled.isPooled());
        HikariDataSource ds = assertInstanceOf(HikariDataSource.class, pooled.dataSource());
        assertEquals("strip-pool", ds.getPoolName());
        assertEquals(3, ds.getMaximumPoolSize());
        assertNull(pooled.extra(DbSpec.POOL));
        assertNull(pooled.extra(HikariPoolAdapter.MAX_POOL_SIZE));
        assertEquals("5", pooled.extra(DbSpec.QUERY_TIMEOUT));
        assertEquals(IsolationLevel.READ_COMMITTED, pooled.isolationLevel());
        assertEquals(spec.subname(), pooled.subname());
    }

    @Test
    void pooledSpecIsReturnedUnchanged() {
        DbSpec pooled = pooled(h2Spec().build());

        assertSame(pooled, adapter.transform(pooled));
    }

    @Test
    void unstartablePoolIsConnectionError() {
        DbSpec spec = DbSpec.builder().subprotocol("nosuchdb").subname("//localhost/app").build();

        assertThrows(ConnectionException.class, () -> adapter.transform(spec));
    }

    @Test
    void closeShutsDownPoolOnce() {
        DbSpec pooled = adapter.transform(h2Spec().build());
        HikariDataSource ds = (HikariDataSource) pooled.dataSource();

        HikariPoolAdapter.close(pooled);
        HikariPoolAdapter.close(pooled);
        HikariPoolAdapter.close(h2Spec().build());

        assertTrue(ds.isClosed());
    }

    private DbSpec pooled(DbSpec spec) {
        DbSpec pooled = adapter.transform(spec);
        pools.add(pooled);
        return pooled;
    }

    private static DbSpec.Builder h2Spec() {
        return DbSpec.builder()
                .subprotocol("h2")
                .subname("mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1")
                .extra(DbSpec.POOL, "hikari");
    }
}
