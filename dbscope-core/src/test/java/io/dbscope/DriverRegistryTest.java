package io.dbscope;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DriverRegistryTest {

    @Test
    void defaultsKnowCommonDrivers() {
        DriverRegistry registry = DriverRegistry.defaults();

        assertEquals(Optional.of("org.h2.Driver"), registry.lookup("h2"));
        assertEquals(Optional.of("org.postgresql.Driver"), registry.lookup("postgresql"));
        assertEquals(Optional.of("org.postgresql.Driver"), registry.lookup("PGSQL"));
        assertEquals(Optional.empty(), registry.lookup("nosuchdb"));
        assertEquals(Optional.empty(), registry.lookup(null));
    }

    @Test
    void withReturnsExtendedCopy() {
        DriverRegistry base = DriverRegistry.defaults();
        DriverRegistry extended = base.with("TiDB", "com.mysql.cj.jdbc.Driver");

        assertEquals(Optional.of("com.mysql.cj.jdbc.Driver"), extended.lookup("tidb"));
        assertEquals(Optional.empty(), base.lookup("tidb"));
        assertEquals(Optional.of("org.h2.Driver"), extended.lookup("h2"));
    }

    @Test
    void explicitDriverClassWins() {
        DbSpec spec = DbSpec.builder().driverClass("com.example.Driver").subprotocol("h2").subname("mem:x").build();

        assertEquals("com.example.Driver", DriverRegistry.empty().resolve(spec));
    }

    @Test
    void unresolvableSpecListsKnownSubprotocols() {
        DbSpec spec = DbSpec.builder().subprotocol("h2").subname("mem:x").build();

        UnknownDriverException thrown = assertThrows(UnknownDriverException.class, () ->
                DriverRegistry.empty().with("sqlite", "org.sqlite.JDBC").resolve(spec));

        assertEquals("No driver registered for subprotocol: h2. Available: [sqlite]", thrown.getMessage());
    }
}
