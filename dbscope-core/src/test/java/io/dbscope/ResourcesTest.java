package io.dbscope;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ResourcesTest {
    private final ConnectionFactory factory = new ConnectionFactory();

    @Test
    void releasesOnceAfterNormalCompletion() {
        RecordingConnection recording = new RecordingConnection();

        int result = Resources.withScoped(() -> factory.open(recording.spec()), conn -> 7);

        assertEquals(7, result);
        assertEquals(1, recording.count("close"));
    }

    @Test
    void releasesOnceWhenBodyFails() {
        RecordingConnection recording = new RecordingConnection();
        RuntimeException boom = new RuntimeException("boom");

        RuntimeException thrown = assertThrows(RuntimeException.class, () ->
                Resources.withScoped(() -> factory.open(recording.spec()), conn -> {
                    throw boom;
                }));

        assertSame(boom, thrown);
        assertEquals(0, thrown.getSuppressed().length);
        assertEquals(1, recording.count("close"));
    }

    @Test
    void bodyErrorTakesPrecedenceOverReleaseFailure() {
        SQLException closeFailure = new SQLException("socket closed");
        RecordingConnection recording = new RecordingConnection().failOn("close", closeFailure);
        IllegalStateException boom = new IllegalStateException("boom");

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () ->
                Resources.withScoped(() -> factory.open(recording.spec()), conn -> {
                    throw boom;
                }));

        assertSame(boom, thrown);
        assertEquals(1, thrown.getSuppressed().length);
        ResourceReleaseException release = assertInstanceOf(ResourceReleaseException.class, thrown.getSuppressed()[0]);
        assertSame(closeFailure, release.getCause());
        assertEquals(1, recording.count("close"));
    }

    @Test
    void releaseFailureAfterSuccessIsThrown() {
        SQLException closeFailure = new SQLException("socket closed");
        RecordingConnection recording = new RecordingConnection().failOn("close", closeFailure);

        ResourceReleaseException thrown = assertThrows(ResourceReleaseException.class, () ->
                Resources.withScoped(() -> factory.open(recording.spec()), conn -> "ok"));

        assertSame(closeFailure, thrown.getCause());
    }

    @Test
    void failedAcquisitionReleasesNothing() {
        AtomicInteger bodyRuns = new AtomicInteger();

        assertThrows(UnknownDriverException.class, () ->
                Resources.withScoped(() -> factory.open("nosuchdb://localhost/app"), conn -> bodyRuns.incrementAndGet()));

        assertEquals(0, bodyRuns.get());
    }

    @Test
    void nestedScopesOverSameResourceReleaseOnce() {
        RecordingConnection recording = new RecordingConnection();
        DbConnection conn = factory.open(recording.spec());

        Resources.withScoped(() -> conn, outer ->
                Resources.withScoped(() -> outer, inner -> inner.vendor()));

        assertEquals(1, recording.count("close"));
        assertTrue(conn.isClosed());
    }

    @Test
    void checkedBodyExceptionPropagates() {
        RecordingConnection recording = new RecordingConnection();
        SQLException failure = new SQLException("raw failure");

        SQLException thrown = assertThrows(SQLException.class, () ->
                Resources.withScoped(() -> factory.open(recording.spec()), conn -> {
                    throw failure;
                }));

        assertSame(failure, thrown);
        assertEquals(1, recording.count("close"));
    }

    @Test
    void plainAutoCloseableResourcesAreSupported() {
        AtomicInteger closes = new AtomicInteger();

        String result = Resources.withScoped(() -> (AutoCloseable) closes::incrementAndGet, resource -> "used");

        assertEquals("used", result);
        assertEquals(1, closes.get());
    }

    @Test
    void nullArgumentsAreRejected() {
        assertThrows(NullPointerException.class, () -> Resources.withScoped(null, r -> null));
        assertThrows(NullPointerException.class, () -> Resources.withScoped(() -> (AutoCloseable) () -> { }, null));
    }
}
