package io.dbscope;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scoped acquisition with guaranteed release.
 *
 * <pre>{@code
 * long count = Resources.withScoped(() -> factory.open(spec), conn ->
 *     SqlExecutor.query(conn, "SELECT COUNT(*) AS n FROM users").data().size());
 * }</pre>
 */
public final class Resources {
    private static final Logger logger = Logger.getLogger(Resources.class.getName());

    private Resources() {
    }

    /**
     * Acquires a resource.
     *
     * @param <R> resource type
     * @param <E> checked exception the acquisition may throw
     */
    @FunctionalInterface
    public interface Acquirer<R extends AutoCloseable, E extends Exception> {
        R acquire() throws E;
    }

    /**
     * Work performed while a resource is held.
     *
     * @param <R> resource type
     * @param <T> result type
     * @param <E> checked exception the body may throw
     */
    @FunctionalInterface
    public interface ScopedBody<R, T, E extends Exception> {
        T apply(R resource) throws E;
    }

    /**
     * Acquires a resource, runs {@code body} with it and closes it exactly once on every
     * exit path.
     *
     * <p>An error from {@code body} propagates unchanged; if closing then fails as well, the
     * close failure is attached to it as a suppressed {@link ResourceReleaseException}.
     * If {@code body} completes normally and closing fails, the
     * {@link ResourceReleaseException} is thrown. If acquisition fails nothing is closed.
     *
     * @return the body's result
     */
    public static <R extends AutoCloseable, T, E extends Exception> T withScoped(
            Acquirer<R, E> acquire, ScopedBody<? super R, T, E> body) throws E {
        Objects.requireNonNull(acquire, "acquire");
        Objects.requireNonNull(body, "body");
        R resource = Objects.requireNonNull(acquire.acquire(), "acquired resource");
        T result;
        try {
            result = body.apply(resource);
        } catch (Throwable t) {
            try {
                resource.close();
            } catch (Exception e) {
                ResourceReleaseException releaseFailure = asReleaseFailure(resource, e);
                logger.log(Level.WARNING, "Failed to release " + resource + " after error in scoped body", e);
                if (releaseFailure != t) {
                    t.addSuppressed(releaseFailure);
                }
            }
            throw t;
        }
        try {
            resource.close();
        } catch (Exception e) {
            throw asReleaseFailure(resource, e);
        }
        return result;
    }

    private static ResourceReleaseException asReleaseFailure(AutoCloseable resource, Exception e) {
        if (e instanceof ResourceReleaseException release) {
            return release;
        }
        return new ResourceReleaseException("Failed to release " + resource, e);
    }
}
