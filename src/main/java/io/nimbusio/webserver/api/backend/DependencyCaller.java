package io.nimbusio.webserver.api.backend;

import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;
import io.nimbusio.webserver.api.model.exceptions.DependencyUnavailableException;
import io.nimbusio.webserver.util.WebServerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls blocking collaborators (metadata, accounting, authentication) with a shared timeout ceiling.
 *
 * A call that does not finish in time, that cannot be scheduled, or that fails with a checked exception is reported as
 * a {@link DependencyUnavailableException}. Runtime exceptions thrown by the call are rethrown unchanged so that
 * domain failures (no such key, conflict, ...) keep their meaning. Calls are never retried.
 */
public class DependencyCaller implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyCaller.class);

    private final ExecutorService executor;
    private final TimeLimiter timeLimiter;
    private final Duration timeout;

    public DependencyCaller(Duration timeout, int poolSize, int queueSize) {
        this.timeout = timeout;
        this.executor = new ThreadPoolExecutor(poolSize, poolSize, 60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueSize),
                new ThreadFactoryBuilder().setNameFormat("dependency-call-%d").setDaemon(true).build());
        this.timeLimiter = SimpleTimeLimiter.create(executor);
    }

    public <T> T call(String operation, Callable<T> callable) {
        try {
            return timeLimiter.callWithTimeout(callable, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            WebServerMetrics.DEPENDENCY_TIMEOUTS.mark();
            LOG.warn("{} did not complete within {}", operation, timeout);
            throw new DependencyUnavailableException(operation + " timed out after " + timeout, e);
        } catch (ExecutionException | UncheckedExecutionException | ExecutionError e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            WebServerMetrics.DEPENDENCY_FAILURES.mark();
            throw new DependencyUnavailableException(operation + " failed", cause);
        } catch (RejectedExecutionException e) {
            WebServerMetrics.DEPENDENCY_FAILURES.mark();
            throw new DependencyUnavailableException(operation + " could not be scheduled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DependencyUnavailableException(operation + " was interrupted", e);
        }
    }

    public void run(String operation, Runnable runnable) {
        call(operation, () -> {
            runnable.run();
            return null;
        });
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
