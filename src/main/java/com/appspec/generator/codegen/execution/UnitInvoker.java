package com.appspec.generator.codegen.execution;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.appspec.generator.codegen.exception.BuildCancelledException;
import com.appspec.generator.codegen.exception.StackBuildException;

/**
 * Invokes one unit, optionally bounded by a timeout. Without a timeout the unit runs on the
 * calling thread; with one it runs on a helper thread that is interrupted when the budget is
 * exceeded. Exceeding the budget is reported like any other failure of the unit.
 */
public class UnitInvoker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UnitInvoker.class);

    private ExecutorService timeoutExecutor;

    public <T> T invoke(String unitId, Duration timeout, Supplier<T> body,
            Function<Duration, StackBuildException> onTimeout) {
        long started = System.nanoTime();
        try {
            if (timeout == null) {
                return body.get();
            }
            return invokeBounded(unitId, timeout, body, onTimeout);
        } finally {
            log.debug("Unit '{}' finished in {} ms", unitId, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        }
    }

    private <T> T invokeBounded(String unitId, Duration timeout, Supplier<T> body,
            Function<Duration, StackBuildException> onTimeout) {
        Future<T> future = executor().submit(body::get);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw onTimeout.apply(timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new BuildCancelledException(unitId);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Unit '" + unitId + "' failed", cause);
        }
    }

    private synchronized ExecutorService executor() {
        if (timeoutExecutor == null) {
            timeoutExecutor = Executors.newCachedThreadPool(daemonThreads("unit-timeout"));
        }
        return timeoutExecutor;
    }

    @Override
    public synchronized void close() {
        if (timeoutExecutor != null) {
            timeoutExecutor.shutdownNow();
            timeoutExecutor = null;
        }
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
