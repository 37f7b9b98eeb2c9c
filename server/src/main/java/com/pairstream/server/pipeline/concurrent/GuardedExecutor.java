package com.pairstream.server.pipeline.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs a task on a separate daemon thread and stops waiting for it after a fixed bound.
 * <p>
 * Cancellation is best effort: on timeout the task is interrupted and abandoned, but code
 * that ignores interrupts (a wedged native decode, a blocked socket read) keeps its thread
 * until it returns. The caller is only guaranteed not to block past the bound.
 */
public class GuardedExecutor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(GuardedExecutor.class);

    private final ExecutorService executor;
    private final AtomicLong abandoned = new AtomicLong();

    public GuardedExecutor(String threadNamePrefix) {
        this.executor = Executors.newCachedThreadPool(new NamedThreadFactory(threadNamePrefix));
    }

    /**
     * @throws GuardedTimeoutException if {@code task} has not returned within {@code timeout}
     * @throws ExecutionException      wrapping whatever {@code task} threw
     */
    public <T> T runWithTimeout(Callable<T> task, Duration timeout)
            throws GuardedTimeoutException, ExecutionException, InterruptedException {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("GuardedExecutor is closed", e);
        }

        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            long count = abandoned.incrementAndGet();
            logger.warn("Guarded task exceeded {} ms and was abandoned ({} so far)", timeout.toMillis(), count);
            throw new GuardedTimeoutException(timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    /**
     * Number of tasks abandoned after timing out.
     */
    public long getAbandonedCount() {
        return abandoned.get();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
