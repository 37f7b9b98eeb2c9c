package com.pairstream.server.pipeline.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-size worker pool that maps a function over items and reports results in input order.
 * A failing item produces an error {@link ItemResult}; it never blocks or drops other items.
 */
public class ParallelExecutor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ParallelExecutor.class);
    private static final Duration DEFAULT_GRACE = Duration.ofSeconds(5);

    @FunctionalInterface
    public interface ItemFunction<T, R> {
        R apply(T item) throws Exception;
    }

    @FunctionalInterface
    public interface ResultSink<T, R> {
        /**
         * @return false to stop consuming; remaining in-flight items are cancelled
         */
        boolean accept(ItemResult<T, R> result) throws InterruptedException;
    }

    @FunctionalInterface
    public interface ProgressListener {
        void onItemDone(int completed, int total);
    }

    private final ExecutorService pool;
    private final int workerCount;

    public ParallelExecutor(int workerCount, String threadNamePrefix) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, got " + workerCount);
        }
        this.workerCount = workerCount;
        this.pool = Executors.newFixedThreadPool(workerCount, new NamedThreadFactory(threadNamePrefix));
    }

    /**
     * One-shot map on a temporary pool.
     */
    public static <T, R> List<ItemResult<T, R>> map(ItemFunction<T, R> fn, List<T> items, int workerCount)
            throws InterruptedException {
        try (ParallelExecutor executor = new ParallelExecutor(workerCount, "map")) {
            return executor.mapParallel(fn, items);
        }
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public <T, R> List<ItemResult<T, R>> mapParallel(ItemFunction<T, R> fn, List<T> items)
            throws InterruptedException {
        return mapParallel(fn, items, null);
    }

    /**
     * Runs {@code fn} on every item. Items complete in any order; each is tagged with its
     * index and the returned list is in input order.
     */
    public <T, R> List<ItemResult<T, R>> mapParallel(ItemFunction<T, R> fn, List<T> items,
            ProgressListener listener) throws InterruptedException {
        int total = items.size();
        CompletionService<ItemResult<T, R>> completion = new ExecutorCompletionService<>(pool);
        Map<Future<ItemResult<T, R>>, Integer> indexByFuture = new HashMap<>();

        for (int i = 0; i < total; i++) {
            final int index = i;
            final T item = items.get(i);
            Future<ItemResult<T, R>> f = completion.submit(() -> invoke(fn, index, item));
            indexByFuture.put(f, index);
        }

        @SuppressWarnings("unchecked")
        ItemResult<T, R>[] ordered = new ItemResult[total];
        try {
            for (int done = 1; done <= total; done++) {
                Future<ItemResult<T, R>> f = completion.take();
                ItemResult<T, R> result;
                try {
                    result = f.get();
                } catch (ExecutionException e) {
                    // invoke() only lets Errors escape
                    int index = indexByFuture.get(f);
                    result = ItemResult.failure(index, items.get(index), e.getCause());
                }
                ordered[result.getIndex()] = result;
                if (listener != null) {
                    listener.onItemDone(done, total);
                }
            }
        } catch (InterruptedException e) {
            for (Future<ItemResult<T, R>> f : indexByFuture.keySet()) {
                f.cancel(true);
            }
            throw e;
        }
        return Arrays.asList(ordered);
    }

    /**
     * Streams items through the pool with at most {@code maxInFlight} submitted but not yet
     * consumed, handing results to {@code sink} strictly in input order. Blocks while the
     * sink blocks.
     */
    public <T, R> void forEachOrdered(Iterator<T> items, ItemFunction<T, R> fn, int maxInFlight,
            ResultSink<T, R> sink) throws InterruptedException {
        if (maxInFlight < 1) {
            throw new IllegalArgumentException("maxInFlight must be >= 1");
        }
        Deque<Pending<T, R>> window = new ArrayDeque<>();
        int index = 0;
        boolean stopped = false;
        try {
            while (!stopped && items.hasNext()) {
                if (window.size() >= maxInFlight) {
                    stopped = !sink.accept(await(window.poll()));
                    if (stopped) {
                        break;
                    }
                }
                final T item = items.next();
                window.add(new Pending<>(index++, item, pool.submit(() -> fn.apply(item))));
            }
            while (!stopped && !window.isEmpty()) {
                stopped = !sink.accept(await(window.poll()));
            }
        } finally {
            for (Pending<T, R> p : window) {
                p.future.cancel(true);
            }
        }
    }

    /**
     * Stops the pool, interrupting running items, and waits up to {@code grace} for workers
     * to exit.
     *
     * @return true if every worker exited in time
     */
    public boolean shutdown(Duration grace) {
        List<Runnable> pending = pool.shutdownNow();
        if (!pending.isEmpty()) {
            logger.debug("Discarded {} queued tasks on shutdown", pending.size());
        }
        try {
            boolean terminated = pool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS);
            if (!terminated) {
                logger.warn("Worker pool did not terminate within {} ms; abandoning remaining workers",
                        grace.toMillis());
            }
            return terminated;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void close() {
        shutdown(DEFAULT_GRACE);
    }

    private static <T, R> ItemResult<T, R> invoke(ItemFunction<T, R> fn, int index, T item) {
        try {
            return ItemResult.success(index, item, fn.apply(item));
        } catch (Exception e) {
            return ItemResult.failure(index, item, e);
        }
    }

    private static <T, R> ItemResult<T, R> await(Pending<T, R> p) throws InterruptedException {
        try {
            return ItemResult.success(p.index, p.item, p.future.get());
        } catch (ExecutionException e) {
            return ItemResult.failure(p.index, p.item, e.getCause());
        } catch (CancellationException e) {
            return ItemResult.failure(p.index, p.item, e);
        }
    }

    private static final class Pending<T, R> {
        final int index;
        final T item;
        final Future<R> future;

        Pending(int index, T item, Future<R> future) {
            this.index = index;
            this.item = item;
            this.future = future;
        }
    }
}
