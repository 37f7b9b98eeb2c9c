package com.pairstream.server.pipeline.concurrent;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

public class ParallelExecutorTest {

    @Test
    public void testMapPreservesInputOrder() throws Exception {
        List<Integer> items = List.of(5, 4, 3, 2, 1, 0);
        // earlier items sleep longer, so completion order is reversed
        List<ItemResult<Integer, Integer>> results = ParallelExecutor.map(i -> {
            Thread.sleep(i * 15L);
            return i * 10;
        }, items, 4);

        Assertions.assertEquals(items.size(), results.size());
        for (int i = 0; i < items.size(); i++) {
            Assertions.assertEquals(i, results.get(i).getIndex());
            Assertions.assertEquals(items.get(i), results.get(i).getItem());
            Assertions.assertEquals(items.get(i) * 10, results.get(i).getValue());
        }
    }

    @Test
    public void testFailingItemDoesNotAffectOthers() throws Exception {
        List<Integer> items = List.of(1, 2, 3, 4);
        List<ItemResult<Integer, Integer>> results = ParallelExecutor.map(i -> {
            if (i == 3) {
                throw new IllegalArgumentException("bad item");
            }
            return i;
        }, items, 2);

        Assertions.assertTrue(results.get(0).isSuccess());
        Assertions.assertTrue(results.get(1).isSuccess());
        Assertions.assertFalse(results.get(2).isSuccess());
        Assertions.assertTrue(results.get(2).getError() instanceof IllegalArgumentException);
        Assertions.assertThrows(IllegalStateException.class, () -> results.get(2).getValue());
        Assertions.assertEquals(4, results.get(3).getValue());
    }

    @Test
    public void testEmptyInput() throws Exception {
        Assertions.assertTrue(ParallelExecutor.map(i -> i, Collections.<Integer>emptyList(), 2).isEmpty());
    }

    @Test
    public void testProgressReportedForEveryItem() throws Exception {
        List<Integer> reported = Collections.synchronizedList(new ArrayList<>());
        try (ParallelExecutor executor = new ParallelExecutor(3, "test")) {
            executor.mapParallel(i -> i, List.of(1, 2, 3, 4, 5), (done, total) -> reported.add(done));
        }
        Assertions.assertEquals(List.of(1, 2, 3, 4, 5), reported);
    }

    @Test
    public void testForEachOrderedDeliversInOrderWithBoundedWindow() throws Exception {
        List<Integer> items = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            items.add(i);
        }
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<Integer> seen = new ArrayList<>();

        try (ParallelExecutor executor = new ParallelExecutor(8, "test")) {
            executor.forEachOrdered(items.iterator(), i -> {
                int now = running.incrementAndGet();
                maxRunning.accumulateAndGet(now, Math::max);
                Thread.sleep((20 - i) % 5 * 3L);
                running.decrementAndGet();
                return i;
            }, 3, result -> {
                seen.add(result.getValue());
                return true;
            });
        }
        Assertions.assertEquals(items, seen);
        Assertions.assertTrue(maxRunning.get() <= 3, "in-flight bound exceeded: " + maxRunning.get());
    }

    @Test
    public void testForEachOrderedStopsWhenSinkDeclines() throws Exception {
        List<Integer> seen = new ArrayList<>();
        try (ParallelExecutor executor = new ParallelExecutor(2, "test")) {
            executor.forEachOrdered(List.of(1, 2, 3, 4, 5, 6).iterator(), i -> i, 2, result -> {
                seen.add(result.getValue());
                return result.getValue() < 3;
            });
        }
        Assertions.assertEquals(List.of(1, 2, 3), seen);
    }

    @Test
    public void testInvalidWorkerCount() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ParallelExecutor(0, "test"));
    }
}
