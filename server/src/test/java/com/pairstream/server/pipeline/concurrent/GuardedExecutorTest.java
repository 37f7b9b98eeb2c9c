package com.pairstream.server.pipeline.concurrent;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;

public class GuardedExecutorTest {

    @Test
    public void testFastTaskReturnsValue() throws Exception {
        try (GuardedExecutor guard = new GuardedExecutor("test-guard")) {
            Assertions.assertEquals("ok", guard.runWithTimeout(() -> "ok", Duration.ofSeconds(1)));
            Assertions.assertEquals(0, guard.getAbandonedCount());
        }
    }

    @Test
    public void testSlowTaskTimesOutWithinBound() {
        try (GuardedExecutor guard = new GuardedExecutor("test-guard")) {
            long start = System.nanoTime();
            GuardedTimeoutException e = Assertions.assertThrows(GuardedTimeoutException.class,
                    () -> guard.runWithTimeout(() -> {
                        Thread.sleep(10_000);
                        return "late";
                    }, Duration.ofMillis(100)));
            long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

            Assertions.assertTrue(elapsedMillis < 2_000, "took " + elapsedMillis + " ms");
            Assertions.assertEquals(Duration.ofMillis(100), e.getTimeout());
            Assertions.assertEquals(1, guard.getAbandonedCount());
        }
    }

    @Test
    public void testTaskFailureIsWrapped() {
        try (GuardedExecutor guard = new GuardedExecutor("test-guard")) {
            ExecutionException e = Assertions.assertThrows(ExecutionException.class,
                    () -> guard.runWithTimeout(() -> {
                        throw new IOException("disk gone");
                    }, Duration.ofSeconds(1)));
            Assertions.assertTrue(e.getCause() instanceof IOException);
        }
    }

    @Test
    public void testNonPositiveTimeoutRejected() {
        try (GuardedExecutor guard = new GuardedExecutor("test-guard")) {
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> guard.runWithTimeout(() -> 1, Duration.ZERO));
        }
    }
}
