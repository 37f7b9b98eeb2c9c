package com.pairstream.server.pipeline.concurrent;

import java.time.Duration;

/**
 * A guarded operation did not return within its time bound. The operation itself may still
 * be running.
 */
public class GuardedTimeoutException extends Exception {

    private final Duration timeout;

    public GuardedTimeoutException(Duration timeout, Throwable cause) {
        super("Operation timed out after " + timeout.toMillis() + " ms", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
