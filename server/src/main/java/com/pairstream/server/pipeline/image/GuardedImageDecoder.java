package com.pairstream.server.pipeline.image;

import com.pairstream.server.pipeline.concurrent.GuardedExecutor;
import com.pairstream.server.pipeline.concurrent.GuardedTimeoutException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutionException;

/**
 * Bounds every decode of the wrapped decoder by a wall-clock timeout. A timeout surfaces as
 * {@link InterruptedIOException} whose cause is the {@link GuardedTimeoutException}.
 */
public class GuardedImageDecoder implements ImageDecoder {

    private final ImageDecoder delegate;
    private final GuardedExecutor guard;
    private final Duration timeout;

    public GuardedImageDecoder(ImageDecoder delegate, GuardedExecutor guard, Duration timeout) {
        this.delegate = delegate;
        this.guard = guard;
        this.timeout = timeout;
    }

    @Override
    public ImageTensor decode(Path path, int channels) throws IOException {
        try {
            return guard.runWithTimeout(() -> delegate.decode(path, channels), timeout);
        } catch (GuardedTimeoutException e) {
            InterruptedIOException timedOut = new InterruptedIOException(
                    "Decoding " + path + " timed out after " + timeout.toMillis() + " ms");
            timedOut.initCause(e);
            throw timedOut;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IOException("Decoding " + path + " failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted while decoding " + path);
            interrupted.initCause(e);
            throw interrupted;
        }
    }
}
