package com.pairstream.server.pipeline.stream;

import com.pairstream.server.pipeline.concurrent.GuardedExecutor;
import com.pairstream.server.pipeline.concurrent.ItemResult;
import com.pairstream.server.pipeline.concurrent.ParallelExecutor;
import com.pairstream.server.pipeline.derive.PairDeriver;
import com.pairstream.server.pipeline.image.GuardedImageDecoder;
import com.pairstream.server.pipeline.image.ImageDecoder;
import com.pairstream.server.pipeline.image.ImageIoDecoder;
import com.pairstream.server.pipeline.manifest.ManifestException;
import com.pairstream.server.pipeline.manifest.ManifestResolver;
import com.pairstream.server.pipeline.sample.SampleDescriptor;
import com.pairstream.server.pipeline.sample.SampleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Streams batches of (input, target) pairs out of a resolved manifest.
 *
 * <p>Each epoch runs two background threads. The feeder pushes descriptors through the worker
 * pool, keeping at most {@code 2 * parallelism} in flight, and hands the results to the
 * shuffle window in manifest order. The assembler takes samples out of the window, groups them
 * into batches and places them on a prefetch queue of {@code prefetchDepth} slots. Every stage
 * is bounded, so a slow consumer stalls the workers instead of growing memory.
 *
 * <p>Because results enter the window in manifest order and the window draws from an RNG
 * seeded by {@code (seed, epoch)}, the batch sequence is a function of the manifest and the
 * configuration only, independent of worker scheduling.
 *
 * <p>{@link #nextBatch()} may be called from one consumer thread at a time.
 */
public class StreamingPipeline implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(StreamingPipeline.class);
    private static final Duration DEFAULT_TEARDOWN = Duration.ofSeconds(5);

    private final List<SampleDescriptor> descriptors;
    private final PipelineConfig config;
    private final SampleProcessor processor;
    private final ParallelExecutor workers;
    private final GuardedExecutor guard;
    private final Duration teardownTimeout;
    private final Object lifecycleLock = new Object();

    private int epochNumber;
    private Epoch current;
    private boolean closed;

    public StreamingPipeline(List<SampleDescriptor> descriptors, PipelineConfig config) {
        this(descriptors, config, new ImageIoDecoder());
    }

    public StreamingPipeline(List<SampleDescriptor> descriptors, PipelineConfig config, ImageDecoder decoder) {
        this.descriptors = Collections.unmodifiableList(new ArrayList<>(descriptors));
        this.config = config;

        ImageDecoder effective = decoder;
        if (config.getIoTimeout() != null) {
            this.guard = new GuardedExecutor("pair-io");
            effective = new GuardedImageDecoder(decoder, guard, config.getIoTimeout());
            this.teardownTimeout = config.getIoTimeout().compareTo(DEFAULT_TEARDOWN) > 0
                    ? config.getIoTimeout() : DEFAULT_TEARDOWN;
        } else {
            this.guard = null;
            this.teardownTimeout = DEFAULT_TEARDOWN;
        }
        this.processor = new SampleProcessor(new PairDeriver(config.getDerivation(), effective),
                config.getTransformChain(), config.getValueMin(), config.getValueMax());
        this.workers = new ParallelExecutor(config.getParallelism(), "pair-worker");
        this.current = new Epoch(0);

        logger.info("Pipeline ready: {} samples, {}", this.descriptors.size(), config);
    }

    /**
     * Resolves the manifest once and builds a pipeline over it.
     */
    public static StreamingPipeline fromManifest(ManifestResolver resolver, PipelineConfig config)
            throws ManifestException {
        return new StreamingPipeline(resolver.resolve(), config);
    }

    /**
     * Returns the next batch, starting the epoch on the first call. Blocks until a batch is
     * ready.
     *
     * @return the batch, or empty once the epoch is exhausted (repeatable without blocking)
     * @throws PipelineException if the epoch failed
     * @throws IllegalStateException if the pipeline is closed
     */
    public Optional<Batch> nextBatch() {
        Epoch epoch;
        synchronized (lifecycleLock) {
            if (closed) {
                throw new IllegalStateException("Pipeline is closed");
            }
            epoch = current;
            epoch.startIfNeeded();
        }
        return epoch.next();
    }

    /**
     * Tears down the current epoch, discarding buffered samples and queued batches, and
     * prepares a fresh one reshuffled with the next epoch's seed. It starts on the next
     * {@link #nextBatch()} call.
     */
    public void resetEpoch() {
        Epoch old;
        synchronized (lifecycleLock) {
            if (closed) {
                throw new IllegalStateException("Pipeline is closed");
            }
            old = current;
            epochNumber++;
            current = new Epoch(epochNumber);
        }
        old.stop();
        logger.info("Epoch {} reset; next epoch is {}", old.number, epochNumber);
    }

    public PipelineStats stats() {
        Epoch epoch;
        synchronized (lifecycleLock) {
            epoch = current;
        }
        return epoch.snapshot();
    }

    public EpochState getState() {
        synchronized (lifecycleLock) {
            return current.state;
        }
    }

    public int getEpoch() {
        synchronized (lifecycleLock) {
            return epochNumber;
        }
    }

    public List<SampleDescriptor> getDescriptors() {
        return descriptors;
    }

    public PipelineConfig getConfig() {
        return config;
    }

    public boolean isClosed() {
        synchronized (lifecycleLock) {
            return closed;
        }
    }

    /**
     * Stops the epoch and the worker pool. Workers stuck past the teardown bound are
     * abandoned. Idempotent.
     */
    @Override
    public void close() {
        Epoch epoch;
        synchronized (lifecycleLock) {
            if (closed) {
                return;
            }
            closed = true;
            epoch = current;
        }
        epoch.stop();
        workers.shutdown(teardownTimeout);
        if (guard != null) {
            if (guard.getAbandonedCount() > 0) {
                logger.warn("{} image reads were abandoned after timing out", guard.getAbandonedCount());
            }
            guard.close();
        }
        logger.info("Pipeline closed");
    }

    private static final class Slot {
        static final Slot END = new Slot(null, null, false);
        static final Slot CANCELLED = new Slot(null, null, true);

        final Batch batch;
        final PipelineException failure;
        final boolean cancelled;

        private Slot(Batch batch, PipelineException failure, boolean cancelled) {
            this.batch = batch;
            this.failure = failure;
            this.cancelled = cancelled;
        }

        static Slot of(Batch batch) {
            return new Slot(batch, null, false);
        }

        static Slot failed(PipelineException failure) {
            return new Slot(null, failure, false);
        }
    }

    private final class Epoch {
        final int number;
        final ShuffleBuffer<ProcessedSample> window;
        final BlockingQueue<Slot> prefetch;

        final AtomicLong seen = new AtomicLong();
        final AtomicLong skipped = new AtomicLong();
        final AtomicLong delivered = new AtomicLong();
        final AtomicLong waitNanos = new AtomicLong();

        volatile EpochState state = EpochState.NOT_STARTED;
        volatile PipelineException failure;
        volatile boolean stopped;

        private Thread feeder;
        private Thread assembler;

        // consumer side
        private final Object consumerLock = new Object();
        private boolean endReached;
        private PipelineException reported;

        Epoch(int number) {
            this.number = number;
            this.window = new ShuffleBuffer<>(config.getShuffleWindowSize(), epochRandom(number));
            this.prefetch = new ArrayBlockingQueue<>(config.getPrefetchDepth());
        }

        void startIfNeeded() {
            if (state != EpochState.NOT_STARTED) {
                return;
            }
            state = EpochState.RUNNING;
            feeder = new Thread(this::feed, "pair-feeder-" + number);
            assembler = new Thread(this::assemble, "pair-assembler-" + number);
            feeder.setDaemon(true);
            assembler.setDaemon(true);
            feeder.start();
            assembler.start();
            logger.info("Epoch {} started over {} samples", number, descriptors.size());
        }

        Optional<Batch> next() {
            synchronized (consumerLock) {
                if (endReached) {
                    return Optional.empty();
                }
                if (reported != null) {
                    throw reported;
                }
                long start = System.nanoTime();
                Slot slot;
                try {
                    slot = prefetch.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new PipelineException("Interrupted while waiting for a batch", e);
                }
                if (slot.cancelled) {
                    // leave the marker for any later caller of this torn-down epoch
                    prefetch.offer(slot);
                    throw new PipelineException("Epoch " + number + " was torn down while waiting for a batch");
                }
                if (slot.failure != null) {
                    reported = new PipelineException(slot.failure.getMessage(), slot.failure);
                    throw reported;
                }
                if (slot == Slot.END) {
                    endReached = true;
                    logger.info("Epoch {} exhausted: {}", number, snapshot());
                    return Optional.empty();
                }
                waitNanos.addAndGet(System.nanoTime() - start);
                delivered.incrementAndGet();
                return Optional.of(slot.batch);
            }
        }

        private void feed() {
            int inFlight = Math.max(2, config.getParallelism() * 2);
            try {
                workers.forEachOrdered(descriptors.iterator(), processor::process, inFlight, this::accept);
                if (failure == null && !stopped) {
                    state = EpochState.DRAINING;
                    window.close();
                    logger.debug("Epoch {} manifest exhausted; draining {} buffered samples", number, window.size());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                fail(new PipelineException("Sample feeder failed in epoch " + number, e));
            }
        }

        private boolean accept(ItemResult<SampleDescriptor, ProcessedSample> result) throws InterruptedException {
            if (stopped) {
                return false;
            }
            seen.incrementAndGet();
            if (result.isSuccess()) {
                return window.put(result.getValue());
            }

            Throwable error = result.getError();
            if (error instanceof SampleException) {
                SampleException se = (SampleException) error;
                long skips = skipped.incrementAndGet();
                logger.warn("Skipping sample {} ({} error): {}", se.getSampleId(), se.kind(), se.getMessage());
                if (config.getErrorPolicy() == ErrorPolicy.ABORT) {
                    fail(new PipelineException("Aborting epoch " + number + ": sample " + se.getSampleId()
                            + " failed (" + se.kind() + ")", se));
                    return false;
                }
                if ((double) skips / descriptors.size() > config.getSkipRatioThreshold()) {
                    fail(new PipelineException(String.format(
                            "Skipped %d of %d samples in epoch %d, above the skip ratio threshold %.3f; last error: %s",
                            skips, descriptors.size(), number, config.getSkipRatioThreshold(), se.getMessage()), se));
                    return false;
                }
                return true;
            }
            if (error instanceof PipelineException) {
                fail((PipelineException) error);
                return false;
            }
            if (stopped) {
                // cancelled by teardown
                return false;
            }
            fail(new PipelineException("Unexpected failure processing " + result.getItem().id(), error));
            return false;
        }

        private void assemble() {
            int batchSize = config.getBatchSize();
            List<ProcessedSample> pending = new ArrayList<>(batchSize);
            try {
                try {
                    ProcessedSample sample;
                    while ((sample = window.take()) != null) {
                        pending.add(sample);
                        if (pending.size() == batchSize) {
                            prefetch.put(Slot.of(Batch.stack(pending)));
                            pending = new ArrayList<>(batchSize);
                        }
                    }
                    if (stopped) {
                        return;
                    }
                    if (failure != null) {
                        prefetch.put(Slot.failed(failure));
                        return;
                    }
                    if (!pending.isEmpty()) {
                        if (config.getPartialBatchPolicy() == PartialBatchPolicy.KEEP) {
                            prefetch.put(Slot.of(Batch.stack(pending)));
                        } else {
                            logger.debug("Dropping partial batch of {} samples", pending.size());
                        }
                    }
                    state = EpochState.EXHAUSTED;
                    prefetch.put(Slot.END);
                } catch (PipelineException e) {
                    fail(e);
                    prefetch.put(Slot.failed(e));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private synchronized void fail(PipelineException e) {
            if (stopped || failure != null) {
                return;
            }
            failure = e;
            state = EpochState.FAILED;
            window.cancel();
            logger.error("Epoch {} failed: {}", number, e.getMessage());
        }

        /**
         * Interrupts both threads, waits for them up to the teardown bound, then clears the
         * queues and wakes any blocked consumer.
         */
        void stop() {
            synchronized (this) {
                if (stopped) {
                    return;
                }
                stopped = true;
            }
            window.cancel();
            joinQuietly(feeder);
            joinQuietly(assembler);
            prefetch.clear();
            prefetch.offer(Slot.CANCELLED);
            if (state != EpochState.EXHAUSTED && state != EpochState.FAILED) {
                state = EpochState.CANCELLED;
            }
        }

        private void joinQuietly(Thread t) {
            if (t == null) {
                return;
            }
            t.interrupt();
            try {
                t.join(teardownTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) {
                logger.warn("{} did not stop within {} ms; abandoning it", t.getName(), teardownTimeout.toMillis());
            }
        }

        PipelineStats snapshot() {
            long batches = delivered.get();
            double meanMillis = batches == 0 ? 0.0 : waitNanos.get() / 1_000_000.0 / batches;
            return new PipelineStats(number, state, descriptors.size(), seen.get(), skipped.get(), batches, meanMillis);
        }
    }

    private Random epochRandom(int epoch) {
        return new Random(config.getSeed() * 1_000_003L + epoch);
    }
}
