package com.pairstream.server.pipeline.stream;

public enum EpochState {
    NOT_STARTED,
    /** Workers are deriving samples from the manifest. */
    RUNNING,
    /** Manifest exhausted; buffered samples are being flushed into batches. */
    DRAINING,
    /** Every batch of the epoch has been queued, followed by the end-of-epoch marker. */
    EXHAUSTED,
    FAILED,
    /** Torn down by {@code resetEpoch()} or {@code close()}. */
    CANCELLED
}
