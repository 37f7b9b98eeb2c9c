package com.pairstream.server.pipeline.stream;

/**
 * What happens to the final batch of an epoch when fewer than {@code batchSize} samples remain.
 */
public enum PartialBatchPolicy {
    KEEP,
    DROP
}
