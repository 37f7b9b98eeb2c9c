package com.pairstream.server.pipeline.stream;

/**
 * Reaction to a per-sample derivation or transform failure.
 */
public enum ErrorPolicy {
    /** Log, count and skip the sample; escalate only past the skip-ratio threshold. */
    SKIP,
    /** Fail the epoch on the first bad sample. */
    ABORT
}
