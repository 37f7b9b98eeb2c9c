package com.pairstream.server.pipeline.transform;

/**
 * Coarse category of a transform, in the order steps are expected to appear in a chain.
 */
public enum TransformStage {
    GEOMETRIC,
    COLOR,
    NORMALIZATION,
    THRESHOLD,
    /** User-registered transform with no ordering expectation. */
    CUSTOM
}
