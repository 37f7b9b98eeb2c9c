package com.pairstream.server.pipeline.transform;

@FunctionalInterface
public interface TransformFactory {
    /**
     * @throws IllegalArgumentException if a required parameter is missing or invalid
     */
    ImageTransform create(TransformParams params);
}
