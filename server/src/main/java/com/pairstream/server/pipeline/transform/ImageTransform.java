package com.pairstream.server.pipeline.transform;

import com.pairstream.server.pipeline.image.ImageTensor;

/**
 * A pure image-to-image function. Implementations must not keep state between calls.
 */
@FunctionalInterface
public interface ImageTransform {
    ImageTensor apply(ImageTensor image);
}
