package com.pairstream.server.pipeline.stream;

import com.pairstream.server.pipeline.image.ImagePair;
import com.pairstream.server.pipeline.sample.SampleDescriptor;

/**
 * A sample that made it through derivation, transforms and validation.
 */
public final class ProcessedSample {

    private final SampleDescriptor descriptor;
    private final ImagePair pair;

    public ProcessedSample(SampleDescriptor descriptor, ImagePair pair) {
        this.descriptor = descriptor;
        this.pair = pair;
    }

    public SampleDescriptor getDescriptor() {
        return descriptor;
    }

    public ImagePair getPair() {
        return pair;
    }

    public String id() {
        return descriptor.id();
    }
}
