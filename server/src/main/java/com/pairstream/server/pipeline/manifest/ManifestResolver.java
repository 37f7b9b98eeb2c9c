package com.pairstream.server.pipeline.manifest;

import com.pairstream.server.pipeline.sample.SampleDescriptor;

import java.util.List;

public interface ManifestResolver {
    /**
     * Resolve the sample descriptors in a stable order. Repeated calls with the same
     * underlying data return the same sequence.
     */
    List<SampleDescriptor> resolve() throws ManifestException;
}
