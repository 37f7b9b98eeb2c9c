package com.pairstream.server.pipeline.transform;

import com.pairstream.server.pipeline.sample.SampleException;

/**
 * A transform raised while processing one sample.
 */
public class TransformException extends SampleException {

    private final String transformName;

    public TransformException(String sampleId, String transformName, String message, Throwable cause) {
        super(sampleId, message, cause);
        this.transformName = transformName;
    }

    public String getTransformName() {
        return transformName;
    }

    @Override
    public String kind() {
        return "transform";
    }
}
