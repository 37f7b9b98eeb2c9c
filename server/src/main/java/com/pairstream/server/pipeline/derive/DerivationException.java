package com.pairstream.server.pipeline.derive;

import com.pairstream.server.pipeline.sample.SampleException;

/**
 * A sample's pair could not be derived: unreadable or corrupt image, decode timeout, or an
 * invalid crop rectangle.
 */
public class DerivationException extends SampleException {

    public DerivationException(String sampleId, String message) {
        super(sampleId, message, null);
    }

    public DerivationException(String sampleId, String message, Throwable cause) {
        super(sampleId, message, cause);
    }

    @Override
    public String kind() {
        return "derivation";
    }
}
