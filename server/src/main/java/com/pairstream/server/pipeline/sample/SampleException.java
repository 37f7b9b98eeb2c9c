package com.pairstream.server.pipeline.sample;

/**
 * Failure confined to a single sample. The streaming engine counts these and skips the
 * sample unless configured to abort.
 */
public abstract class SampleException extends Exception {

    private final String sampleId;

    protected SampleException(String sampleId, String message, Throwable cause) {
        super(message, cause);
        this.sampleId = sampleId;
    }

    public String getSampleId() {
        return sampleId;
    }

    /**
     * Short error kind for logs, e.g. "derivation" or "transform".
     */
    public abstract String kind();
}
