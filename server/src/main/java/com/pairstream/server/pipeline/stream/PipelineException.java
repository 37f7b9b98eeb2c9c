package com.pairstream.server.pipeline.stream;

/**
 * Fatal pipeline failure: the skip ratio was exceeded, a sample failed under
 * {@link ErrorPolicy#ABORT}, or an invariant such as uniform batch shape was violated.
 * Ends the epoch.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
