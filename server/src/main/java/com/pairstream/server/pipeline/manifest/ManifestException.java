package com.pairstream.server.pipeline.manifest;

/**
 * The manifest could not be resolved: the record source is unreachable, the query failed,
 * a row is malformed, or the filesystem root does not exist.
 */
public class ManifestException extends Exception {

    public ManifestException(String message) {
        super(message);
    }

    public ManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}
