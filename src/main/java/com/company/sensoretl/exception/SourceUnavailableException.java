package com.company.sensoretl.exception;

/**
 * Source API unreachable, timed out or answered with an error status. Not retried by the pipeline.
 */
public class SourceUnavailableException extends RuntimeException {
    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public SourceUnavailableException(String message) {
        super(message);
    }
}
