package com.docpulse.pipeline.conversion;

/**
 * Signals that a backend cannot run at all (missing binary, unsupported
 * input format), as opposed to failing on one particular document.
 */
public class BackendUnavailableException extends RuntimeException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
