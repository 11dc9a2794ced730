package com.docpulse.pipeline.checkpoint;

/**
 * A checkpoint could not be read or written.
 */
public class CheckpointException extends RuntimeException {

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
