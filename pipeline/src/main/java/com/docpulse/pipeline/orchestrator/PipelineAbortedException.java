package com.docpulse.pipeline.orchestrator;

/**
 * The run could not continue, typically because progress could not be checkpointed.
 */
public class PipelineAbortedException extends RuntimeException {

    public PipelineAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
