package com.docpulse.pipeline.orchestrator;

/**
 * Neither converted text nor an abstract is available for an item.
 */
public class ContentUnavailableException extends Exception {

    public ContentUnavailableException(String message) {
        super(message);
    }
}
