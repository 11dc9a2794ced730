package com.docpulse.pipeline.client;

import com.docpulse.pipeline.resilience.ErrorClassification;

import java.io.IOException;

/**
 * A document could not be fetched. {@code statusCode} is 0 when the failure
 * did not come from an HTTP response.
 */
public class FetchException extends IOException {

    private final int statusCode;
    private final boolean retryable;

    public FetchException(String message, int statusCode, boolean retryable) {
        super(message);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Retries retryable fetch failures and any other I/O error.
     */
    public static ErrorClassification classify(Throwable error) {
        if (error instanceof FetchException) {
            return ((FetchException) error).isRetryable()
                    ? ErrorClassification.RETRYABLE
                    : ErrorClassification.NON_RETRYABLE;
        }
        return error instanceof IOException
                ? ErrorClassification.RETRYABLE
                : ErrorClassification.NON_RETRYABLE;
    }
}
