package com.docpulse.pipeline.provider;

import com.docpulse.pipeline.resilience.ErrorClassification;

import java.io.IOException;

/**
 * Retry treatment for provider failures.
 */
public final class ProviderErrors {

    private ProviderErrors() {
    }

    public static ErrorClassification classify(Throwable error) {
        if (error instanceof RateLimitedException) {
            return ErrorClassification.rateLimited(((RateLimitedException) error).getRetryAfter());
        }
        if (error instanceof TransientProviderException || error instanceof IOException) {
            return ErrorClassification.RETRYABLE;
        }
        return ErrorClassification.NON_RETRYABLE;
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}
