package com.docpulse.pipeline.resilience;

/**
 * Maps an error raised by a wrapped call to its retry treatment.
 */
@FunctionalInterface
public interface ErrorClassifier {

    ErrorClassification classify(Throwable error);

    /**
     * Retries {@link java.io.IOException}s, fails fast on everything else.
     */
    static ErrorClassifier ioRetryable() {
        return error -> error instanceof java.io.IOException
                ? ErrorClassification.RETRYABLE
                : ErrorClassification.NON_RETRYABLE;
    }
}
