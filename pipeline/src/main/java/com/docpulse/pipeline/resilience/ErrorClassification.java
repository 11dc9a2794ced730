package com.docpulse.pipeline.resilience;

import java.time.Duration;

/**
 * How {@link ResilientCallExecutor} should treat a failed attempt.
 */
public record ErrorClassification(Kind kind, Duration waitHint) {

    public enum Kind {
        NON_RETRYABLE,
        RETRYABLE,
        RATE_LIMITED
    }

    public static final ErrorClassification NON_RETRYABLE = new ErrorClassification(Kind.NON_RETRYABLE, null);
    public static final ErrorClassification RETRYABLE = new ErrorClassification(Kind.RETRYABLE, null);

    /**
     * @param waitHint server-provided wait, or {@code null} to use the computed backoff
     */
    public static ErrorClassification rateLimited(Duration waitHint) {
        return new ErrorClassification(Kind.RATE_LIMITED, waitHint);
    }
}
