package com.docpulse.pipeline.resilience;

import java.time.Duration;

/**
 * Retry budget for {@link ResilientCallExecutor}.
 *
 * @param maxAttempts      total attempts including the first call
 * @param baseDelay        delay before the first retry, doubled per retry
 * @param maxDelay         upper bound for any single sleep
 * @param jitterFactor     relative jitter applied to each backoff, in [0, 1)
 * @param rateLimitCeiling rate-limit wait hints above this give up immediately
 */
public record RetryPolicy(
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        double jitterFactor,
        Duration rateLimitCeiling
) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(
            3, Duration.ofSeconds(1), Duration.ofSeconds(60), 0.1, Duration.ofMinutes(5));

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (jitterFactor < 0.0 || jitterFactor >= 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0, 1)");
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
    }

    public RetryPolicy withMaxAttempts(int attempts) {
        return new RetryPolicy(attempts, baseDelay, maxDelay, jitterFactor, rateLimitCeiling);
    }
}
