package com.docpulse.pipeline.provider;

import java.time.Duration;

public class RateLimitedException extends ProviderException {

    private final Duration retryAfter;

    /**
     * @param retryAfter server-provided wait, or {@code null} if none was sent
     */
    public RateLimitedException(String provider, String message, Duration retryAfter) {
        super(provider, message);
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
