package com.docpulse.pipeline.resilience;

import java.time.Duration;

/**
 * Thresholds for {@link ProviderHealth}.
 */
public record CircuitBreakerPolicy(
        int failureThreshold,
        int successThreshold,
        Duration cooldown,
        int halfOpenProbeLimit
) {

    public static final CircuitBreakerPolicy DEFAULT =
            new CircuitBreakerPolicy(5, 2, Duration.ofSeconds(60), 1);

    public CircuitBreakerPolicy {
        if (failureThreshold < 1 || successThreshold < 1 || halfOpenProbeLimit < 1) {
            throw new IllegalArgumentException("circuit breaker thresholds must be >= 1");
        }
    }
}
