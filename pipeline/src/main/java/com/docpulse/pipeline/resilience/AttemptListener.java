package com.docpulse.pipeline.resilience;

import java.time.Duration;

/**
 * Receives every attempt made by {@link ResilientCallExecutor}, successful or
 * not, for cost and telemetry accounting.
 */
@FunctionalInterface
public interface AttemptListener {

    AttemptListener NONE = attempt -> { };

    void onAttempt(Attempt attempt);

    /**
     * @param number     1-based attempt number
     * @param success    whether the call returned normally
     * @param error      the failure, or {@code null} on success
     * @param nextDelay  sleep scheduled before the next attempt, or {@code null} if none follows
     */
    record Attempt(int number, boolean success, Throwable error, Duration nextDelay) {

        public boolean isRetry() {
            return number > 1;
        }
    }
}
