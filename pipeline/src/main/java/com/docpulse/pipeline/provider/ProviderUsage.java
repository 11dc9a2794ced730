package com.docpulse.pipeline.provider;

import com.docpulse.pipeline.model.TokenUsage;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Thread-safe usage counters for one provider.
 */
public class ProviderUsage {

    private final AtomicInteger requests = new AtomicInteger();
    private final AtomicInteger retries = new AtomicInteger();
    private final AtomicInteger successes = new AtomicInteger();
    private final AtomicInteger failures = new AtomicInteger();
    private final AtomicInteger fallbackActivations = new AtomicInteger();
    private final AtomicLong inputTokens = new AtomicLong();
    private final AtomicLong outputTokens = new AtomicLong();
    private final DoubleAdder costUsd = new DoubleAdder();

    void recordRequest(boolean retry) {
        requests.incrementAndGet();
        if (retry) {
            retries.incrementAndGet();
        }
    }

    void recordSuccess(TokenUsage usage, double cost) {
        successes.incrementAndGet();
        inputTokens.addAndGet(usage.inputTokens());
        outputTokens.addAndGet(usage.outputTokens());
        costUsd.add(cost);
    }

    void recordFailure() {
        failures.incrementAndGet();
    }

    void recordFallbackActivation() {
        fallbackActivations.incrementAndGet();
    }

    double cost() {
        return costUsd.sum();
    }

    public Snapshot snapshot() {
        return new Snapshot(requests.get(), retries.get(), successes.get(), failures.get(),
                fallbackActivations.get(), inputTokens.get(), outputTokens.get(), costUsd.sum());
    }

    /**
     * @param requests             individual calls, retries included
     * @param successes            logical extractions that returned a result
     * @param failures             logical extractions that ended in an error
     * @param fallbackActivations  times this provider was used in place of the primary
     */
    public record Snapshot(int requests, int retries, int successes, int failures,
                           int fallbackActivations, long inputTokens, long outputTokens,
                           double costUsd) {

        public long totalTokens() {
            return inputTokens + outputTokens;
        }
    }
}
