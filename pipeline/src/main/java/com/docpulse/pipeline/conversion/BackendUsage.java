package com.docpulse.pipeline.conversion;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe per-backend counters for the run summary.
 */
public class BackendUsage {

    private final AtomicInteger attempts = new AtomicInteger();
    private final AtomicInteger successes = new AtomicInteger();
    private final AtomicInteger failures = new AtomicInteger();
    private final AtomicInteger selected = new AtomicInteger();

    void recordAttempt(boolean success) {
        attempts.incrementAndGet();
        if (success) {
            successes.incrementAndGet();
        } else {
            failures.incrementAndGet();
        }
    }

    void recordSelected() {
        selected.incrementAndGet();
    }

    public Snapshot snapshot() {
        return new Snapshot(attempts.get(), successes.get(), failures.get(), selected.get());
    }

    /**
     * @param attempts  individual calls, retries included
     * @param selected  items whose final text came from this backend
     */
    public record Snapshot(int attempts, int successes, int failures, int selected) {}
}
