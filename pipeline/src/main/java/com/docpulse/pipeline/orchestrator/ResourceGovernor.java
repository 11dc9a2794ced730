package com.docpulse.pipeline.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Caps how many callers use one resource class (downloads, conversions,
 * summaries) at once. Permits are released even when the call fails.
 */
public class ResourceGovernor {

    private static final Logger logger = LoggerFactory.getLogger(ResourceGovernor.class);

    private final String name;
    private final int capacity;
    private final Semaphore permits;
    private final AtomicInteger inUse = new AtomicInteger();
    private final AtomicInteger peakInUse = new AtomicInteger();

    public ResourceGovernor(String name, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException(name + " capacity must be >= 1");
        }
        this.name = name;
        this.capacity = capacity;
        this.permits = new Semaphore(capacity, true);
    }

    public <T> T execute(Callable<T> operation) throws Exception {
        if (!permits.tryAcquire()) {
            logger.debug("Waiting for {} permit ({} in use)", name, inUse.get());
            permits.acquire();
        }
        int current = inUse.incrementAndGet();
        peakInUse.accumulateAndGet(current, Math::max);
        try {
            return operation.call();
        } finally {
            inUse.decrementAndGet();
            permits.release();
        }
    }

    public String name() {
        return name;
    }

    public int capacity() {
        return capacity;
    }

    public int inUse() {
        return inUse.get();
    }

    /**
     * Highest number of concurrent holders observed since construction.
     */
    public int peakInUse() {
        return peakInUse.get();
    }
}
