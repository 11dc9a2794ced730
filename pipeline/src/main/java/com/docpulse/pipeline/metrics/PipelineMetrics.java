package com.docpulse.pipeline.metrics;

import com.docpulse.pipeline.model.TokenUsage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.ToDoubleFunction;

/**
 * Micrometer meters for pipeline throughput, provider usage, cache
 * performance and worker pool status.
 *
 * <p>Meter names (all prefixed {@value #PREFIX}):
 * <ul>
 *   <li>{@code items.discovered}, {@code items.processed{status}}, {@code item.duration{stage}}</li>
 *   <li>{@code downloads{status}}, {@code conversions{backend,status}}, {@code extraction.errors{error_type}}</li>
 *   <li>{@code llm.requests{provider,status}}, {@code llm.request.duration{provider}},
 *       {@code llm.tokens{provider,type}}, {@code llm.cost{provider}}</li>
 *   <li>{@code cache.operations{cache_type,operation}}</li>
 *   <li>{@code workers.active{worker_type}}, {@code queue.size{queue_name}} gauges</li>
 * </ul></p>
 *
 * <p>Components default to a private {@link SimpleMeterRegistry}; pass a shared
 * registry to collect everything in one place.</p>
 */
public class PipelineMetrics {

    public static final String PREFIX = "docpulse.";

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_DEGRADED = "degraded";
    public static final String STATUS_FAILED = "failed";
    public static final String STATUS_SKIPPED = "skipped";

    private final MeterRegistry meterRegistry;
    private final AtomicInteger inputQueueDepth = new AtomicInteger();
    private final AtomicInteger pendingItems = new AtomicInteger();

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        Gauge.builder(PREFIX + "queue.size", inputQueueDepth, AtomicInteger::get)
                .description("Items waiting in the work queue")
                .tag("queue_name", "input")
                .register(meterRegistry);
        Gauge.builder(PREFIX + "items.pending", pendingItems, AtomicInteger::get)
                .description("Items of the current run not yet processed")
                .register(meterRegistry);
    }

    public static PipelineMetrics simple() {
        return new PipelineMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry registry() {
        return meterRegistry;
    }

    // -------------------------------------------------------------------------
    // Items
    // -------------------------------------------------------------------------

    public void itemsDiscovered(int count) {
        meterRegistry.counter(PREFIX + "items.discovered").increment(count);
    }

    public void itemsSkipped(int count) {
        if (count > 0) {
            meterRegistry.counter(PREFIX + "items.processed", "status", STATUS_SKIPPED).increment(count);
        }
    }

    public void itemProcessed(String status, Duration elapsed) {
        meterRegistry.counter(PREFIX + "items.processed", "status", status).increment();
        stageDuration("total", elapsed);
    }

    public void stageDuration(String stage, Duration elapsed) {
        Timer.builder(PREFIX + "item.duration")
                .description("Time spent per item and stage")
                .tag("stage", stage)
                .register(meterRegistry)
                .record(elapsed);
    }

    public void download(boolean success, Duration elapsed) {
        meterRegistry.counter(PREFIX + "downloads", "status", status(success)).increment();
        stageDuration("download", elapsed);
    }

    public void conversion(String backend, boolean success, Duration elapsed) {
        meterRegistry.counter(PREFIX + "conversions", "backend", backend, "status", status(success)).increment();
        stageDuration("conversion", elapsed);
    }

    /**
     * @param errorType one of {@code download}, {@code conversion}, {@code llm}, {@code cost_limit}
     */
    public void extractionError(String errorType) {
        meterRegistry.counter(PREFIX + "extraction.errors", "error_type", errorType).increment();
    }

    // -------------------------------------------------------------------------
    // Providers
    // -------------------------------------------------------------------------

    public void providerRequest(String provider, boolean success, Duration elapsed) {
        meterRegistry.counter(PREFIX + "llm.requests", "provider", provider, "status", status(success)).increment();
        Timer.builder(PREFIX + "llm.request.duration")
                .tag("provider", provider)
                .register(meterRegistry)
                .record(elapsed);
    }

    public void providerUsage(String provider, TokenUsage usage, double costUsd) {
        meterRegistry.counter(PREFIX + "llm.tokens", "provider", provider, "type", "input")
                .increment(usage.inputTokens());
        meterRegistry.counter(PREFIX + "llm.tokens", "provider", provider, "type", "output")
                .increment(usage.outputTokens());
        Counter.builder(PREFIX + "llm.cost")
                .baseUnit("usd")
                .tag("provider", provider)
                .register(meterRegistry)
                .increment(costUsd);
    }

    // -------------------------------------------------------------------------
    // Cache
    // -------------------------------------------------------------------------

    /**
     * @param operation {@code hit}, {@code miss} or {@code set}
     */
    public void cacheOperation(String cacheType, String operation) {
        meterRegistry.counter(PREFIX + "cache.operations",
                "cache_type", cacheType.toLowerCase(Locale.ROOT), "operation", operation).increment();
    }

    // -------------------------------------------------------------------------
    // Worker pool
    // -------------------------------------------------------------------------

    /**
     * Registers a gauge reading how many holders {@code source} currently has.
     * Only the first source bound per worker type is read.
     */
    public <T> void bindActiveWorkers(String workerType, T source, ToDoubleFunction<T> inUse) {
        Gauge.builder(PREFIX + "workers.active", source, inUse)
                .description("Callers currently holding a permit")
                .tag("worker_type", workerType)
                .strongReference(true)
                .register(meterRegistry);
    }

    public void inputQueueDepth(int depth) {
        inputQueueDepth.set(depth);
    }

    public void pendingItems(int count) {
        pendingItems.set(count);
    }

    private static String status(boolean success) {
        return success ? STATUS_SUCCESS : STATUS_FAILED;
    }
}
