package com.docpulse.pipeline.orchestrator;

import com.docpulse.pipeline.checkpoint.CheckpointException;
import com.docpulse.pipeline.checkpoint.CheckpointStore;
import com.docpulse.pipeline.dedup.DeduplicationIndex;
import com.docpulse.pipeline.metrics.PipelineMetrics;
import com.docpulse.pipeline.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A single execution of the pipeline, consumed as a lazy iterator of
 * {@link ItemResult}s in completion order.
 *
 * <p>Work starts on the first call to {@link #hasNext()}. A producer feeds a
 * bounded queue and blocks while it is full; workers take items until they
 * see their sentinel. Completed ids are checkpointed as results are consumed,
 * after every {@code checkpointInterval} successful completions and once more
 * at the end. Failures never trigger a checkpoint write.</p>
 *
 * <p>Not restartable and meant for a single consuming thread;
 * {@link #cancel()}, {@link #state()} and {@link #summary()} may be called
 * from any thread.</p>
 */
public class PipelineRun implements Iterator<ItemResult>, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PipelineRun.class);

    private static final Object POISON = new Object();
    private static final Object WORKER_DONE = new Object();
    private static final long POLL_MS = 100;
    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    private final RunPlan plan;
    private final ItemProcessor processor;
    private final CheckpointStore checkpoints;
    private final DeduplicationIndex dedup;
    private final int checkpointInterval;
    private final int workerCount;
    private final PipelineMetrics metrics;

    private final BlockingQueue<Object> inputQueue;
    private final BlockingQueue<Object> results = new LinkedBlockingQueue<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile RunState state = RunState.INIT;
    private final Instant startedAt = Instant.now();
    private volatile Instant finishedAt;

    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger degraded = new AtomicInteger();
    private final AtomicInteger cacheHits = new AtomicInteger();
    private final AtomicInteger fallbackUses = new AtomicInteger();
    private final List<ItemResult> failures = new CopyOnWriteArrayList<>();

    // Consumer-thread state
    private ExecutorService pool;
    private boolean started;
    private boolean finished;
    private int activeWorkers;
    private int workersFinished;
    private int consumed;
    private ItemResult next;
    private final List<String> uncheckpointed = new ArrayList<>();
    private final List<String> succeededIds = new ArrayList<>();

    PipelineRun(RunPlan plan, ItemProcessor processor, CheckpointStore checkpoints,
                DeduplicationIndex dedup, int queueSize, int checkpointInterval, int workerCount) {
        this.plan = plan;
        this.processor = processor;
        this.checkpoints = checkpoints;
        this.dedup = dedup;
        this.checkpointInterval = checkpointInterval;
        this.workerCount = workerCount;
        this.inputQueue = new ArrayBlockingQueue<>(queueSize);
        this.metrics = processor.metrics();
    }

    public String runId() {
        return plan.runId();
    }

    public RunState state() {
        return state;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    // -------------------------------------------------------------------------
    // Iteration
    // -------------------------------------------------------------------------

    /**
     * Blocks until the next result is available or the run has finished.
     *
     * @throws PipelineAbortedException if progress could not be checkpointed
     *                                  or the consumer was interrupted
     */
    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        ensureStarted();

        try {
            while (workersFinished < activeWorkers) {
                Object taken = results.take();
                if (taken == WORKER_DONE) {
                    workersFinished++;
                    continue;
                }
                ItemResult result = (ItemResult) taken;
                accept(result);
                next = result;
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw abort("Interrupted while waiting for results", e);
        }

        finish();
        return false;
    }

    @Override
    public ItemResult next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Run " + plan.runId() + " has no more results");
        }
        ItemResult result = next;
        next = null;
        return result;
    }

    public Stream<ItemResult> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    /**
     * Stops handing out new items. Items already being processed complete and
     * are still emitted; the run then ends PARTIAL with its checkpoint kept.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            logger.warn("Run {} cancelled", plan.runId());
        }
    }

    /**
     * Cancels the run if it is still going and drains the remaining results
     * so that their progress is checkpointed.
     */
    @Override
    public void close() {
        if (finished) {
            return;
        }
        cancel();
        while (hasNext()) {
            next();
        }
    }

    // -------------------------------------------------------------------------
    // Threads
    // -------------------------------------------------------------------------

    private void ensureStarted() {
        if (started) {
            return;
        }
        started = true;
        state = RunState.RUNNING;
        metrics.pendingItems(plan.pending().size());
        activeWorkers = cancelled.get() ? 0 : workerCount;
        if (activeWorkers == 0) {
            return;
        }

        logger.info("Run {} processing {} items with {} workers",
                plan.runId(), plan.pending().size(), activeWorkers);
        pool = Executors.newFixedThreadPool(activeWorkers + 1, threadFactory(plan.runId()));
        MdcAwareExecutor executor = new MdcAwareExecutor(pool);
        try (MDC.MDCCloseable ignored = MDC.putCloseable("runId", plan.runId())) {
            executor.execute(this::produce);
            for (int i = 0; i < activeWorkers; i++) {
                executor.execute(this::work);
            }
        }
    }

    private void produce() {
        try {
            for (WorkItem item : plan.pending()) {
                if (cancelled.get() || !offerUntilCancelled(item)) {
                    return;
                }
            }
            if (!cancelled.get() && state == RunState.RUNNING) {
                state = RunState.DRAINING;
                logger.info("All {} items queued for run {}", plan.pending().size(), plan.runId());
            }
            for (int i = 0; i < activeWorkers; i++) {
                if (!offerUntilCancelled(POISON)) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled.set(true);
            logger.warn("Producer for run {} interrupted", plan.runId());
        }
    }

    /**
     * Offers {@code element}, waiting while the queue is full. False if the
     * run was cancelled first; workers then exit without a sentinel.
     */
    private boolean offerUntilCancelled(Object element) throws InterruptedException {
        while (!inputQueue.offer(element, POLL_MS, TimeUnit.MILLISECONDS)) {
            if (cancelled.get()) {
                return false;
            }
        }
        metrics.inputQueueDepth(inputQueue.size());
        return true;
    }

    private void work() {
        try {
            while (true) {
                Object taken = inputQueue.poll(POLL_MS, TimeUnit.MILLISECONDS);
                metrics.inputQueueDepth(inputQueue.size());
                if (taken == null) {
                    if (cancelled.get()) {
                        break;
                    }
                    continue;
                }
                if (taken == POISON || cancelled.get()) {
                    break;
                }
                WorkItem item = (WorkItem) taken;
                MDC.put("itemId", item.id());
                try {
                    results.put(processItem(item));
                } finally {
                    MDC.remove("itemId");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Worker for run {} interrupted", plan.runId());
        } finally {
            results.add(WORKER_DONE);
        }
    }

    private ItemResult processItem(WorkItem item) throws InterruptedException {
        try {
            return processor.process(item, plan.targets());
        } catch (RuntimeException e) {
            logger.error("Unexpected error processing {}", item.id(), e);
            return ItemResult.failure(item, e.toString(), Duration.ZERO);
        }
    }

    private static ThreadFactory threadFactory(String runId) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "pipeline-" + runId + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    // -------------------------------------------------------------------------
    // Result accounting and checkpoints
    // -------------------------------------------------------------------------

    private void accept(ItemResult result) {
        consumed++;
        metrics.pendingItems(Math.max(0, plan.pending().size() - consumed));
        if (result.success()) {
            completed.incrementAndGet();
            if (result.degraded()) {
                degraded.incrementAndGet();
            }
            if (result.fromCache()) {
                cacheHits.incrementAndGet();
            }
            if (result.fallbackProviderUsed()) {
                fallbackUses.incrementAndGet();
            }
            uncheckpointed.add(result.itemId());
            succeededIds.add(result.itemId());
        } else {
            failed.incrementAndGet();
            failures.add(result);
        }

        if (uncheckpointed.size() >= checkpointInterval) {
            flushCheckpoint();
        }
    }

    private void flushCheckpoint() {
        if (uncheckpointed.isEmpty()) {
            return;
        }
        try {
            checkpoints.recordCompleted(plan.runId(), uncheckpointed);
            uncheckpointed.clear();
        } catch (CheckpointException e) {
            throw abort("Could not checkpoint run " + plan.runId(), e);
        }
    }

    private void finish() {
        flushCheckpoint();
        shutdownPool();
        metrics.inputQueueDepth(inputQueue.size());

        if (cancelled.get()) {
            state = RunState.PARTIAL;
            logger.warn("Run {} ended early; resume with the same run id to continue", plan.runId());
        } else {
            state = RunState.DONE;
            try {
                checkpoints.clear(plan.runId());
            } catch (CheckpointException e) {
                logger.error("Could not clear checkpoint for run {}", plan.runId(), e);
            }
            updateDedupIndex();
        }
        finished = true;
        finishedAt = Instant.now();
        logSummary(summary());
    }

    private void updateDedupIndex() {
        Map<String, WorkItem> byId = plan.pending().stream()
                .collect(Collectors.toMap(WorkItem::id, Function.identity(), (a, b) -> a));
        List<WorkItem> done = new ArrayList<>(plan.resumed());
        for (String id : succeededIds) {
            WorkItem item = byId.get(id);
            if (item != null) {
                done.add(item);
            }
        }
        if (done.isEmpty()) {
            return;
        }
        try {
            dedup.update(done);
        } catch (UncheckedIOException e) {
            logger.error("Could not update dedup index after run {}", plan.runId(), e);
        }
    }

    private PipelineAbortedException abort(String message, Throwable cause) {
        cancelled.set(true);
        state = RunState.PARTIAL;
        finished = true;
        finishedAt = Instant.now();
        if (pool != null) {
            pool.shutdownNow();
        }
        logger.error("Run {} aborted: {}", plan.runId(), message, cause);
        logSummary(summary());
        return new PipelineAbortedException(message, cause);
    }

    private void shutdownPool() {
        if (pool == null) {
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Worker pool for run {} did not stop in {}s", plan.runId(), SHUTDOWN_WAIT_SECONDS);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    // -------------------------------------------------------------------------
    // Summary
    // -------------------------------------------------------------------------

    public RunSummary summary() {
        Instant end = finishedAt != null ? finishedAt : Instant.now();
        return new RunSummary(
                plan.runId(),
                state,
                plan.discovered(),
                plan.duplicates(),
                plan.filteredOut(),
                plan.resumed().size(),
                plan.pending().size(),
                completed.get(),
                failed.get(),
                degraded.get(),
                cacheHits.get(),
                fallbackUses.get(),
                processor.providerUsage(),
                processor.backendUsage(),
                failures,
                Duration.between(startedAt, end).toMillis());
    }

    private static void logSummary(RunSummary summary) {
        logger.info("=== Pipeline Run Summary ===");
        logger.info("Run: {} ({})", summary.runId(), summary.state());
        logger.info("Total duration: {}ms", summary.totalDurationMs());
        logger.info("Items: discovered={}, duplicates={}, filtered={}, resumed={}, scheduled={}",
                summary.discovered(), summary.duplicates(), summary.filteredOut(),
                summary.resumed(), summary.scheduled());
        logger.info("Results: {} completed ({} degraded, {} from cache, {} via fallback provider), {} failed",
                summary.completed(), summary.degraded(), summary.cacheHits(),
                summary.fallbackProviderUses(), summary.failed());

        summary.providerUsage().forEach((name, usage) ->
                logger.info("  provider {}: requests={}, retries={}, ok={}, failed={}, tokens={}, cost=${}",
                        name, usage.requests(), usage.retries(), usage.successes(), usage.failures(),
                        usage.totalTokens(), String.format("%.4f", usage.costUsd())));
        summary.backendUsage().forEach((name, usage) ->
                logger.info("  backend {}: attempts={}, ok={}, failed={}, selected={}",
                        name, usage.attempts(), usage.successes(), usage.failures(), usage.selected()));

        if (summary.hasFailures()) {
            logger.warn("Run completed with {} failures", summary.failed());
            summary.failures().forEach(r ->
                    logger.warn("  FAILED: {} [{}]: {}", r.itemId(), r.title(), r.error()));
        }
    }
}
