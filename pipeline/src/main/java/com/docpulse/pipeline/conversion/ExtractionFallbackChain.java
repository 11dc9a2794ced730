package com.docpulse.pipeline.conversion;

import com.docpulse.pipeline.model.ExtractionAttempt;
import com.docpulse.pipeline.model.WorkItem;
import com.docpulse.pipeline.resilience.ErrorClassification;
import com.docpulse.pipeline.resilience.ErrorClassifier;
import com.docpulse.pipeline.resilience.ResilientCallExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tries conversion backends in priority order and returns the first result
 * whose quality score reaches {@code minQualityScore}. When none does, the
 * best-scoring text seen is returned; when no backend produced text at all,
 * a failed attempt is returned so the caller can degrade.
 *
 * <p>Backends that report themselves unavailable at construction are dropped
 * from the chain for its lifetime.</p>
 */
public class ExtractionFallbackChain {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionFallbackChain.class);

    private final List<ConversionBackend> backends;
    private final QualityScorer scorer;
    private final ResilientCallExecutor executor;
    private final double minQualityScore;
    private final Map<String, BackendUsage> usage = new LinkedHashMap<>();

    public ExtractionFallbackChain(List<ConversionBackend> candidates, QualityScorer scorer,
                                   ResilientCallExecutor executor, double minQualityScore) {
        this.scorer = scorer;
        this.executor = executor;
        this.minQualityScore = minQualityScore;

        List<ConversionBackend> available = new ArrayList<>();
        for (ConversionBackend backend : candidates) {
            if (backend.isAvailable()) {
                available.add(backend);
                usage.put(backend.type().id(), new BackendUsage());
                logger.info("Conversion backend {} available", backend.type().id());
            } else {
                logger.warn("Conversion backend {} unavailable, skipping", backend.type().id());
            }
        }
        this.backends = Collections.unmodifiableList(available);
    }

    public List<ConversionBackend> backends() {
        return backends;
    }

    public double minQualityScore() {
        return minQualityScore;
    }

    /**
     * Converts {@code source} for {@code item}, never throwing for backend failures.
     */
    public ExtractionAttempt convert(WorkItem item, Path source) throws InterruptedException {
        List<ExtractionAttempt> retained = new ArrayList<>();

        for (ConversionBackend backend : backends) {
            Optional<ExtractionAttempt> maybeAttempt = attempt(backend, item, source);
            if (maybeAttempt.isEmpty()) {
                continue;
            }
            ExtractionAttempt attempt = maybeAttempt.get();
            if (attempt.success() && attempt.qualityScore() >= minQualityScore) {
                logger.info("Item {} converted by {} (score {})",
                        item.id(), attempt.backend(), format(attempt.qualityScore()));
                usage.get(attempt.backend()).recordSelected();
                return attempt;
            }
            retained.add(attempt);
        }

        Optional<ExtractionAttempt> best = retained.stream()
                .filter(ExtractionAttempt::success)
                .max(Comparator.comparingDouble(ExtractionAttempt::qualityScore));

        if (best.isPresent()) {
            ExtractionAttempt chosen = best.get();
            logger.warn("Item {}: no backend reached quality {}, using best from {} (score {})",
                    item.id(), minQualityScore, chosen.backend(), format(chosen.qualityScore()));
            usage.get(chosen.backend()).recordSelected();
            return chosen;
        }

        Duration total = retained.stream()
                .map(ExtractionAttempt::duration)
                .reduce(Duration.ZERO, Duration::plus);
        String errors = retained.stream()
                .map(a -> a.backend() + ": " + (a.error() != null ? a.error() : "no text"))
                .reduce((a, b) -> a + "; " + b)
                .orElse("no backend available");
        logger.error("Item {}: all conversion backends failed ({})", item.id(), errors);
        return ExtractionAttempt.failure(ExtractionAttempt.NO_BACKEND,
                "All conversion backends failed: " + errors, total);
    }

    /**
     * Runs one backend through the executor. Empty when the backend turned
     * out to be unavailable, which does not count as an attempt.
     */
    private Optional<ExtractionAttempt> attempt(ConversionBackend backend, WorkItem item, Path source)
            throws InterruptedException {
        String id = backend.type().id();
        BackendUsage counters = usage.get(id);
        long start = System.nanoTime();

        try {
            String text = executor.execute(() -> backend.convert(source), ExtractionFallbackChain::classify,
                    a -> counters.recordAttempt(a.success()));
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            if (text == null || text.isBlank()) {
                logger.debug("Backend {} returned no text for {}", id, item.id());
                return Optional.of(ExtractionAttempt.failure(id, "empty output", elapsed));
            }
            double score = scorer.score(text, item.pageCount());
            logger.debug("Backend {} produced {} chars for {} (score {})",
                    id, text.length(), item.id(), format(score));
            return Optional.of(ExtractionAttempt.success(id, text, score, elapsed));
        } catch (BackendUnavailableException e) {
            logger.warn("Backend {} unavailable for {}: {}", id, item.id(), e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            logger.warn("Backend {} failed for {}: {}", id, item.id(), e.getMessage());
            return Optional.of(ExtractionAttempt.failure(id, describe(e), elapsed));
        }
    }

    public Map<String, BackendUsage.Snapshot> usage() {
        Map<String, BackendUsage.Snapshot> snapshot = new LinkedHashMap<>();
        usage.forEach((id, counters) -> snapshot.put(id, counters.snapshot()));
        return snapshot;
    }

    static ErrorClassification classify(Throwable error) {
        if (error instanceof BackendUnavailableException) {
            return ErrorClassification.NON_RETRYABLE;
        }
        return ErrorClassifier.ioRetryable().classify(error);
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    private static String format(double score) {
        return String.format("%.2f", score);
    }
}
