package com.docpulse.pipeline.orchestrator;

import com.docpulse.pipeline.cache.ArtifactRef;
import com.docpulse.pipeline.cache.CacheKeys;
import com.docpulse.pipeline.cache.CacheLayer;
import com.docpulse.pipeline.cache.CacheTier;
import com.docpulse.pipeline.client.DocumentFetcher;
import com.docpulse.pipeline.client.FetchException;
import com.docpulse.pipeline.conversion.BackendUsage;
import com.docpulse.pipeline.conversion.ExtractionFallbackChain;
import com.docpulse.pipeline.metrics.PipelineMetrics;
import com.docpulse.pipeline.model.ExtractionAttempt;
import com.docpulse.pipeline.model.ExtractionTarget;
import com.docpulse.pipeline.model.SummaryResult;
import com.docpulse.pipeline.model.WorkItem;
import com.docpulse.pipeline.provider.CostLimitExceededException;
import com.docpulse.pipeline.provider.ProviderUsage;
import com.docpulse.pipeline.provider.ResilientProviderClient;
import com.docpulse.pipeline.resilience.ResilientCallExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Takes one item through cache lookup, download, conversion and
 * summarization, each stage under its own {@link ResourceGovernor}.
 *
 * <p>Stages:
 * <ol>
 *   <li>Result cache: a hit short-circuits everything.</li>
 *   <li>Artifact cache: a hit skips download and conversion.</li>
 *   <li>Download through the retrying executor.</li>
 *   <li>Conversion through the fallback chain; the text is stored as an artifact.</li>
 *   <li>Summarization; non-degraded results are cached.</li>
 * </ol>
 * When no text can be obtained the item degrades to its title and abstract,
 * or fails if it has no abstract.</p>
 */
public class ItemProcessor {

    private static final Logger logger = LoggerFactory.getLogger(ItemProcessor.class);

    private final DocumentFetcher fetcher;
    private final ExtractionFallbackChain conversionChain;
    private final ResilientProviderClient providerClient;
    private final CacheLayer cache;
    private final ResilientCallExecutor executor;
    private final ResourceGovernor downloads;
    private final ResourceGovernor conversions;
    private final ResourceGovernor summaries;
    private final Path artifactDir;
    private final PipelineMetrics metrics;

    public ItemProcessor(DocumentFetcher fetcher,
                         ExtractionFallbackChain conversionChain,
                         ResilientProviderClient providerClient,
                         CacheLayer cache,
                         ResilientCallExecutor executor,
                         ResourceGovernor downloads,
                         ResourceGovernor conversions,
                         ResourceGovernor summaries,
                         Path artifactDir) {
        this(fetcher, conversionChain, providerClient, cache, executor, downloads, conversions, summaries,
                artifactDir, PipelineMetrics.simple());
    }

    public ItemProcessor(DocumentFetcher fetcher,
                         ExtractionFallbackChain conversionChain,
                         ResilientProviderClient providerClient,
                         CacheLayer cache,
                         ResilientCallExecutor executor,
                         ResourceGovernor downloads,
                         ResourceGovernor conversions,
                         ResourceGovernor summaries,
                         Path artifactDir,
                         PipelineMetrics metrics) {
        this.fetcher = fetcher;
        this.conversionChain = conversionChain;
        this.providerClient = providerClient;
        this.cache = cache;
        this.executor = executor;
        this.downloads = downloads;
        this.conversions = conversions;
        this.summaries = summaries;
        this.artifactDir = artifactDir;
        this.metrics = metrics;

        for (ResourceGovernor governor : List.of(downloads, conversions, summaries)) {
            metrics.bindActiveWorkers(governor.name(), governor, ResourceGovernor::inUse);
        }
    }

    /**
     * Processes {@code item}. Per-item failures are returned as failed
     * results; only interruption escapes.
     */
    public ItemResult process(WorkItem item, List<ExtractionTarget> targets) throws InterruptedException {
        long start = System.nanoTime();
        String resultKey = CacheKeys.result(item.id(), targets);

        Optional<SummaryResult> cached = cache.get(CacheTier.RESULT, resultKey, SummaryResult.class);
        if (cached.isPresent()) {
            logger.info("Result cache hit for {}", item.id());
            Duration took = elapsed(start);
            metrics.itemProcessed(PipelineMetrics.STATUS_SUCCESS, took);
            return ItemResult.fromCache(item, cached.get(), took);
        }

        try {
            Content content = obtainContent(item);
            long summaryStart = System.nanoTime();
            SummaryResult summary = summarize(content, targets);
            metrics.stageDuration("extraction", elapsed(summaryStart));

            if (!content.degraded()) {
                cache.put(CacheTier.RESULT, resultKey, summary);
            }
            logger.info("Item {} completed via {} / {}{}", item.id(), content.backend(),
                    summary.provider(), content.degraded() ? " (degraded)" : "");
            Duration took = elapsed(start);
            metrics.itemProcessed(content.degraded() ? PipelineMetrics.STATUS_DEGRADED : PipelineMetrics.STATUS_SUCCESS,
                    took);
            return ItemResult.success(item, summary, content.backend(), content.qualityScore(),
                    content.degraded(), took);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            logger.error("Item {} failed: {}", item.id(), e.getMessage());
            Duration took = elapsed(start);
            metrics.itemProcessed(PipelineMetrics.STATUS_FAILED, took);
            return ItemResult.failure(item, describe(e), took);
        }
    }

    private SummaryResult summarize(Content content, List<ExtractionTarget> targets) throws Exception {
        try {
            return summaries.execute(() -> providerClient.extract(content.text(), targets));
        } catch (CostLimitExceededException e) {
            metrics.extractionError("cost_limit");
            throw e;
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            metrics.extractionError("llm");
            throw e;
        }
    }

    // -------------------------------------------------------------------------
    // Content acquisition
    // -------------------------------------------------------------------------

    Content obtainContent(WorkItem item) throws Exception {
        String artifactKey = CacheKeys.artifact(item.id());
        Optional<Content> fromArtifact = readArtifact(item, artifactKey);
        if (fromArtifact.isPresent()) {
            return fromArtifact.get();
        }

        String reason = "no source location";
        if (item.hasSource()) {
            long stageStart = System.nanoTime();
            try {
                Path source = downloads.execute(() ->
                        executor.execute(() -> fetcher.fetch(item), FetchException::classify));
                metrics.download(true, elapsed(stageStart));

                stageStart = System.nanoTime();
                ExtractionAttempt attempt = conversions.execute(() -> conversionChain.convert(item, source));
                metrics.conversion(attempt.success() ? attempt.backend() : "none", attempt.success(),
                        elapsed(stageStart));

                if (attempt.success()) {
                    boolean belowThreshold = attempt.qualityScore() < conversionChain.minQualityScore();
                    storeArtifact(item, artifactKey, attempt);
                    return new Content(attempt.text(), attempt.backend(), attempt.qualityScore(), belowThreshold);
                }
                metrics.extractionError("conversion");
                reason = attempt.error();
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                logger.warn("Could not fetch {} from {}: {}", item.id(), item.sourceLocation(), e.getMessage());
                metrics.download(false, elapsed(stageStart));
                metrics.extractionError("download");
                reason = "download failed: " + e.getMessage();
            }
        }

        if (item.hasAbstract()) {
            logger.warn("Item {} degraded to title and abstract ({})", item.id(), reason);
            String text = item.title() + "\n\n" + item.abstractText();
            return new Content(text, ItemResult.ABSTRACT_BACKEND, 0.0, true);
        }
        throw new ContentUnavailableException("No content for " + item.id() + ": " + reason);
    }

    private Optional<Content> readArtifact(WorkItem item, String artifactKey) {
        Optional<ArtifactRef> ref = cache.getArtifact(artifactKey);
        if (ref.isEmpty()) {
            return Optional.empty();
        }
        try {
            String text = Files.readString(ref.get().toPath(), StandardCharsets.UTF_8);
            boolean belowThreshold = ref.get().qualityScore() < conversionChain.minQualityScore();
            logger.debug("Artifact cache hit for {} ({})", item.id(), ref.get().backend());
            return Optional.of(new Content(text, ref.get().backend(), ref.get().qualityScore(), belowThreshold));
        } catch (IOException e) {
            logger.warn("Cached artifact for {} unreadable, converting again: {}", item.id(), e.getMessage());
            cache.invalidate(CacheTier.ARTIFACT, artifactKey);
            return Optional.empty();
        }
    }

    private void storeArtifact(WorkItem item, String artifactKey, ExtractionAttempt attempt) {
        if (!cache.isEnabled()) {
            return;
        }
        try {
            Files.createDirectories(artifactDir);
            // One file per artifact key: ids differing only in punctuation or case never share a file
            Path file = artifactDir.resolve(artifactKey + ".md");
            Path temp = Files.createTempFile(artifactDir, ".artifact-", ".tmp");
            try {
                Files.writeString(temp, attempt.text(), StandardCharsets.UTF_8);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
            cache.putArtifact(artifactKey, ArtifactRef.of(file, attempt.backend(), attempt.qualityScore()));
        } catch (IOException e) {
            logger.warn("Could not store artifact for {}: {}", item.id(), e.getMessage());
        }
    }

    // -------------------------------------------------------------------------
    // Usage for the run summary
    // -------------------------------------------------------------------------

    PipelineMetrics metrics() {
        return metrics;
    }

    public Map<String, ProviderUsage.Snapshot> providerUsage() {
        return providerClient.usage();
    }

    public Map<String, BackendUsage.Snapshot> backendUsage() {
        return conversionChain.usage();
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    record Content(String text, String backend, double qualityScore, boolean degraded) {}
}
