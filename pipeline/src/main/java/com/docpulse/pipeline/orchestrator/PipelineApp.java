package com.docpulse.pipeline.orchestrator;

import com.docpulse.pipeline.cache.CacheKeys;
import com.docpulse.pipeline.cache.CacheLayer;
import com.docpulse.pipeline.checkpoint.CheckpointStore;
import com.docpulse.pipeline.client.HttpDocumentFetcher;
import com.docpulse.pipeline.client.HttpSummarizationProvider;
import com.docpulse.pipeline.config.PipelineConfig;
import com.docpulse.pipeline.conversion.ConversionBackends;
import com.docpulse.pipeline.conversion.ExtractionFallbackChain;
import com.docpulse.pipeline.conversion.QualityScorer;
import com.docpulse.pipeline.dedup.DeduplicationIndex;
import com.docpulse.pipeline.discovery.CachingDiscoverySource;
import com.docpulse.pipeline.discovery.DiscoverySource;
import com.docpulse.pipeline.discovery.JsonFileDiscoverySource;
import com.docpulse.pipeline.metrics.PipelineMetrics;
import com.docpulse.pipeline.model.ExtractionTarget;
import com.docpulse.pipeline.model.WorkItem;
import com.docpulse.pipeline.provider.ResilientProviderClient;
import com.docpulse.pipeline.provider.SummarizationProvider;
import com.docpulse.pipeline.ranking.QualityRanker;
import com.docpulse.pipeline.resilience.ResilientCallExecutor;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Command-line entry point: runs the pipeline over items listed in a JSON file.
 *
 * <p>Usage:
 * <pre>
 *   java -jar pipeline.jar items.json "query text"            # run id derived from inputs
 *   java -jar pipeline.jar items.json "query text" --run-id r1
 * </pre>
 * Exits 0 when every item succeeded, 1 otherwise.</p>
 */
public class PipelineApp {

    private static final Logger logger = LoggerFactory.getLogger(PipelineApp.class);

    static final List<ExtractionTarget> DEFAULT_TARGETS = List.of(
            new ExtractionTarget("summary", "Two or three sentence summary of the document", "text"),
            new ExtractionTarget("methodology", "Methods or approach used", "text"),
            new ExtractionTarget("key_findings", "Main results or conclusions", "list"));

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: pipeline <items.json> [query] [--run-id <id>]");
            System.exit(2);
        }
        Path itemsFile = Path.of(args[0]);
        String query = args.length > 1 && !args[1].startsWith("--") ? args[1] : "";
        String runId = parseRunId(args).orElse(defaultRunId(itemsFile, query));
        logger.info("Starting DocPulse pipeline (run: {}, items: {})", runId, itemsFile);

        try {
            PipelineConfig config = PipelineConfig.fromEnvironment();
            PipelineMetrics metrics = new PipelineMetrics(new SimpleMeterRegistry());
            CacheLayer cache = CacheLayer.fromConfig(config, metrics);

            DiscoverySource discovery = new CachingDiscoverySource(new JsonFileDiscoverySource(itemsFile), cache);
            List<WorkItem> items = discovery.discover(query, 0);

            PipelineOrchestrator orchestrator = build(config, cache, metrics);
            RunSummary summary;
            try (PipelineRun run = orchestrator.start(runId, items, query, DEFAULT_TARGETS)) {
                run.forEachRemaining(result -> logger.debug("Result for {}: success={}",
                        result.itemId(), result.success()));
                summary = run.summary();
            }

            printSummary(summary);
            logMeters(metrics);

            if (summary.hasFailures() || summary.state() != RunState.DONE) {
                logger.warn("Pipeline finished with failures");
                System.exit(1);
            }
            logger.info("DocPulse pipeline finished successfully.");
            System.exit(0);

        } catch (Exception e) {
            logger.error("Fatal error during pipeline run", e);
            System.exit(1);
        }
    }

    static PipelineOrchestrator build(PipelineConfig config, CacheLayer cache) {
        return build(config, cache, PipelineMetrics.simple());
    }

    static PipelineOrchestrator build(PipelineConfig config, CacheLayer cache, PipelineMetrics metrics) {
        PipelineConfig.ProviderSettings primarySettings = config.getPrimaryProvider();
        if (primarySettings == null || !primarySettings.isConfigured()) {
            throw new IllegalStateException("PRIMARY_PROVIDER_ENDPOINT must be set");
        }
        SummarizationProvider primary = new HttpSummarizationProvider(primarySettings);
        Optional<SummarizationProvider> fallback = Optional.empty();
        PipelineConfig.ProviderSettings fallbackSettings = config.getFallbackProvider();
        if (config.isFallbackProviderEnabled()) {
            if (fallbackSettings != null && fallbackSettings.isConfigured()) {
                fallback = Optional.of(new HttpSummarizationProvider(fallbackSettings));
            } else {
                logger.warn("FALLBACK_PROVIDER_ENABLED is set but FALLBACK_PROVIDER_ENDPOINT is missing");
            }
        }

        ResilientCallExecutor executor = new ResilientCallExecutor(config.getRetryPolicy());
        ResilientProviderClient providers = new ResilientProviderClient(primary, fallback, executor,
                config.getCircuitBreakerPolicy(), Clock.systemUTC(), config.getMaxTotalCostUsd(), metrics);
        ExtractionFallbackChain chain = new ExtractionFallbackChain(ConversionBackends.defaultChain(),
                new QualityScorer(), executor, config.getMinQualityScore());

        ItemProcessor processor = new ItemProcessor(
                new HttpDocumentFetcher(config.getDownloadDir()),
                chain,
                providers,
                cache,
                executor,
                new ResourceGovernor("downloads", config.getMaxConcurrentDownloads()),
                new ResourceGovernor("conversions", config.getMaxConcurrentConversions()),
                new ResourceGovernor("summaries", config.getMaxConcurrentSummaries()),
                config.getCacheDir().resolve("artifacts"),
                metrics);

        return new PipelineOrchestrator(config, processor,
                new CheckpointStore(config.getCheckpointDir()),
                new DeduplicationIndex(config.getDedupIndexPath()),
                new QualityRanker());
    }

    static Optional<String> parseRunId(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--run-id".equals(args[i])) {
                return Optional.of(args[i + 1]);
            }
        }
        return Optional.empty();
    }

    static String defaultRunId(Path itemsFile, String query) {
        return "run-" + CacheKeys.of(itemsFile.toAbsolutePath().toString(), query).substring(0, 12);
    }

    private static void logMeters(PipelineMetrics metrics) {
        logger.info("=== Pipeline Metrics ===");
        metrics.registry().getMeters().stream()
                .sorted((a, b) -> a.getId().toString().compareTo(b.getId().toString()))
                .forEach(meter -> logger.info("  {} {}", describe(meter.getId()), measurements(meter)));
    }

    private static String describe(Meter.Id id) {
        return id.getName() + id.getTags().stream()
                .map(tag -> tag.getKey() + "=" + tag.getValue())
                .reduce((a, b) -> a + "," + b)
                .map(tags -> "{" + tags + "}")
                .orElse("");
    }

    private static String measurements(Meter meter) {
        StringBuilder sb = new StringBuilder();
        for (Measurement m : meter.measure()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(m.getStatistic().name().toLowerCase()).append('=').append(m.getValue());
        }
        return sb.toString();
    }

    private static void printSummary(RunSummary summary) {
        System.out.println();
        System.out.println("=== DocPulse Pipeline Summary ===");
        System.out.println("Run:      " + summary.runId() + " (" + summary.state() + ")");
        System.out.println("Duration: " + summary.totalDurationMs() + "ms");
        System.out.println("Items:    " + summary.discovered() + " discovered, "
                + summary.duplicates() + " duplicates, " + summary.filteredOut() + " filtered, "
                + summary.resumed() + " resumed");
        System.out.println("Results:  " + summary.completed() + " completed ("
                + summary.degraded() + " degraded, " + summary.cacheHits() + " cached), "
                + summary.failed() + " failed");
        System.out.printf("Cost:     $%.4f (%d tokens)%n", summary.totalCostUsd(), summary.totalTokens());

        if (summary.hasFailures()) {
            System.out.println();
            System.out.println("Failures:");
            summary.failures().forEach(r -> System.out.println("  - " + r.itemId()
                    + " [" + r.title() + "]: " + r.error()));
        }
        System.out.println();
    }
}
