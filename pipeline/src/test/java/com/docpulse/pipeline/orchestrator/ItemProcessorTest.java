package com.docpulse.pipeline.orchestrator;

import com.docpulse.pipeline.cache.CacheKeys;
import com.docpulse.pipeline.cache.CacheLayer;
import com.docpulse.pipeline.cache.CacheTier;
import com.docpulse.pipeline.config.PipelineConfig;
import com.docpulse.pipeline.conversion.BackendType;
import com.docpulse.pipeline.metrics.PipelineMetrics;
import com.docpulse.pipeline.model.ExtractionTarget;
import com.docpulse.pipeline.model.SummaryResult;
import com.docpulse.pipeline.model.WorkItem;
import com.docpulse.pipeline.orchestrator.PipelineStubs.StubBackend;
import com.docpulse.pipeline.orchestrator.PipelineStubs.StubFetcher;
import com.docpulse.pipeline.orchestrator.PipelineStubs.StubProvider;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static com.docpulse.pipeline.orchestrator.PipelineStubs.TARGETS;
import static org.junit.jupiter.api.Assertions.*;

class ItemProcessorTest {

    @TempDir
    Path tempDir;

    private StubFetcher fetcher;
    private StubProvider provider;
    private CacheLayer cache;
    private MeterRegistry registry;
    private PipelineMetrics metrics;

    @BeforeEach
    void setUp() {
        fetcher = new StubFetcher(tempDir.resolve("downloads"));
        provider = new StubProvider(0);
        registry = new SimpleMeterRegistry();
        metrics = new PipelineMetrics(registry);
        cache = CacheLayer.fromConfig(PipelineConfig.builder().cacheDir(tempDir.resolve("cache")).build(), metrics);
    }

    private ItemProcessor processor(double score, StubBackend... backends) {
        return PipelineStubs.processor(fetcher, provider, cache,
                new ResourceGovernor("downloads", 2),
                new ResourceGovernor("conversions", 2),
                new ResourceGovernor("summaries", 1),
                tempDir.resolve("artifacts"), metrics, score, backends);
    }

    private double count(String name, String... tags) {
        return registry.get(PipelineMetrics.PREFIX + name).tags(tags).counter().count();
    }

    private static WorkItem item(String id, String abstractText) {
        return new WorkItem(id, null, "Title of " + id, "https://x.org/" + id + ".pdf", abstractText,
                null, null, null);
    }

    @Test
    @DisplayName("Converted text is summarized, cached and stored as an artifact")
    void process_success() throws Exception {
        ItemResult result = processor(0.9).process(item("p1", null), TARGETS);

        assertTrue(result.success());
        assertFalse(result.degraded());
        assertEquals("plain-text", result.backend());
        assertEquals(0.9, result.qualityScore());
        assertEquals("of text of p1.pdf", result.summary().content().get("summary").asText());
        assertEquals("primary", result.summary().provider());
        assertFalse(result.fallbackProviderUsed());

        assertTrue(cache.get(CacheTier.RESULT, CacheKeys.result("p1", TARGETS), SummaryResult.class).isPresent());
        Path artifact = cache.getArtifact(CacheKeys.artifact("p1")).orElseThrow().toPath();
        assertEquals("text of p1.pdf", Files.readString(artifact));
    }

    @Test
    @DisplayName("A cached result short-circuits download, conversion and summarization")
    void process_resultCacheHit() throws Exception {
        ItemProcessor processor = processor(0.9);
        processor.process(item("p1", null), TARGETS);

        ItemResult again = processor.process(item("p1", null), TARGETS);

        assertTrue(again.fromCache());
        assertEquals(ItemResult.CACHE_BACKEND, again.backend());
        assertEquals(1, fetcher.calls.get());
        assertEquals(1, provider.totalCalls());
    }

    @Test
    @DisplayName("A cached artifact skips download and conversion but still summarizes")
    void process_artifactCacheHit() throws Exception {
        processor(0.9).process(item("p1", null), TARGETS);
        cache.clear(CacheTier.RESULT);

        ItemResult again = processor(0.9).process(item("p1", null), TARGETS);

        assertTrue(again.success());
        assertFalse(again.fromCache());
        assertEquals("plain-text", again.backend());
        assertEquals(1, fetcher.calls.get());
        assertEquals(2, provider.totalCalls());
    }

    @Test
    @DisplayName("Ids that differ only in punctuation keep separate artifacts")
    void process_collidingIdsKeepSeparateArtifacts() throws Exception {
        List<ExtractionTarget> otherTargets = List.of(new ExtractionTarget("methods", "Methods used", "text"));
        ItemProcessor processor = processor(0.9);

        processor.process(item("a:b", null), TARGETS);
        processor.process(item("a_b", null), TARGETS);
        ItemResult again = processor.process(item("a:b", null), otherTargets);

        assertTrue(again.success());
        assertEquals("of text of a:b.pdf", again.summary().content().get("summary").asText());
        assertEquals(2, fetcher.calls.get());

        Path colon = cache.getArtifact(CacheKeys.artifact("a:b")).orElseThrow().toPath();
        Path underscore = cache.getArtifact(CacheKeys.artifact("a_b")).orElseThrow().toPath();
        assertNotEquals(colon, underscore);
        assertEquals(CacheKeys.artifact("a:b") + ".md", colon.getFileName().toString());
        assertEquals("text of a:b.pdf", Files.readString(colon));
        assertEquals("text of a_b.pdf", Files.readString(underscore));
        try (Stream<Path> files = Files.list(tempDir.resolve("artifacts"))) {
            assertTrue(files.noneMatch(f -> f.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    @DisplayName("Text below the quality threshold is used but marked degraded and not cached")
    void process_lowQuality() throws Exception {
        ItemResult result = processor(0.2).process(item("p1", null), TARGETS);

        assertTrue(result.success());
        assertTrue(result.degraded());
        assertEquals(0.2, result.qualityScore());
        assertTrue(cache.get(CacheTier.RESULT, CacheKeys.result("p1", TARGETS), SummaryResult.class).isEmpty());
    }

    @Test
    @DisplayName("When every backend fails the abstract is summarized instead")
    void process_conversionFailsDegradesToAbstract() throws Exception {
        ItemProcessor processor = processor(0.9, new StubBackend(BackendType.PDFBOX, true));

        ItemResult result = processor.process(item("p1", "An abstract."), TARGETS);

        assertTrue(result.success());
        assertTrue(result.degraded());
        assertEquals(ItemResult.ABSTRACT_BACKEND, result.backend());
        assertTrue(provider.callsByContent.containsKey("Title of p1\n\nAn abstract."));
    }

    @Test
    @DisplayName("No content and no abstract yields a failed result, not an exception")
    void process_noContent() throws Exception {
        fetcher.unreachable.add("p1");

        ItemResult result = processor(0.9).process(item("p1", null), TARGETS);

        assertFalse(result.success());
        assertTrue(result.error().contains("No content for p1"), result.error());
        assertEquals(0, provider.totalCalls());
    }

    @Test
    @DisplayName("Items without a source location go straight to the abstract")
    void process_noSource() throws Exception {
        WorkItem item = new WorkItem("p2", null, "Only metadata", null, "Abstract text", null, null, null);

        ItemResult result = processor(0.9).process(item, TARGETS);

        assertTrue(result.degraded());
        assertEquals(0, fetcher.calls.get());
    }

    @Test
    @DisplayName("Provider failures become failed results")
    void process_providerFailure() throws Exception {
        provider.rejectedContent.add("text of p1.pdf");

        ItemResult result = processor(0.9).process(item("p1", null), TARGETS);

        assertFalse(result.success());
        assertTrue(result.error().startsWith("All providers failed"), result.error());
    }

    // =========================================================================
    // Metrics
    // =========================================================================

    @Test
    @DisplayName("Items, stages, provider usage and cache operations are recorded as meters")
    void process_recordsMeters() throws Exception {
        ItemProcessor processor = processor(0.9);
        fetcher.unreachable.add("p2");

        processor.process(item("p1", null), TARGETS);
        processor.process(item("p1", null), TARGETS);
        processor.process(item("p2", null), TARGETS);

        assertEquals(2.0, count("items.processed", "status", "success"));
        assertEquals(1.0, count("items.processed", "status", "failed"));
        assertEquals(3, registry.get(PipelineMetrics.PREFIX + "item.duration").tags("stage", "total").timer().count());

        assertEquals(1.0, count("downloads", "status", "success"));
        assertEquals(1.0, count("downloads", "status", "failed"));
        assertEquals(1.0, count("extraction.errors", "error_type", "download"));
        assertEquals(1.0, count("conversions", "backend", "plain-text", "status", "success"));

        assertEquals(1.0, count("llm.requests", "provider", "primary", "status", "success"));
        assertEquals(100.0, count("llm.tokens", "provider", "primary", "type", "input"));
        assertEquals(20.0, count("llm.tokens", "provider", "primary", "type", "output"));

        assertEquals(1.0, count("cache.operations", "cache_type", "result", "operation", "hit"));
        assertEquals(2.0, count("cache.operations", "cache_type", "result", "operation", "miss"));
        assertEquals(1.0, count("cache.operations", "cache_type", "artifact", "operation", "set"));

        assertEquals(0.0, registry.get(PipelineMetrics.PREFIX + "workers.active")
                .tags("worker_type", "downloads").gauge().value());
    }

    @Test
    @DisplayName("Provider failures and degraded items are counted separately")
    void process_recordsProviderErrorsAndDegraded() throws Exception {
        provider.rejectedContent.add("text of p1.pdf");

        processor(0.9).process(item("p1", null), TARGETS);
        processor(0.2).process(item("p3", null), TARGETS);

        assertEquals(1.0, count("extraction.errors", "error_type", "llm"));
        assertEquals(1.0, count("llm.requests", "provider", "primary", "status", "failed"));
        assertEquals(1.0, count("items.processed", "status", "degraded"));
    }
}
