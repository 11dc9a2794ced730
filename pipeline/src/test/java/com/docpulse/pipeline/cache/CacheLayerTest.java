package com.docpulse.pipeline.cache;

import com.docpulse.pipeline.MutableClock;
import com.docpulse.pipeline.metrics.PipelineMetrics;
import com.docpulse.pipeline.model.ExtractionTarget;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CacheLayerTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private CacheLayer cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        cache = new CacheLayer(tempDir.resolve("cache"), Map.of(CacheTier.QUERY, Duration.ofMinutes(10)), true, clock);
    }

    // =========================================================================
    // Get / put
    // =========================================================================

    @Test
    @DisplayName("Stored values are read back and persisted under the tier directory")
    void putThenGet() {
        cache.put(CacheTier.RESULT, "k1", Map.of("summary", "text"));

        Optional<Map> value = cache.get(CacheTier.RESULT, "k1", Map.class);

        assertTrue(value.isPresent());
        assertEquals("text", value.get().get("summary"));
        assertTrue(Files.isRegularFile(tempDir.resolve("cache").resolve("result").resolve("k1.json")));
        assertEquals(new CacheStats(1, 0), cache.stats(CacheTier.RESULT));
    }

    @Test
    @DisplayName("Hits, misses and sets are reported as cache operation meters per tier")
    void recordsCacheOperationMeters() {
        MeterRegistry registry = new SimpleMeterRegistry();
        CacheLayer metered = new CacheLayer(tempDir.resolve("metered"), Map.of(), true, clock,
                new PipelineMetrics(registry));

        metered.get(CacheTier.RESULT, "k1", Map.class);
        metered.put(CacheTier.RESULT, "k1", Map.of("summary", "text"));
        metered.get(CacheTier.RESULT, "k1", Map.class);
        metered.getArtifact("missing");

        assertEquals(1.0, registry.get("docpulse.cache.operations")
                .tags("cache_type", "result", "operation", "miss").counter().count());
        assertEquals(1.0, registry.get("docpulse.cache.operations")
                .tags("cache_type", "result", "operation", "set").counter().count());
        assertEquals(1.0, registry.get("docpulse.cache.operations")
                .tags("cache_type", "result", "operation", "hit").counter().count());
        assertEquals(1.0, registry.get("docpulse.cache.operations")
                .tags("cache_type", "artifact", "operation", "miss").counter().count());
        assertEquals(new CacheStats(1, 1), metered.stats(CacheTier.RESULT));
    }

    @Test
    @DisplayName("A new cache instance reads entries written by an earlier one")
    void persistsAcrossInstances() {
        cache.put(CacheTier.RESULT, "k1", List.of("a", "b"));

        CacheLayer reopened = new CacheLayer(tempDir.resolve("cache"), Map.of(), true, clock);

        assertEquals(List.of("a", "b"), reopened.get(CacheTier.RESULT, "k1", List.class).orElseThrow());
    }

    @Test
    @DisplayName("Expired entries are never returned and are evicted")
    void expiredEntry_miss() {
        cache.put(CacheTier.QUERY, "q", "value");
        clock.advance(Duration.ofMinutes(9));
        assertTrue(cache.get(CacheTier.QUERY, "q", String.class).isPresent());

        clock.advance(Duration.ofMinutes(1));

        assertTrue(cache.get(CacheTier.QUERY, "q", String.class).isEmpty());
        assertFalse(Files.exists(cache.fileFor(CacheTier.QUERY, "q")));
        assertEquals(1, cache.stats(CacheTier.QUERY).misses());
    }

    @Test
    @DisplayName("Tiers use their own TTLs")
    void tiersIndependent() {
        cache.put(CacheTier.QUERY, "same", "query-value");
        cache.put(CacheTier.ARTIFACT, "same", "artifact-value");

        clock.advance(Duration.ofHours(2));

        assertTrue(cache.get(CacheTier.QUERY, "same", String.class).isEmpty());
        assertEquals("artifact-value", cache.get(CacheTier.ARTIFACT, "same", String.class).orElseThrow());
    }

    @Test
    @DisplayName("Unsafe keys are hashed into file names")
    void unsafeKey_hashed() {
        Path file = cache.fileFor(CacheTier.RESULT, "../escape/attempt");

        assertEquals(tempDir.resolve("cache").resolve("result"), file.getParent());
    }

    @Test
    @DisplayName("Disabled cache misses on reads and ignores writes")
    void disabled() throws Exception {
        CacheLayer off = new CacheLayer(tempDir.resolve("off"), Map.of(), false, clock);
        off.put(CacheTier.RESULT, "k", "v");

        assertFalse(off.isEnabled());
        assertTrue(off.get(CacheTier.RESULT, "k", String.class).isEmpty());
        assertEquals("computed", off.getOrCompute(CacheTier.RESULT, "k", String.class, () -> "computed"));
        assertFalse(Files.exists(tempDir.resolve("off")));
    }

    @Test
    @DisplayName("clear removes only the given tier")
    void clear() {
        cache.put(CacheTier.RESULT, "a", "1");
        cache.put(CacheTier.RESULT, "b", "2");
        cache.put(CacheTier.ARTIFACT, "a", "3");

        assertEquals(2, cache.clear(CacheTier.RESULT));

        assertTrue(cache.get(CacheTier.RESULT, "a", String.class).isEmpty());
        assertTrue(cache.get(CacheTier.ARTIFACT, "a", String.class).isPresent());
    }

    // =========================================================================
    // getOrCompute
    // =========================================================================

    @Test
    @DisplayName("Concurrent getOrCompute for one key runs the loader once")
    void getOrCompute_singleFlight() throws Exception {
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> cache.getOrCompute(CacheTier.RESULT, "hot", String.class, () -> {
                    loads.incrementAndGet();
                    assertTrue(release.await(5, TimeUnit.SECONDS));
                    return "value";
                })));
            }
            Thread.sleep(200);
            release.countDown();

            for (Future<String> future : futures) {
                assertEquals("value", future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, loads.get());
    }

    @Test
    @DisplayName("A failing loader caches nothing and propagates its error")
    void getOrCompute_failure() {
        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> cache.getOrCompute(CacheTier.RESULT, "k", String.class, () -> {
                    throw new IllegalStateException("boom");
                }));

        assertEquals("boom", error.getMessage());
        assertTrue(cache.get(CacheTier.RESULT, "k", String.class).isEmpty());
    }

    // =========================================================================
    // Artifacts
    // =========================================================================

    @Test
    @DisplayName("Artifact refs whose file disappeared are evicted")
    void artifact_staleEvicted() throws Exception {
        Path text = Files.writeString(tempDir.resolve("doc.md"), "# converted");
        cache.putArtifact("doc", ArtifactRef.of(text, "pdfbox", 0.8));

        ArtifactRef ref = cache.getArtifact("doc").orElseThrow();
        assertEquals("pdfbox", ref.backend());
        assertEquals(text.toAbsolutePath(), ref.toPath());

        Files.delete(text);

        assertTrue(cache.getArtifact("doc").isEmpty());
        assertFalse(Files.exists(cache.fileFor(CacheTier.ARTIFACT, "doc")));
    }

    // =========================================================================
    // Keys
    // =========================================================================

    @Test
    @DisplayName("Result keys ignore target order but not target content")
    void resultKey_orderIndependent() {
        ExtractionTarget a = new ExtractionTarget("summary", "Summary", "text");
        ExtractionTarget b = new ExtractionTarget("methods", "Methods", "list");

        assertEquals(CacheKeys.result("x", List.of(a, b)), CacheKeys.result("x", List.of(b, a)));
        assertNotEquals(CacheKeys.result("x", List.of(a)), CacheKeys.result("x", List.of(a, b)));
        assertNotEquals(CacheKeys.result("x", List.of(a)), CacheKeys.result("y", List.of(a)));
    }

    @Test
    @DisplayName("Query keys ignore parameter order and are 64 hex characters")
    void queryKey() {
        Map<String, Object> first = new java.util.LinkedHashMap<>();
        first.put("limit", 10);
        first.put("year", 2024);
        Map<String, Object> second = new java.util.LinkedHashMap<>();
        second.put("year", 2024);
        second.put("limit", 10);

        String key = CacheKeys.query("transformers", first);

        assertEquals(key, CacheKeys.query("transformers", second));
        assertTrue(key.matches("[0-9a-f]{64}"));
    }
}
