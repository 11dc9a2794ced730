package com.docpulse.pipeline.cache;

import com.docpulse.pipeline.config.PipelineConfig;
import com.docpulse.pipeline.metrics.PipelineMetrics;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Three-tier TTL cache backed by one JSON file per entry under
 * {@code <root>/<tier>/<key>.json}, mirrored in memory.
 *
 * <p>Expired entries are never returned and are evicted when read.
 * {@link #getOrCompute} runs at most one loader per key at a time; concurrent
 * callers for the same key wait for and share its result.</p>
 *
 * <p>Writes are best-effort: a failed write is logged and the value is still
 * served from memory for the rest of the run.</p>
 */
public class CacheLayer {

    private static final Logger logger = LoggerFactory.getLogger(CacheLayer.class);

    private static final Pattern SAFE_KEY = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private final Path root;
    private final Map<CacheTier, Duration> ttls;
    private final boolean enabled;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final PipelineMetrics metrics;

    private final Map<String, CacheEntry> memory = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();
    private final Map<CacheTier, AtomicLong> hits = new EnumMap<>(CacheTier.class);
    private final Map<CacheTier, AtomicLong> misses = new EnumMap<>(CacheTier.class);

    public CacheLayer(Path root, Map<CacheTier, Duration> ttls, boolean enabled, Clock clock) {
        this(root, ttls, enabled, clock, PipelineMetrics.simple());
    }

    public CacheLayer(Path root, Map<CacheTier, Duration> ttls, boolean enabled, Clock clock,
                      PipelineMetrics metrics) {
        this.root = root;
        this.ttls = new EnumMap<>(CacheTier.class);
        for (CacheTier tier : CacheTier.values()) {
            this.ttls.put(tier, ttls.getOrDefault(tier, tier.defaultTtl()));
            hits.put(tier, new AtomicLong());
            misses.put(tier, new AtomicLong());
        }
        this.enabled = enabled;
        this.clock = clock;
        this.metrics = metrics;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public static CacheLayer fromConfig(PipelineConfig config) {
        return fromConfig(config, PipelineMetrics.simple());
    }

    public static CacheLayer fromConfig(PipelineConfig config, PipelineMetrics metrics) {
        return new CacheLayer(config.getCacheDir(),
                Map.of(CacheTier.QUERY, config.getQueryTtl(),
                        CacheTier.ARTIFACT, config.getArtifactTtl(),
                        CacheTier.RESULT, config.getResultTtl()),
                config.isCacheEnabled(),
                Clock.systemUTC(),
                metrics);
    }

    /**
     * A cache that misses on every read and ignores every write.
     */
    public static CacheLayer disabled() {
        return new CacheLayer(Path.of("."), Map.of(), false, Clock.systemUTC());
    }

    public boolean isEnabled() {
        return enabled;
    }

    // -------------------------------------------------------------------------
    // Generic get / put
    // -------------------------------------------------------------------------

    public <T> Optional<T> get(CacheTier tier, String key, Class<T> type) {
        return get(tier, key, objectMapper.constructType(type));
    }

    public <T> Optional<T> get(CacheTier tier, String key, TypeReference<T> type) {
        return get(tier, key, objectMapper.constructType(type));
    }

    private <T> Optional<T> get(CacheTier tier, String key, JavaType type) {
        if (!enabled) {
            return Optional.empty();
        }
        Optional<JsonNode> node = lookup(tier, key);
        if (node.isEmpty()) {
            recordMiss(tier);
            return Optional.empty();
        }
        try {
            T value = objectMapper.convertValue(node.get(), type);
            recordHit(tier);
            return Optional.ofNullable(value);
        } catch (IllegalArgumentException e) {
            logger.warn("Cached {} entry {} does not match {}, evicting: {}",
                    tier, key, type, e.getMessage());
            invalidate(tier, key);
            recordMiss(tier);
            return Optional.empty();
        }
    }

    public void put(CacheTier tier, String key, Object value) {
        if (!enabled) {
            return;
        }
        Instant now = clock.instant();
        CacheEntry entry = new CacheEntry(key, tier, now, now.plus(ttls.get(tier)),
                objectMapper.valueToTree(value));
        memory.put(id(tier, key), entry);
        write(tier, key, entry);
        metrics.cacheOperation(tier.directory(), "set");
    }

    /**
     * Returns the cached value, or runs {@code loader}, caches and returns its
     * result. At most one loader runs per key at a time.
     */
    public <T> T getOrCompute(CacheTier tier, String key, Class<T> type, Callable<T> loader) throws Exception {
        if (!enabled) {
            return loader.call();
        }
        Optional<T> cached = get(tier, key, type);
        if (cached.isPresent()) {
            return cached.get();
        }

        String id = id(tier, key);
        CompletableFuture<Object> mine = new CompletableFuture<>();
        CompletableFuture<Object> existing = inFlight.putIfAbsent(id, mine);
        if (existing != null) {
            logger.debug("Waiting for in-flight computation of {} {}", tier, key);
            return type.cast(await(existing));
        }

        try {
            Optional<JsonNode> raced = lookup(tier, key);
            T value = raced.isPresent()
                    ? objectMapper.convertValue(raced.get(), type)
                    : loader.call();
            if (raced.isEmpty()) {
                put(tier, key, value);
            }
            mine.complete(value);
            return value;
        } catch (Exception e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(id, mine);
        }
    }

    private static Object await(CompletableFuture<Object> future) throws Exception {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw e;
        }
    }

    public boolean invalidate(CacheTier tier, String key) {
        boolean inMemory = memory.remove(id(tier, key)) != null;
        try {
            return Files.deleteIfExists(fileFor(tier, key)) || inMemory;
        } catch (IOException e) {
            logger.warn("Could not delete cache file for {} {}: {}", tier, key, e.getMessage());
            return inMemory;
        }
    }

    /**
     * Removes every entry of {@code tier}, returning how many files were deleted.
     */
    public int clear(CacheTier tier) {
        memory.keySet().removeIf(id -> id.startsWith(tier.directory() + "/"));
        Path dir = root.resolve(tier.directory());
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        int deleted = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*.json")) {
            for (Path file : files) {
                Files.deleteIfExists(file);
                deleted++;
            }
        } catch (IOException e) {
            logger.warn("Could not clear {} cache in {}: {}", tier, dir, e.getMessage());
        }
        logger.info("Cleared {} entries from {} cache", deleted, tier);
        return deleted;
    }

    // -------------------------------------------------------------------------
    // Artifacts
    // -------------------------------------------------------------------------

    /**
     * Cached artifact for {@code key}, only if the file it points at still
     * exists; a stale reference is evicted and reported as a miss.
     */
    public Optional<ArtifactRef> getArtifact(String key) {
        if (!enabled) {
            return Optional.empty();
        }
        Optional<JsonNode> node = lookup(CacheTier.ARTIFACT, key);
        if (node.isEmpty()) {
            recordMiss(CacheTier.ARTIFACT);
            return Optional.empty();
        }
        ArtifactRef ref = objectMapper.convertValue(node.get(), ArtifactRef.class);
        if (ref == null || ref.path() == null || !Files.isRegularFile(ref.toPath())) {
            logger.info("Artifact for {} no longer on disk, evicting", key);
            invalidate(CacheTier.ARTIFACT, key);
            recordMiss(CacheTier.ARTIFACT);
            return Optional.empty();
        }
        recordHit(CacheTier.ARTIFACT);
        return Optional.of(ref);
    }

    public void putArtifact(String key, ArtifactRef ref) {
        put(CacheTier.ARTIFACT, key, ref);
    }

    private void recordHit(CacheTier tier) {
        hits.get(tier).incrementAndGet();
        metrics.cacheOperation(tier.directory(), "hit");
    }

    private void recordMiss(CacheTier tier) {
        misses.get(tier).incrementAndGet();
        metrics.cacheOperation(tier.directory(), "miss");
    }

    public CacheStats stats(CacheTier tier) {
        return new CacheStats(hits.get(tier).get(), misses.get(tier).get());
    }

    // -------------------------------------------------------------------------
    // Storage
    // -------------------------------------------------------------------------

    private Optional<JsonNode> lookup(CacheTier tier, String key) {
        String id = id(tier, key);
        CacheEntry entry = memory.get(id);
        if (entry == null) {
            entry = read(tier, key);
            if (entry != null) {
                memory.put(id, entry);
            }
        }
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            logger.debug("{} cache entry {} expired at {}", tier, key, entry.expiresAt());
            invalidate(tier, key);
            return Optional.empty();
        }
        return Optional.ofNullable(entry.value());
    }

    private CacheEntry read(CacheTier tier, String key) {
        Path file = fileFor(tier, key);
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            return objectMapper.readValue(file.toFile(), CacheEntry.class);
        } catch (IOException e) {
            logger.warn("Corrupt cache file {}, evicting: {}", file, e.getMessage());
            invalidate(tier, key);
            return null;
        }
    }

    private void write(CacheTier tier, String key, CacheEntry entry) {
        Path file = fileFor(tier, key);
        try {
            Files.createDirectories(file.getParent());
            Path temp = Files.createTempFile(file.getParent(), ".entry-", ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), entry);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            logger.warn("Could not persist {} cache entry {}: {}", tier, key, e.getMessage());
        }
    }

    Path fileFor(CacheTier tier, String key) {
        String name = SAFE_KEY.matcher(key).matches() ? key : CacheKeys.sha256(key);
        return root.resolve(tier.directory()).resolve(name + ".json");
    }

    private static String id(CacheTier tier, String key) {
        return tier.directory() + "/" + key;
    }
}
