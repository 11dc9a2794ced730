package com.docpulse.pipeline.config;

import com.docpulse.pipeline.resilience.CircuitBreakerPolicy;
import com.docpulse.pipeline.resilience.RetryPolicy;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Pipeline configuration. Every option is read from the process environment
 * first, then from a {@code .env} file (via dotenv-java), then falls back to
 * its default. Invalid values are collected and reported together.
 */
public class PipelineConfig {

    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    private final int maxConcurrentDownloads;
    private final int maxConcurrentConversions;
    private final int maxConcurrentSummaries;
    private final int queueSize;
    private final int checkpointInterval;
    private final double minQualityScore;
    private final RetryPolicy retryPolicy;
    private final CircuitBreakerPolicy circuitBreakerPolicy;
    private final boolean fallbackProviderEnabled;
    private final boolean cacheEnabled;
    private final Path cacheDir;
    private final Duration queryTtl;
    private final Duration artifactTtl;
    private final Duration resultTtl;
    private final Path checkpointDir;
    private final Path dedupIndexPath;
    private final Path downloadDir;
    private final double maxTotalCostUsd;
    private final int minPopularity;
    private final Integer minYear;
    private final Integer maxYear;
    private final ProviderSettings primaryProvider;
    private final ProviderSettings fallbackProvider;

    /**
     * Endpoint, model and credentials of one summarization provider.
     */
    public record ProviderSettings(String name, String endpoint, String model, String apiKey,
                                   double inputCostPerMillion, double outputCostPerMillion) {

        public boolean isConfigured() {
            return endpoint != null && !endpoint.isBlank();
        }
    }

    private PipelineConfig(Builder b) {
        this.maxConcurrentDownloads = b.maxConcurrentDownloads;
        this.maxConcurrentConversions = b.maxConcurrentConversions;
        this.maxConcurrentSummaries = b.maxConcurrentSummaries;
        this.queueSize = b.queueSize;
        this.checkpointInterval = b.checkpointInterval;
        this.minQualityScore = b.minQualityScore;
        this.retryPolicy = b.retryPolicy;
        this.circuitBreakerPolicy = b.circuitBreakerPolicy;
        this.fallbackProviderEnabled = b.fallbackProviderEnabled;
        this.cacheEnabled = b.cacheEnabled;
        this.cacheDir = b.cacheDir;
        this.queryTtl = b.queryTtl;
        this.artifactTtl = b.artifactTtl;
        this.resultTtl = b.resultTtl;
        this.checkpointDir = b.checkpointDir;
        this.dedupIndexPath = b.dedupIndexPath;
        this.downloadDir = b.downloadDir;
        this.maxTotalCostUsd = b.maxTotalCostUsd;
        this.minPopularity = b.minPopularity;
        this.minYear = b.minYear;
        this.maxYear = b.maxYear;
        this.primaryProvider = b.primaryProvider;
        this.fallbackProvider = b.fallbackProvider;

        validate();
    }

    public static PipelineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from environment variables and an optional {@code .env} file.
     */
    public static PipelineConfig fromEnvironment() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
        return fromSource(key -> resolve(dotenv, key));
    }

    /**
     * Loads configuration from an arbitrary key lookup. Keys that resolve to
     * {@code null} or blank keep their defaults.
     */
    static PipelineConfig fromSource(Function<String, String> source) {
        EnvReader env = new EnvReader(source);
        Builder b = builder();

        b.maxConcurrentDownloads(env.integer("PIPELINE_MAX_CONCURRENT_DOWNLOADS", b.maxConcurrentDownloads));
        b.maxConcurrentConversions(env.integer("PIPELINE_MAX_CONCURRENT_CONVERSIONS", b.maxConcurrentConversions));
        b.maxConcurrentSummaries(env.integer("PIPELINE_MAX_CONCURRENT_SUMMARIES", b.maxConcurrentSummaries));
        b.queueSize(env.integer("PIPELINE_QUEUE_SIZE", b.queueSize));
        b.checkpointInterval(env.integer("PIPELINE_CHECKPOINT_INTERVAL", b.checkpointInterval));
        b.minQualityScore(env.decimal("PIPELINE_MIN_QUALITY_SCORE", b.minQualityScore));

        RetryPolicy retry = RetryPolicy.DEFAULT;
        int maxAttempts = env.integer("RETRY_MAX_ATTEMPTS", retry.maxAttempts());
        Duration baseDelay = env.duration("RETRY_BASE_DELAY", retry.baseDelay());
        Duration maxDelay = env.duration("RETRY_MAX_DELAY", retry.maxDelay());
        double jitter = env.decimal("RETRY_JITTER_FACTOR", retry.jitterFactor());
        Duration ceiling = env.duration("RETRY_RATE_LIMIT_CEILING", retry.rateLimitCeiling());

        CircuitBreakerPolicy breaker = CircuitBreakerPolicy.DEFAULT;
        int failureThreshold = env.integer("CIRCUIT_BREAKER_FAILURE_THRESHOLD", breaker.failureThreshold());
        int successThreshold = env.integer("CIRCUIT_BREAKER_SUCCESS_THRESHOLD", breaker.successThreshold());
        Duration cooldown = env.duration("CIRCUIT_BREAKER_COOLDOWN", breaker.cooldown());
        int probes = env.integer("CIRCUIT_BREAKER_HALF_OPEN_PROBES", breaker.halfOpenProbeLimit());

        b.fallbackProviderEnabled(env.bool("FALLBACK_PROVIDER_ENABLED", b.fallbackProviderEnabled));
        b.cacheEnabled(env.bool("CACHE_ENABLED", b.cacheEnabled));
        b.cacheDir(env.path("CACHE_DIR", b.cacheDir));
        b.queryTtl(env.duration("CACHE_TTL_QUERY", b.queryTtl));
        b.artifactTtl(env.duration("CACHE_TTL_ARTIFACT", b.artifactTtl));
        b.resultTtl(env.duration("CACHE_TTL_RESULT", b.resultTtl));
        b.checkpointDir(env.path("CHECKPOINT_DIR", b.checkpointDir));
        b.dedupIndexPath(env.path("DEDUP_INDEX_PATH", b.dedupIndexPath));
        b.downloadDir(env.path("DOWNLOAD_DIR", b.downloadDir));
        b.maxTotalCostUsd(env.decimal("COST_MAX_TOTAL_USD", b.maxTotalCostUsd));
        b.minPopularity(env.integer("FILTER_MIN_POPULARITY", b.minPopularity));
        b.minYear(env.optionalInteger("FILTER_MIN_YEAR"));
        b.maxYear(env.optionalInteger("FILTER_MAX_YEAR"));

        b.primaryProvider(new ProviderSettings(
                env.string("PRIMARY_PROVIDER_NAME", "primary"),
                env.string("PRIMARY_PROVIDER_ENDPOINT", null),
                env.string("PRIMARY_PROVIDER_MODEL", null),
                env.string("PRIMARY_PROVIDER_API_KEY", null),
                env.decimal("PRIMARY_PROVIDER_INPUT_COST_PER_MTOK", 0.0),
                env.decimal("PRIMARY_PROVIDER_OUTPUT_COST_PER_MTOK", 0.0)));
        b.fallbackProvider(new ProviderSettings(
                env.string("FALLBACK_PROVIDER_NAME", "fallback"),
                env.string("FALLBACK_PROVIDER_ENDPOINT", null),
                env.string("FALLBACK_PROVIDER_MODEL", null),
                env.string("FALLBACK_PROVIDER_API_KEY", null),
                env.decimal("FALLBACK_PROVIDER_INPUT_COST_PER_MTOK", 0.0),
                env.decimal("FALLBACK_PROVIDER_OUTPUT_COST_PER_MTOK", 0.0)));

        env.throwIfInvalid();

        try {
            b.retryPolicy(new RetryPolicy(maxAttempts, baseDelay, maxDelay, jitter, ceiling));
            b.circuitBreakerPolicy(new CircuitBreakerPolicy(failureThreshold, successThreshold, cooldown, probes));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid resilience configuration: " + e.getMessage(), e);
        }

        PipelineConfig config = b.build();
        logger.info("Configuration loaded: downloads={}, conversions={}, summaries={}, queueSize={}, "
                        + "fallbackProvider={}, cacheEnabled={}",
                config.maxConcurrentDownloads, config.maxConcurrentConversions,
                config.maxConcurrentSummaries, config.queueSize,
                config.fallbackProviderEnabled, config.cacheEnabled);
        return config;
    }

    private void validate() {
        StringBuilder invalid = new StringBuilder();
        if (maxConcurrentDownloads < 1) invalid.append("PIPELINE_MAX_CONCURRENT_DOWNLOADS ");
        if (maxConcurrentConversions < 1) invalid.append("PIPELINE_MAX_CONCURRENT_CONVERSIONS ");
        if (maxConcurrentSummaries < 1) invalid.append("PIPELINE_MAX_CONCURRENT_SUMMARIES ");
        if (queueSize < 1) invalid.append("PIPELINE_QUEUE_SIZE ");
        if (checkpointInterval < 1) invalid.append("PIPELINE_CHECKPOINT_INTERVAL ");
        if (minQualityScore < 0.0 || minQualityScore > 1.0) invalid.append("PIPELINE_MIN_QUALITY_SCORE ");
        if (maxTotalCostUsd < 0.0) invalid.append("COST_MAX_TOTAL_USD ");
        if (minYear != null && maxYear != null && minYear > maxYear) invalid.append("FILTER_MIN_YEAR ");

        if (!invalid.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid configuration values: " + invalid.toString().trim());
        }
    }

    private static String resolve(Dotenv dotenv, String key) {
        String envValue = System.getenv(key);
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }
        return dotenv.get(key);
    }

    /**
     * Parses ISO-8601 durations ({@code PT30S}) or plain seconds ({@code 1.5}).
     */
    static Duration parseDuration(String raw) {
        String value = raw.trim();
        if (value.startsWith("P") || value.startsWith("p")) {
            return Duration.parse(value.toUpperCase());
        }
        double seconds = Double.parseDouble(value);
        return Duration.ofMillis(Math.round(seconds * 1000));
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    public int getMaxConcurrentDownloads() {
        return maxConcurrentDownloads;
    }

    public int getMaxConcurrentConversions() {
        return maxConcurrentConversions;
    }

    public int getMaxConcurrentSummaries() {
        return maxConcurrentSummaries;
    }

    public int getQueueSize() {
        return queueSize;
    }

    public int getCheckpointInterval() {
        return checkpointInterval;
    }

    public double getMinQualityScore() {
        return minQualityScore;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public CircuitBreakerPolicy getCircuitBreakerPolicy() {
        return circuitBreakerPolicy;
    }

    public boolean isFallbackProviderEnabled() {
        return fallbackProviderEnabled;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public Path getCacheDir() {
        return cacheDir;
    }

    public Duration getQueryTtl() {
        return queryTtl;
    }

    public Duration getArtifactTtl() {
        return artifactTtl;
    }

    public Duration getResultTtl() {
        return resultTtl;
    }

    public Path getCheckpointDir() {
        return checkpointDir;
    }

    public Path getDedupIndexPath() {
        return dedupIndexPath;
    }

    public Path getDownloadDir() {
        return downloadDir;
    }

    /**
     * Total spend ceiling across providers; 0 means unlimited.
     */
    public double getMaxTotalCostUsd() {
        return maxTotalCostUsd;
    }

    public int getMinPopularity() {
        return minPopularity;
    }

    public Integer getMinYear() {
        return minYear;
    }

    public Integer getMaxYear() {
        return maxYear;
    }

    public ProviderSettings getPrimaryProvider() {
        return primaryProvider;
    }

    public ProviderSettings getFallbackProvider() {
        return fallbackProvider;
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder {
        private int maxConcurrentDownloads = 5;
        private int maxConcurrentConversions = 3;
        private int maxConcurrentSummaries = 2;
        private int queueSize = 100;
        private int checkpointInterval = 10;
        private double minQualityScore = 0.5;
        private RetryPolicy retryPolicy = RetryPolicy.DEFAULT;
        private CircuitBreakerPolicy circuitBreakerPolicy = CircuitBreakerPolicy.DEFAULT;
        private boolean fallbackProviderEnabled = false;
        private boolean cacheEnabled = true;
        private Path cacheDir = Path.of("cache");
        private Duration queryTtl = Duration.ofHours(1);
        private Duration artifactTtl = Duration.ofDays(7);
        private Duration resultTtl = Duration.ofDays(30);
        private Path checkpointDir = Path.of("checkpoints");
        private Path dedupIndexPath = Path.of("dedup", "index.json");
        private Path downloadDir = Path.of("downloads");
        private double maxTotalCostUsd = 0.0;
        private int minPopularity = 0;
        private Integer minYear;
        private Integer maxYear;
        private ProviderSettings primaryProvider =
                new ProviderSettings("primary", null, null, null, 0.0, 0.0);
        private ProviderSettings fallbackProvider =
                new ProviderSettings("fallback", null, null, null, 0.0, 0.0);

        private Builder() {
        }

        public Builder maxConcurrentDownloads(int value) {
            this.maxConcurrentDownloads = value;
            return this;
        }

        public Builder maxConcurrentConversions(int value) {
            this.maxConcurrentConversions = value;
            return this;
        }

        public Builder maxConcurrentSummaries(int value) {
            this.maxConcurrentSummaries = value;
            return this;
        }

        public Builder queueSize(int value) {
            this.queueSize = value;
            return this;
        }

        public Builder checkpointInterval(int value) {
            this.checkpointInterval = value;
            return this;
        }

        public Builder minQualityScore(double value) {
            this.minQualityScore = value;
            return this;
        }

        public Builder retryPolicy(RetryPolicy value) {
            this.retryPolicy = value;
            return this;
        }

        public Builder circuitBreakerPolicy(CircuitBreakerPolicy value) {
            this.circuitBreakerPolicy = value;
            return this;
        }

        public Builder fallbackProviderEnabled(boolean value) {
            this.fallbackProviderEnabled = value;
            return this;
        }

        public Builder cacheEnabled(boolean value) {
            this.cacheEnabled = value;
            return this;
        }

        public Builder cacheDir(Path value) {
            this.cacheDir = value;
            return this;
        }

        public Builder queryTtl(Duration value) {
            this.queryTtl = value;
            return this;
        }

        public Builder artifactTtl(Duration value) {
            this.artifactTtl = value;
            return this;
        }

        public Builder resultTtl(Duration value) {
            this.resultTtl = value;
            return this;
        }

        public Builder checkpointDir(Path value) {
            this.checkpointDir = value;
            return this;
        }

        public Builder dedupIndexPath(Path value) {
            this.dedupIndexPath = value;
            return this;
        }

        public Builder downloadDir(Path value) {
            this.downloadDir = value;
            return this;
        }

        public Builder maxTotalCostUsd(double value) {
            this.maxTotalCostUsd = value;
            return this;
        }

        public Builder minPopularity(int value) {
            this.minPopularity = value;
            return this;
        }

        public Builder minYear(Integer value) {
            this.minYear = value;
            return this;
        }

        public Builder maxYear(Integer value) {
            this.maxYear = value;
            return this;
        }

        public Builder primaryProvider(ProviderSettings value) {
            this.primaryProvider = value;
            return this;
        }

        public Builder fallbackProvider(ProviderSettings value) {
            this.fallbackProvider = value;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(this);
        }
    }

    /**
     * Typed reads over a raw key lookup, remembering every key that failed to parse.
     */
    private static final class EnvReader {
        private final Function<String, String> source;
        private final List<String> invalidKeys = new ArrayList<>();

        EnvReader(Function<String, String> source) {
            this.source = source;
        }

        private String raw(String key) {
            String value = source.apply(key);
            return value == null || value.isBlank() ? null : value.trim();
        }

        String string(String key, String fallback) {
            String value = raw(key);
            return value != null ? value : fallback;
        }

        int integer(String key, int fallback) {
            String value = raw(key);
            if (value == null) {
                return fallback;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                invalidKeys.add(key);
                return fallback;
            }
        }

        Integer optionalInteger(String key) {
            String value = raw(key);
            if (value == null) {
                return null;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                invalidKeys.add(key);
                return null;
            }
        }

        double decimal(String key, double fallback) {
            String value = raw(key);
            if (value == null) {
                return fallback;
            }
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                invalidKeys.add(key);
                return fallback;
            }
        }

        boolean bool(String key, boolean fallback) {
            String value = raw(key);
            if (value == null) {
                return fallback;
            }
            if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
                return Boolean.parseBoolean(value);
            }
            invalidKeys.add(key);
            return fallback;
        }

        Duration duration(String key, Duration fallback) {
            String value = raw(key);
            if (value == null) {
                return fallback;
            }
            try {
                return parseDuration(value);
            } catch (DateTimeParseException | NumberFormatException e) {
                invalidKeys.add(key);
                return fallback;
            }
        }

        Path path(String key, Path fallback) {
            String value = raw(key);
            return value != null ? Path.of(value) : fallback;
        }

        void throwIfInvalid() {
            if (!invalidKeys.isEmpty()) {
                throw new IllegalStateException(
                        "Invalid configuration values: " + String.join(" ", invalidKeys));
            }
        }
    }
}
