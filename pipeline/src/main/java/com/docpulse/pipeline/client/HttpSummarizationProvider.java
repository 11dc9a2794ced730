package com.docpulse.pipeline.client;

import com.docpulse.pipeline.config.PipelineConfig.ProviderSettings;
import com.docpulse.pipeline.model.ExtractionTarget;
import com.docpulse.pipeline.model.TokenUsage;
import com.docpulse.pipeline.provider.PermanentProviderException;
import com.docpulse.pipeline.provider.ProviderResponse;
import com.docpulse.pipeline.provider.QuotaExhaustedException;
import com.docpulse.pipeline.provider.RateLimitedException;
import com.docpulse.pipeline.provider.SummarizationProvider;
import com.docpulse.pipeline.provider.TransientProviderException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Summarization provider speaking a small JSON-over-HTTP protocol.
 *
 * <p>Request: {@code POST <endpoint>} with
 * {@code {"model": ..., "content": ..., "targets": [{name, description, output_format}]}}.
 * Response: {@code {"content": {...}, "usage": {"input_tokens": n, "output_tokens": n}}}.</p>
 *
 * <p>Thread-safe: the underlying {@link OkHttpClient} and {@link ObjectMapper}
 * are both thread-safe, and this class holds no mutable per-request state.</p>
 */
public class HttpSummarizationProvider implements SummarizationProvider {

    private static final Logger logger = LoggerFactory.getLogger(HttpSummarizationProvider.class);

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final double PER_MILLION = 1_000_000.0;

    private final ProviderSettings settings;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpSummarizationProvider(ProviderSettings settings) {
        this(settings, defaultHttpClient());
    }

    public HttpSummarizationProvider(ProviderSettings settings, OkHttpClient httpClient) {
        if (!settings.isConfigured()) {
            throw new IllegalArgumentException("Provider " + settings.name() + " has no endpoint");
        }
        this.settings = settings;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private static OkHttpClient defaultHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(180, TimeUnit.SECONDS)
                .writeTimeout(60, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public String name() {
        return settings.name();
    }

    @Override
    public String model() {
        return settings.model();
    }

    @Override
    public double cost(TokenUsage usage) {
        return usage.inputTokens() * settings.inputCostPerMillion() / PER_MILLION
                + usage.outputTokens() * settings.outputCostPerMillion() / PER_MILLION;
    }

    @Override
    public ProviderResponse summarize(String content, List<ExtractionTarget> targets) {
        Request request = buildRequest(content, targets);

        try (Response response = httpClient.newCall(request).execute()) {
            int statusCode = response.code();
            ResponseBody body = response.body();
            String bodyString = body != null ? body.string() : "";
            logger.info("Provider {} {} {}", name(), statusCode, settings.endpoint());

            if (statusCode >= 200 && statusCode < 300) {
                return parseResponse(bodyString);
            }
            throw errorFor(statusCode, bodyString, response.header("Retry-After"));
        } catch (IOException e) {
            throw new TransientProviderException(name(), "I/O error calling " + settings.endpoint()
                    + ": " + e.getMessage(), e);
        }
    }

    // -------------------------------------------------------------------------
    // Request / response mapping
    // -------------------------------------------------------------------------

    Request buildRequest(String content, List<ExtractionTarget> targets) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", settings.model());
        payload.put("content", content);
        ArrayNode targetArray = payload.putArray("targets");
        for (ExtractionTarget target : targets) {
            targetArray.add(objectMapper.valueToTree(target));
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new PermanentProviderException(name(), "Could not encode request", e);
        }

        Request.Builder builder = new Request.Builder()
                .url(settings.endpoint())
                .header("Accept", "application/json")
                .post(RequestBody.create(json, JSON));
        if (settings.apiKey() != null && !settings.apiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + settings.apiKey());
        }
        return builder.build();
    }

    ProviderResponse parseResponse(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode content = root != null ? root.get("content") : null;
            if (content == null || content.isNull()) {
                throw new PermanentProviderException(name(), "Response has no content field");
            }
            TokenUsage usage = TokenUsage.NONE;
            JsonNode usageNode = root.get("usage");
            if (usageNode != null && usageNode.isObject()) {
                usage = objectMapper.treeToValue(usageNode, TokenUsage.class);
            }
            return new ProviderResponse(content, usage);
        } catch (JsonProcessingException e) {
            throw new PermanentProviderException(name(), "Malformed response: " + e.getOriginalMessage(), e);
        }
    }

    RuntimeException errorFor(int statusCode, String body, String retryAfterHeader) {
        String message = "HTTP " + statusCode + " from " + settings.endpoint();
        boolean quota = body.toLowerCase(Locale.ROOT).contains("quota");

        if (statusCode == 402 || (statusCode == 429 && quota)) {
            return new QuotaExhaustedException(name(), message);
        }
        if (statusCode == 429) {
            return new RateLimitedException(name(), message, parseRetryAfter(retryAfterHeader));
        }
        if (statusCode >= 500 || statusCode == 408) {
            return new TransientProviderException(name(), message);
        }
        return new PermanentProviderException(name(), message + ": " + abbreviate(body));
    }

    /**
     * Reads a Retry-After header given as seconds or an HTTP date.
     *
     * @return the wait, or {@code null} when absent or unparseable
     */
    static Duration parseRetryAfter(String retryAfter) {
        if (retryAfter == null || retryAfter.isBlank()) {
            return null;
        }
        String value = retryAfter.trim();
        try {
            return Duration.ofSeconds(Math.max(0, Long.parseLong(value)));
        } catch (NumberFormatException e) {
            logger.debug("Retry-After '{}' is not a number, trying HTTP date", value);
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration wait = Duration.between(ZonedDateTime.now(at.getZone()), at);
            return wait.isNegative() ? Duration.ZERO : wait;
        } catch (DateTimeParseException e) {
            logger.warn("Ignoring unparseable Retry-After header '{}'", value);
            return null;
        }
    }

    private static String abbreviate(String body) {
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
