package com.docpulse.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Structured output of a summarization call, tagged with the provider that
 * produced it. Stored as-is in the result cache tier.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SummaryResult(
        @JsonProperty("provider") String provider,
        @JsonProperty("model") String model,
        @JsonProperty("content") JsonNode content,
        @JsonProperty("usage") TokenUsage usage,
        @JsonProperty("cost_usd") double costUsd,
        @JsonProperty("fallback_used") boolean fallbackUsed
) {
}
