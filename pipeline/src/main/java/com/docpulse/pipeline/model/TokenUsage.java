package com.docpulse.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenUsage(
        @JsonProperty("input_tokens") long inputTokens,
        @JsonProperty("output_tokens") long outputTokens
) {

    public static final TokenUsage NONE = new TokenUsage(0, 0);

    public long totalTokens() {
        return inputTokens + outputTokens;
    }
}
