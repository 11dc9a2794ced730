package com.docpulse.pipeline.provider;

import com.docpulse.pipeline.model.TokenUsage;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw answer from a single provider call: the structured content and the
 * tokens it consumed.
 */
public record ProviderResponse(JsonNode content, TokenUsage usage) {

    public ProviderResponse {
        usage = usage != null ? usage : TokenUsage.NONE;
    }
}
