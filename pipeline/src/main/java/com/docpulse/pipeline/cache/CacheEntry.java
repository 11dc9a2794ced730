package com.docpulse.pipeline.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * On-disk form of one cached value.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheEntry(
        @JsonProperty("key") String key,
        @JsonProperty("tier") CacheTier tier,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("expires_at") Instant expiresAt,
        @JsonProperty("value") JsonNode value
) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
