package com.docpulse.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One field the summarization provider is asked to produce, e.g.
 * {@code methodology} as {@code text}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractionTarget(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("output_format") String outputFormat
) {

    /**
     * Canonical form used in cache keys.
     */
    public String fingerprint() {
        return name + ":" + description + ":" + outputFormat;
    }
}
