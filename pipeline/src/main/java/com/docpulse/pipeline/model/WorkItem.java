package com.docpulse.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * One document handed to the pipeline by discovery. Immutable; the
 * {@code id} is stable across runs and is what checkpoints and caches key on.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkItem(
        @JsonProperty("id") String id,
        @JsonProperty("external_id") String externalId,
        @JsonProperty("title") String title,
        @JsonProperty("source_location") String sourceLocation,
        @JsonProperty("abstract") String abstractText,
        @JsonProperty("popularity") Integer popularity,
        @JsonProperty("publication_year") Integer publicationYear,
        @JsonProperty("metadata") Map<String, String> metadata
) {

    public static final String PAGE_COUNT = "page_count";

    public WorkItem {
        Objects.requireNonNull(id, "id");
        title = title != null ? title : "";
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static WorkItem of(String id, String title, String sourceLocation) {
        return new WorkItem(id, null, title, sourceLocation, null, null, null, Map.of());
    }

    public boolean hasAbstract() {
        return abstractText != null && !abstractText.isBlank();
    }

    public boolean hasSource() {
        return sourceLocation != null && !sourceLocation.isBlank();
    }

    /**
     * Page count from discovery metadata, or 0 when unknown or unparseable.
     */
    public int pageCount() {
        String raw = metadata.get(PAGE_COUNT);
        if (raw == null) {
            return 0;
        }
        try {
            return Math.max(0, Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
