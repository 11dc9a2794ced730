package com.docpulse.pipeline.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * On-disk checkpoint: {@code {"run_id": ..., "processed_ids": [...]}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CheckpointRecord(
        @JsonProperty("run_id") String runId,
        @JsonProperty("processed_ids") List<String> processedIds
) {

    public CheckpointRecord {
        processedIds = processedIds != null ? List.copyOf(processedIds) : List.of();
    }
}
