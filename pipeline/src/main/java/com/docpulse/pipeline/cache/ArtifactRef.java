package com.docpulse.pipeline.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;

/**
 * Pointer to a converted text file kept on disk, with the backend that
 * produced it and its quality score.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArtifactRef(
        @JsonProperty("path") String path,
        @JsonProperty("backend") String backend,
        @JsonProperty("quality_score") double qualityScore
) {

    public static ArtifactRef of(Path path, String backend, double qualityScore) {
        return new ArtifactRef(path.toAbsolutePath().toString(), backend, qualityScore);
    }

    public Path toPath() {
        return Path.of(path);
    }
}
