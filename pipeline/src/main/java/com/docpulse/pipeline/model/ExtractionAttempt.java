package com.docpulse.pipeline.model;

import java.time.Duration;

/**
 * Outcome of one conversion backend run against one item. A successful
 * attempt always carries non-blank text.
 */
public record ExtractionAttempt(
        String backend,
        boolean success,
        String text,
        double qualityScore,
        Duration duration,
        String error
) {

    public static final String NO_BACKEND = "NONE";

    public ExtractionAttempt {
        if (success && (text == null || text.isBlank())) {
            throw new IllegalArgumentException("successful attempt from " + backend + " has no text");
        }
        duration = duration != null ? duration : Duration.ZERO;
    }

    public static ExtractionAttempt success(String backend, String text, double score, Duration duration) {
        return new ExtractionAttempt(backend, true, text, score, duration, null);
    }

    public static ExtractionAttempt failure(String backend, String error, Duration duration) {
        return new ExtractionAttempt(backend, false, null, 0.0, duration, error);
    }
}
