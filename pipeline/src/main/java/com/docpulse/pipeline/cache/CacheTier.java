package com.docpulse.pipeline.cache;

import java.time.Duration;

/**
 * Cache tiers, each with its own directory and default time-to-live.
 */
public enum CacheTier {
    /** Discovery query responses. */
    QUERY("query", Duration.ofHours(1)),
    /** Converted document text. */
    ARTIFACT("artifact", Duration.ofDays(7)),
    /** Summarization results per item and target set. */
    RESULT("result", Duration.ofDays(30));

    private final String directory;
    private final Duration defaultTtl;

    CacheTier(String directory, Duration defaultTtl) {
        this.directory = directory;
        this.defaultTtl = defaultTtl;
    }

    public String directory() {
        return directory;
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }
}
