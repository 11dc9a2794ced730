package com.docpulse.pipeline.orchestrator;

import com.docpulse.pipeline.model.SummaryResult;
import com.docpulse.pipeline.model.WorkItem;

import java.time.Duration;

/**
 * Outcome of processing one item, emitted by {@link PipelineRun}.
 *
 * <p>{@code degraded} marks results built from title and abstract, or from
 * converted text that never reached the quality threshold.</p>
 */
public record ItemResult(
        String itemId,
        String title,
        boolean success,
        SummaryResult summary,
        String backend,
        double qualityScore,
        boolean degraded,
        boolean fromCache,
        String error,
        Duration duration
) {

    public static final String ABSTRACT_BACKEND = "abstract";
    public static final String CACHE_BACKEND = "cache";

    public static ItemResult success(WorkItem item, SummaryResult summary, String backend,
                                     double qualityScore, boolean degraded, Duration duration) {
        return new ItemResult(item.id(), item.title(), true, summary, backend, qualityScore,
                degraded, false, null, duration);
    }

    public static ItemResult fromCache(WorkItem item, SummaryResult summary, Duration duration) {
        return new ItemResult(item.id(), item.title(), true, summary, CACHE_BACKEND, 1.0,
                false, true, null, duration);
    }

    public static ItemResult failure(WorkItem item, String error, Duration duration) {
        return new ItemResult(item.id(), item.title(), false, null, null, 0.0,
                false, false, error, duration);
    }

    public boolean fallbackProviderUsed() {
        return summary != null && summary.fallbackUsed();
    }
}
