package com.docpulse.pipeline.orchestrator;

import com.docpulse.pipeline.conversion.BackendUsage;
import com.docpulse.pipeline.provider.ProviderUsage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counters for one pipeline run, from discovery through the last result.
 *
 * @param discovered   items passed to {@code start}
 * @param duplicates   items dropped by the dedup index
 * @param filteredOut  items dropped by the filter criteria
 * @param resumed      items skipped because an earlier attempt of this run completed them
 * @param scheduled    items handed to workers
 */
public record RunSummary(
        String runId,
        RunState state,
        int discovered,
        int duplicates,
        int filteredOut,
        int resumed,
        int scheduled,
        int completed,
        int failed,
        int degraded,
        int cacheHits,
        int fallbackProviderUses,
        Map<String, ProviderUsage.Snapshot> providerUsage,
        Map<String, BackendUsage.Snapshot> backendUsage,
        List<ItemResult> failures,
        long totalDurationMs
) {

    public RunSummary {
        providerUsage = Collections.unmodifiableMap(new LinkedHashMap<>(providerUsage));
        backendUsage = Collections.unmodifiableMap(new LinkedHashMap<>(backendUsage));
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return failed > 0;
    }

    public int processed() {
        return completed + failed;
    }

    public double totalCostUsd() {
        return providerUsage.values().stream()
                .mapToDouble(ProviderUsage.Snapshot::costUsd)
                .sum();
    }

    public long totalTokens() {
        return providerUsage.values().stream()
                .mapToLong(ProviderUsage.Snapshot::totalTokens)
                .sum();
    }
}
