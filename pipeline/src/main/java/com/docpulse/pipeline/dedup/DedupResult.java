package com.docpulse.pipeline.dedup;

import com.docpulse.pipeline.model.WorkItem;

import java.util.List;

/**
 * Partition of a batch into unseen items and duplicates, each list in input order.
 */
public record DedupResult(List<WorkItem> newItems, List<WorkItem> duplicates) {

    public DedupResult {
        newItems = List.copyOf(newItems);
        duplicates = List.copyOf(duplicates);
    }
}
