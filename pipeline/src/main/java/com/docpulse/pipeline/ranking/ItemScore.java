package com.docpulse.pipeline.ranking;

import com.docpulse.pipeline.model.WorkItem;

/**
 * Ranking score of one item with its components, each in [0, 1].
 */
public record ItemScore(WorkItem item, double popularity, double recency, double relevance, double total) {
}
