package com.docpulse.pipeline.ranking;

import com.docpulse.pipeline.model.WorkItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class QualityRankerTest {

    private final QualityRanker ranker = new QualityRanker(10,
            Clock.fixed(Instant.parse("2026-06-01T00:00:00Z"), ZoneOffset.UTC));

    private static WorkItem item(String id, String title, Integer popularity, Integer year) {
        return new WorkItem(id, null, title, null, null, popularity, year, null);
    }

    @Test
    @DisplayName("Popularity is log-scaled and capped at 1")
    void popularity() {
        assertEquals(0.0, QualityRanker.popularityScore(null));
        assertEquals(0.0, QualityRanker.popularityScore(0));
        assertEquals(0.0, QualityRanker.popularityScore(1));
        assertEquals(2.0 / 3.0, QualityRanker.popularityScore(100), 1e-9);
        assertEquals(1.0, QualityRanker.popularityScore(50_000));
    }

    @Test
    @DisplayName("Recency decays linearly over the window and is neutral when unknown")
    void recency() {
        assertEquals(1.0, ranker.recencyScore(2026, 2026));
        assertEquals(0.5, ranker.recencyScore(2021, 2026), 1e-9);
        assertEquals(0.0, ranker.recencyScore(1990, 2026));
        assertEquals(0.5, ranker.recencyScore(null, 2026));
        assertEquals(0.5, ranker.recencyScore(2030, 2026));
    }

    @Test
    @DisplayName("Relevance is the Jaccard overlap of query and item tokens")
    void relevance() {
        WorkItem item = item("a", "Sparse attention transformers", 0, 2020);

        assertEquals(QualityRanker.tokens("attention sparse"), Set.of("attention", "sparse"));
        assertEquals(2.0 / 3.0,
                QualityRanker.relevanceScore(item, QualityRanker.tokens("Sparse Attention")), 1e-9);
        assertEquals(0.0, QualityRanker.relevanceScore(item, Set.of()));
    }

    @Test
    @DisplayName("Items are ordered by descending weighted score")
    void rank_order() {
        WorkItem relevant = item("relevant", "Diffusion models for audio", 10, 2025);
        WorkItem popular = item("popular", "Unrelated survey", 10_000, 2025);
        WorkItem old = item("old", "Unrelated classic", 10, 1980);

        List<WorkItem> ranked = ranker.rank(List.of(old, popular, relevant), "diffusion models audio");

        assertEquals(List.of("relevant", "popular", "old"), ranked.stream().map(WorkItem::id).toList());
    }

    @Test
    @DisplayName("Equal scores keep input order")
    void rank_stable() {
        WorkItem first = item("first", "Same", 5, 2020);
        WorkItem second = item("second", "Same", 5, 2020);

        assertEquals(List.of(first, second), ranker.rank(List.of(first, second), "query"));
    }

    @Test
    @DisplayName("Filters drop low popularity and out-of-range years but keep unknown years")
    void filter() {
        List<WorkItem> items = List.of(
                item("ok", "A", 50, 2022),
                item("unpopular", "B", 2, 2022),
                item("tooOld", "C", 50, 2010),
                item("tooNew", "D", 50, 2026),
                item("noYear", "E", 50, null));

        List<WorkItem> kept = ranker.filter(items, new FilterCriteria(10, 2015, 2025));

        assertEquals(List.of("ok", "noYear"), kept.stream().map(WorkItem::id).toList());
        assertEquals(items, ranker.filter(items, FilterCriteria.NONE));
    }
}
