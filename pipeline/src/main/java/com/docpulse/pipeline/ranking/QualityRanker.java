package com.docpulse.pipeline.ranking;

import com.docpulse.pipeline.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Year;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Orders items by a weighted score of popularity (30%), recency (20%) and
 * query relevance (50%).
 */
public class QualityRanker {

    private static final Logger logger = LoggerFactory.getLogger(QualityRanker.class);

    static final double POPULARITY_WEIGHT = 0.30;
    static final double RECENCY_WEIGHT = 0.20;
    static final double RELEVANCE_WEIGHT = 0.50;

    public static final int DEFAULT_RECENCY_WINDOW_YEARS = 10;

    private static final double NEUTRAL = 0.5;

    private final int recencyWindowYears;
    private final Clock clock;

    public QualityRanker() {
        this(DEFAULT_RECENCY_WINDOW_YEARS, Clock.systemUTC());
    }

    public QualityRanker(int recencyWindowYears, Clock clock) {
        if (recencyWindowYears < 1) {
            throw new IllegalArgumentException("recencyWindowYears must be >= 1");
        }
        this.recencyWindowYears = recencyWindowYears;
        this.clock = clock;
    }

    /**
     * Returns {@code items} sorted by descending score. Ties keep input order.
     */
    public List<WorkItem> rank(List<WorkItem> items, String query) {
        return score(items, query).stream()
                .map(ItemScore::item)
                .collect(Collectors.toList());
    }

    /**
     * Scores and sorts {@code items}, highest first.
     */
    public List<ItemScore> score(List<WorkItem> items, String query) {
        Set<String> queryTokens = tokens(query);
        int currentYear = Year.now(clock).getValue();

        List<ItemScore> scored = items.stream()
                .map(item -> score(item, queryTokens, currentYear))
                .sorted(Comparator.comparingDouble(ItemScore::total).reversed())
                .collect(Collectors.toList());

        if (!scored.isEmpty()) {
            logger.debug("Ranked {} items, top score {}", scored.size(),
                    String.format("%.3f", scored.get(0).total()));
        }
        return scored;
    }

    /**
     * Drops items that fail {@code criteria}, keeping input order.
     */
    public List<WorkItem> filter(List<WorkItem> items, FilterCriteria criteria) {
        List<WorkItem> kept = items.stream()
                .filter(item -> passes(item, criteria))
                .collect(Collectors.toList());
        if (kept.size() < items.size()) {
            logger.info("Filtered out {} of {} items", items.size() - kept.size(), items.size());
        }
        return kept;
    }

    private static boolean passes(WorkItem item, FilterCriteria criteria) {
        int popularity = item.popularity() != null ? item.popularity() : 0;
        if (popularity < criteria.minPopularity()) {
            return false;
        }
        Integer year = item.publicationYear();
        if (year == null) {
            return true;
        }
        if (criteria.minYear() != null && year < criteria.minYear()) {
            return false;
        }
        return criteria.maxYear() == null || year <= criteria.maxYear();
    }

    private ItemScore score(WorkItem item, Set<String> queryTokens, int currentYear) {
        double popularity = popularityScore(item.popularity());
        double recency = recencyScore(item.publicationYear(), currentYear);
        double relevance = relevanceScore(item, queryTokens);
        double total = POPULARITY_WEIGHT * popularity
                + RECENCY_WEIGHT * recency
                + RELEVANCE_WEIGHT * relevance;
        return new ItemScore(item, popularity, recency, relevance, total);
    }

    /**
     * {@code min(1, log10(count) / 3)}: 1000 citations or more scores 1.0.
     */
    static double popularityScore(Integer count) {
        if (count == null || count <= 0) {
            return 0.0;
        }
        return Math.min(1.0, Math.log10(count) / 3.0);
    }

    double recencyScore(Integer year, int currentYear) {
        if (year == null || year > currentYear) {
            return NEUTRAL;
        }
        int age = currentYear - year;
        return Math.max(0.0, 1.0 - (double) age / recencyWindowYears);
    }

    /**
     * Jaccard overlap between query tokens and title plus abstract tokens.
     */
    static double relevanceScore(WorkItem item, Set<String> queryTokens) {
        if (queryTokens.isEmpty()) {
            return 0.0;
        }
        Set<String> itemTokens = tokens(item.title() + " "
                + (item.abstractText() != null ? item.abstractText() : ""));
        if (itemTokens.isEmpty()) {
            return 0.0;
        }
        long intersection = queryTokens.stream().filter(itemTokens::contains).count();
        int union = queryTokens.size() + itemTokens.size() - (int) intersection;
        return (double) intersection / union;
    }

    static Set<String> tokens(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toSet());
    }
}
