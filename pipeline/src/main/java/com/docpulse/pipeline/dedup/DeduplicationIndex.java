package com.docpulse.pipeline.dedup;

import com.docpulse.pipeline.model.WorkItem;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Persistent record of items already processed in earlier runs.
 *
 * <p>An item is a duplicate when its external id matches a known one
 * (case-insensitive) or, failing that, its normalized title is more than
 * {@code titleThreshold} similar to a known title. Items earlier in the same
 * batch count as known.</p>
 */
public class DeduplicationIndex {

    private static final Logger logger = LoggerFactory.getLogger(DeduplicationIndex.class);

    public static final double DEFAULT_TITLE_THRESHOLD = 0.90;

    private final Path indexPath;
    private final double titleThreshold;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Set<String> identifiers = new LinkedHashSet<>();
    private final Map<String, String> titles = new LinkedHashMap<>();

    public DeduplicationIndex(Path indexPath) {
        this(indexPath, DEFAULT_TITLE_THRESHOLD);
    }

    public DeduplicationIndex(Path indexPath, double titleThreshold) {
        this.indexPath = indexPath;
        this.titleThreshold = titleThreshold;
        load();
    }

    private void load() {
        if (indexPath == null || !Files.isRegularFile(indexPath)) {
            return;
        }
        try {
            IndexFile file = objectMapper.readValue(indexPath.toFile(), IndexFile.class);
            if (file.identifiers() != null) {
                file.identifiers().forEach(id -> identifiers.add(canonicalId(id)));
            }
            if (file.titles() != null) {
                titles.putAll(file.titles());
            }
            logger.info("Loaded dedup index with {} identifiers and {} titles from {}",
                    identifiers.size(), titles.size(), indexPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read dedup index " + indexPath, e);
        }
    }

    /**
     * Splits {@code items} into new items and duplicates without changing the index.
     */
    public synchronized DedupResult classify(List<WorkItem> items) {
        Set<String> seenIds = new LinkedHashSet<>(identifiers);
        Map<String, String> seenTitles = new LinkedHashMap<>(titles);
        List<WorkItem> fresh = new ArrayList<>();
        List<WorkItem> duplicates = new ArrayList<>();

        for (WorkItem item : items) {
            String id = canonicalId(item.externalId());
            String title = TitleSimilarity.normalize(item.title());

            if (id != null && seenIds.contains(id)) {
                logger.debug("Duplicate by identifier: {} ({})", item.id(), item.externalId());
                duplicates.add(item);
                continue;
            }
            String match = matchTitle(title, seenTitles);
            if (match != null) {
                logger.debug("Duplicate by title: {} matches {}", item.id(), match);
                duplicates.add(item);
                continue;
            }

            fresh.add(item);
            if (id != null) {
                seenIds.add(id);
            }
            if (!title.isEmpty()) {
                seenTitles.put(title, item.id());
            }
        }

        if (!duplicates.isEmpty()) {
            logger.info("Dedup: {} new, {} duplicates", fresh.size(), duplicates.size());
        }
        return new DedupResult(fresh, duplicates);
    }

    public synchronized boolean isDuplicate(WorkItem item) {
        return !classify(List.of(item)).duplicates().isEmpty();
    }

    /**
     * Adds {@code items} to the index and persists it.
     */
    public synchronized void update(List<WorkItem> items) {
        for (WorkItem item : items) {
            String id = canonicalId(item.externalId());
            if (id != null) {
                identifiers.add(id);
            }
            String title = TitleSimilarity.normalize(item.title());
            if (!title.isEmpty()) {
                titles.putIfAbsent(title, item.id());
            }
        }
        save();
    }

    public synchronized int size() {
        return Math.max(identifiers.size(), titles.size());
    }

    private String matchTitle(String title, Map<String, String> known) {
        if (title.isEmpty()) {
            return null;
        }
        String exact = known.get(title);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, String> entry : known.entrySet()) {
            if (TitleSimilarity.ratio(title, entry.getKey()) > titleThreshold) {
                return entry.getValue();
            }
        }
        return null;
    }

    private void save() {
        if (indexPath == null) {
            return;
        }
        try {
            Path dir = indexPath.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path temp = Files.createTempFile(dir, ".dedup-", ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), new IndexFile(new ArrayList<>(identifiers), titles));
                Files.move(temp, indexPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
            logger.info("Saved dedup index ({} identifiers, {} titles) to {}",
                    identifiers.size(), titles.size(), indexPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write dedup index " + indexPath, e);
        }
    }

    private static String canonicalId(String externalId) {
        if (externalId == null || externalId.isBlank()) {
            return null;
        }
        return externalId.trim().toLowerCase(Locale.ROOT);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record IndexFile(
            @JsonProperty("identifiers") List<String> identifiers,
            @JsonProperty("titles") Map<String, String> titles
    ) {}
}
