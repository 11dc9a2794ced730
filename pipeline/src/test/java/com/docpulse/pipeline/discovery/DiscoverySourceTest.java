package com.docpulse.pipeline.discovery;

import com.docpulse.pipeline.MutableClock;
import com.docpulse.pipeline.cache.CacheLayer;
import com.docpulse.pipeline.cache.CacheTier;
import com.docpulse.pipeline.model.WorkItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class DiscoverySourceTest {

    @TempDir
    Path tempDir;

    private static final String ITEMS_JSON = """
            [
              {"id": "arxiv:1", "external_id": "10.1/a", "title": "First", "source_location": "https://x.org/1.pdf",
               "abstract": "About the first", "popularity": 12, "publication_year": 2023,
               "metadata": {"page_count": "8"}, "unknown_field": true},
              {"id": "arxiv:2", "title": "Second"}
            ]
            """;

    @Test
    @DisplayName("JSON file source maps snake_case fields and honours the limit")
    void jsonFile() throws Exception {
        Path file = Files.writeString(tempDir.resolve("items.json"), ITEMS_JSON);
        JsonFileDiscoverySource source = new JsonFileDiscoverySource(file);

        List<WorkItem> all = source.discover("ignored", 0);
        List<WorkItem> limited = source.discover("ignored", 1);

        assertEquals(2, all.size());
        WorkItem first = all.get(0);
        assertEquals("10.1/a", first.externalId());
        assertEquals("About the first", first.abstractText());
        assertEquals(2023, first.publicationYear());
        assertEquals(8, first.pageCount());
        assertFalse(all.get(1).hasSource());
        assertEquals(List.of(first), limited);
    }

    @Test
    @DisplayName("Caching source serves repeat queries from the query tier until expiry")
    void caching() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        CacheLayer cache = new CacheLayer(tempDir.resolve("cache"), Map.of(), true, clock);
        DiscoverySource delegate = mock(DiscoverySource.class);
        when(delegate.discover(anyString(), anyInt()))
                .thenReturn(List.of(WorkItem.of("a", "Alpha", "https://x.org/a.pdf")));
        CachingDiscoverySource source = new CachingDiscoverySource(delegate, cache);

        List<WorkItem> first = source.discover("alpha", 10);
        List<WorkItem> second = source.discover("alpha", 10);
        source.discover("alpha", 20);

        assertEquals(first, second);
        verify(delegate, times(1)).discover("alpha", 10);
        verify(delegate, times(1)).discover("alpha", 20);
        assertEquals(1, cache.stats(CacheTier.QUERY).hits());

        clock.advance(Duration.ofHours(1));
        source.discover("alpha", 10);

        verify(delegate, times(2)).discover("alpha", 10);
    }
}
