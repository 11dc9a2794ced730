package com.docpulse.pipeline.discovery;

import com.docpulse.pipeline.cache.CacheKeys;
import com.docpulse.pipeline.cache.CacheLayer;
import com.docpulse.pipeline.cache.CacheTier;
import com.docpulse.pipeline.model.WorkItem;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Memoizes another source's results in the query cache tier.
 */
public class CachingDiscoverySource implements DiscoverySource {

    private static final Logger logger = LoggerFactory.getLogger(CachingDiscoverySource.class);

    private final DiscoverySource delegate;
    private final CacheLayer cache;

    public CachingDiscoverySource(DiscoverySource delegate, CacheLayer cache) {
        this.delegate = delegate;
        this.cache = cache;
    }

    @Override
    public List<WorkItem> discover(String query, int limit) throws IOException {
        String key = CacheKeys.query(query, Map.of("limit", limit));
        Optional<List<WorkItem>> cached = cache.get(CacheTier.QUERY, key, new TypeReference<List<WorkItem>>() {});
        if (cached.isPresent()) {
            logger.info("Query cache hit for '{}' ({} items)", query, cached.get().size());
            return cached.get();
        }
        List<WorkItem> items = delegate.discover(query, limit);
        cache.put(CacheTier.QUERY, key, items);
        return items;
    }
}
