package com.docpulse.pipeline.discovery;

import com.docpulse.pipeline.model.WorkItem;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads work items from a JSON array on disk. The query is ignored; the
 * file is the result set.
 */
public class JsonFileDiscoverySource implements DiscoverySource {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileDiscoverySource.class);

    private final Path file;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public JsonFileDiscoverySource(Path file) {
        this.file = file;
    }

    @Override
    public List<WorkItem> discover(String query, int limit) throws IOException {
        List<WorkItem> items = objectMapper.readValue(file.toFile(), new TypeReference<>() {});
        logger.info("Discovered {} items from {}", items.size(), file);
        return limit > 0 && items.size() > limit ? List.copyOf(items.subList(0, limit)) : items;
    }
}
