package com.docpulse.pipeline.discovery;

import com.docpulse.pipeline.model.WorkItem;

import java.io.IOException;
import java.util.List;

/**
 * Produces the candidate items for a query.
 */
public interface DiscoverySource {

    List<WorkItem> discover(String query, int limit) throws IOException;
}
