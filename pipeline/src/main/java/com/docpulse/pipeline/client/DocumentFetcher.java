package com.docpulse.pipeline.client;

import com.docpulse.pipeline.model.WorkItem;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Makes an item's source document available as a local file.
 */
public interface DocumentFetcher {

    Path fetch(WorkItem item) throws IOException, InterruptedException;
}
