package com.docpulse.pipeline.conversion;

import java.nio.file.Path;

/**
 * Converts one downloaded document into plain or markdown text.
 */
public interface ConversionBackend {

    BackendType type();

    /**
     * Cheap check for missing binaries or libraries. Consulted once, when the
     * chain is built.
     */
    boolean isAvailable();

    /**
     * @throws BackendUnavailableException if the backend discovers at call time that it cannot run
     * @throws Exception                   on any conversion failure
     */
    String convert(Path source) throws Exception;
}
