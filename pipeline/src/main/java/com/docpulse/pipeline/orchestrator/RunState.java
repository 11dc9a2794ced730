package com.docpulse.pipeline.orchestrator;

/**
 * Lifecycle of a pipeline run. DONE and PARTIAL are terminal.
 */
public enum RunState {
    INIT,
    RUNNING,
    /** All items handed to workers; waiting for in-flight items. */
    DRAINING,
    DONE,
    /** Cancelled or aborted; the checkpoint is kept for resume. */
    PARTIAL
}
