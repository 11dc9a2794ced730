package com.docpulse.pipeline.orchestrator;

import com.docpulse.pipeline.model.ExtractionTarget;
import com.docpulse.pipeline.model.WorkItem;

import java.util.List;

/**
 * What a run will do, fixed during INIT.
 *
 * @param pending  ranked items still to process, best first
 * @param resumed  items a previous attempt of this run already completed
 */
record RunPlan(
        String runId,
        List<WorkItem> pending,
        List<WorkItem> resumed,
        List<ExtractionTarget> targets,
        int discovered,
        int duplicates,
        int filteredOut
) {

    RunPlan {
        pending = List.copyOf(pending);
        resumed = List.copyOf(resumed);
        targets = List.copyOf(targets);
    }
}
