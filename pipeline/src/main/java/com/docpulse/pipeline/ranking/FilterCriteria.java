package com.docpulse.pipeline.ranking;

import com.docpulse.pipeline.config.PipelineConfig;

/**
 * Hard filters applied before ranking. A {@code null} year bound is open.
 * Items with an unknown year pass both year bounds; items with unknown
 * popularity count as 0.
 */
public record FilterCriteria(int minPopularity, Integer minYear, Integer maxYear) {

    public static final FilterCriteria NONE = new FilterCriteria(0, null, null);

    public static FilterCriteria fromConfig(PipelineConfig config) {
        return new FilterCriteria(config.getMinPopularity(), config.getMinYear(), config.getMaxYear());
    }
}
