package com.docpulse.pipeline.orchestrator;

import com.docpulse.pipeline.checkpoint.CheckpointStore;
import com.docpulse.pipeline.config.PipelineConfig;
import com.docpulse.pipeline.dedup.DedupResult;
import com.docpulse.pipeline.dedup.DeduplicationIndex;
import com.docpulse.pipeline.model.ExtractionTarget;
import com.docpulse.pipeline.model.WorkItem;
import com.docpulse.pipeline.ranking.FilterCriteria;
import com.docpulse.pipeline.ranking.QualityRanker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Plans and starts pipeline runs: checkpoint load -> dedup -> filter -> rank
 * -> skip completed ids, then hands the rest to a {@link PipelineRun}.
 */
public class PipelineOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final ItemProcessor processor;
    private final CheckpointStore checkpoints;
    private final DeduplicationIndex dedup;
    private final QualityRanker ranker;
    private final FilterCriteria criteria;
    private final int maxConcurrentDownloads;
    private final int queueSize;
    private final int checkpointInterval;

    public PipelineOrchestrator(PipelineConfig config, ItemProcessor processor, CheckpointStore checkpoints,
                                DeduplicationIndex dedup, QualityRanker ranker) {
        this.processor = processor;
        this.checkpoints = checkpoints;
        this.dedup = dedup;
        this.ranker = ranker;
        this.criteria = FilterCriteria.fromConfig(config);
        this.maxConcurrentDownloads = config.getMaxConcurrentDownloads();
        this.queueSize = config.getQueueSize();
        this.checkpointInterval = config.getCheckpointInterval();
    }

    /**
     * Plans a run over {@code items}. Processing starts when the returned run
     * is first iterated.
     *
     * @param runId stable id; reusing it after a PARTIAL run resumes that run
     */
    public PipelineRun start(String runId, List<WorkItem> items, String query, List<ExtractionTarget> targets) {
        logger.info("Starting run {} with {} discovered items", runId, items.size());

        Set<String> completed = checkpoints.loadCompleted(runId);

        List<WorkItem> unique = distinctById(items);
        DedupResult dedupResult = dedup.classify(unique);
        int duplicates = items.size() - dedupResult.newItems().size();

        List<WorkItem> filtered = ranker.filter(dedupResult.newItems(), criteria);
        List<WorkItem> ranked = ranker.rank(filtered, query);

        List<WorkItem> pending = new ArrayList<>();
        List<WorkItem> resumed = new ArrayList<>();
        for (WorkItem item : ranked) {
            if (completed.contains(item.id())) {
                resumed.add(item);
            } else {
                pending.add(item);
            }
        }
        if (!resumed.isEmpty()) {
            logger.info("Resuming run {}: skipping {} completed items", runId, resumed.size());
        }

        RunPlan plan = new RunPlan(runId, pending, resumed, targets, items.size(), duplicates,
                dedupResult.newItems().size() - filtered.size());
        processor.metrics().itemsDiscovered(items.size());
        processor.metrics().itemsSkipped(plan.duplicates() + plan.filteredOut());
        int workers = Math.min(maxConcurrentDownloads, pending.size());
        logger.info("Run {} planned: {} pending, {} duplicates, {} filtered, {} resumed",
                runId, pending.size(), plan.duplicates(), plan.filteredOut(), resumed.size());

        return new PipelineRun(plan, processor, checkpoints, dedup, queueSize, checkpointInterval, workers);
    }

    private static List<WorkItem> distinctById(List<WorkItem> items) {
        Map<String, WorkItem> byId = new LinkedHashMap<>();
        for (WorkItem item : items) {
            if (byId.putIfAbsent(item.id(), item) != null) {
                logger.debug("Dropping repeated item id {}", item.id());
            }
        }
        return new ArrayList<>(byId.values());
    }
}
