package com.propertyintel.estate.pipeline;

import com.propertyintel.estate.model.EstateItem;
import com.propertyintel.estate.model.RunStatistics;
import com.propertyintel.estate.output.PersistenceAdapter;

import java.util.List;

/**
 * Validate → Deduplicate → Count → Persist, in that order.
 *
 * Validation runs before deduplication so invalid listings never claim an
 * id, and deduplication before persistence so the sink is never asked to
 * write the same listing twice in one run.
 */
public class RecordPipeline {

    private final List<PipelineStage> stages;

    public RecordPipeline(List<String> requiredFields, RunStatistics stats, PersistenceAdapter adapter) {
        this.stages = List.of(
                new ValidationStage(requiredFields, stats),
                new DeduplicationStage(stats),
                new CountStage(stats),
                new PersistStage(adapter, stats));
    }

    /** Returns the outcome of the last stage the item reached */
    public StageOutcome process(EstateItem item) {
        StageOutcome outcome = StageOutcome.pass(item);
        for (PipelineStage stage : stages) {
            outcome = stage.process(outcome.item());
            if (!outcome.isPassed()) {
                return outcome;
            }
        }
        return outcome;
    }

    /** Items of one page, in page order */
    public void processAll(List<EstateItem> items) {
        for (EstateItem item : items) {
            process(item);
        }
    }
}
