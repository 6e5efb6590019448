package com.propertyintel.estate.pipeline;

import com.propertyintel.estate.model.EstateItem;
import com.propertyintel.estate.model.RunStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Drops listings whose hash_id was already seen in this run, e.g. a listing
 * filed under two categories. Items without an id cannot be compared and
 * pass through untouched.
 */
@Slf4j
@RequiredArgsConstructor
public class DeduplicationStage implements PipelineStage {

    private final RunStatistics stats;

    @Override
    public StageOutcome process(EstateItem item) {
        Object id = item.getId();
        if (id == null) {
            return StageOutcome.pass(item);
        }
        if (!stats.markSeen(id)) {
            log.debug("Duplicate listing {} in {} page {}", id, item.getSourceCategory(), item.getSourcePage());
            return StageOutcome.drop(item, DropReason.DUPLICATE_ID);
        }
        return StageOutcome.pass(item);
    }
}
