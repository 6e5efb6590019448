package com.propertyintel.estate.pipeline;

import com.propertyintel.estate.model.EstateItem;
import com.propertyintel.estate.model.RunStatistics;
import com.propertyintel.estate.model.UpsertResult;
import com.propertyintel.estate.output.PersistenceAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class PersistStage implements PipelineStage {

    private final PersistenceAdapter adapter;
    private final RunStatistics stats;

    @Override
    public StageOutcome process(EstateItem item) {
        UpsertResult result;
        try {
            result = adapter.upsert(item);
        } catch (Exception e) {
            log.error("Failed to persist listing {}: {}", item.getId(), e.getMessage(), e);
            result = UpsertResult.FAILED;
        }
        stats.recordUpsert(result);
        return StageOutcome.persisted(item, result);
    }
}
