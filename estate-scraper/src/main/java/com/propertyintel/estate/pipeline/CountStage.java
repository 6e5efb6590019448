package com.propertyintel.estate.pipeline;

import com.propertyintel.estate.model.EstateItem;
import com.propertyintel.estate.model.RunStatistics;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class CountStage implements PipelineStage {

    private final RunStatistics stats;

    @Override
    public StageOutcome process(EstateItem item) {
        stats.recordCounted();
        return StageOutcome.pass(item);
    }
}
