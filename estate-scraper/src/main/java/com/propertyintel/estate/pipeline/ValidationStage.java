package com.propertyintel.estate.pipeline;

import com.propertyintel.estate.model.EstateItem;
import com.propertyintel.estate.model.RunStatistics;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public class ValidationStage implements PipelineStage {

    private final List<String> requiredFields;
    private final RunStatistics stats;

    public ValidationStage(List<String> requiredFields, RunStatistics stats) {
        this.requiredFields = List.copyOf(requiredFields);
        this.stats = stats;
    }

    @Override
    public StageOutcome process(EstateItem item) {
        List<String> missing = new ArrayList<>();
        for (String field : requiredFields) {
            if (!item.hasValue(field)) {
                missing.add(field);
            }
        }

        if (!missing.isEmpty()) {
            stats.recordInvalid(missing);
            log.warn("Dropping listing {} from {} page {}: missing {}",
                    item.getId(), item.getSourceCategory(), item.getSourcePage(), missing);
            return StageOutcome.drop(item, DropReason.MISSING_REQUIRED_FIELD);
        }

        stats.recordValid();
        return StageOutcome.pass(item);
    }
}
