package com.propertyintel.estate.pipeline;

import com.propertyintel.estate.model.EstateItem;

/**
 * One step of the {@link RecordPipeline}. Stages hold the run state they
 * need, so a fresh set is built for every run.
 */
public interface PipelineStage {

    StageOutcome process(EstateItem item);
}
