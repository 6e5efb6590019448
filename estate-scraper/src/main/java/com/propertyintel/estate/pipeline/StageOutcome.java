package com.propertyintel.estate.pipeline;

import com.propertyintel.estate.model.EstateItem;
import com.propertyintel.estate.model.UpsertResult;

/**
 * Either the item continues ({@code dropReason == null}) or it stops here.
 * The persist stage also reports what the sink did with it.
 */
public record StageOutcome(EstateItem item, DropReason dropReason, UpsertResult upsertResult) {

    public static StageOutcome pass(EstateItem item) {
        return new StageOutcome(item, null, null);
    }

    public static StageOutcome drop(EstateItem item, DropReason reason) {
        return new StageOutcome(item, reason, null);
    }

    public static StageOutcome persisted(EstateItem item, UpsertResult result) {
        return new StageOutcome(item, null, result);
    }

    public boolean isPassed() {
        return dropReason == null;
    }
}
