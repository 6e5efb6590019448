package com.propertyintel.estate.output;

import com.propertyintel.estate.config.EstateScraperProperties.Output.OutputMode;
import com.propertyintel.estate.model.EstateItem;
import com.propertyintel.estate.model.UpsertResult;

/**
 * A sink for estate items, keyed by hash_id.
 *
 * {@link #upsert} must be idempotent per id and must not throw on
 * constraint conflicts: those are logged and reported as
 * {@link UpsertResult#SKIPPED_DUPLICATE}.
 */
public interface PersistenceAdapter extends AutoCloseable {

    OutputMode mode();

    /**
     * Prepare the sink for a run (connectivity check, schema, file handle).
     *
     * @throws PersistenceException when the backend cannot be used; the run must not start
     */
    void open();

    UpsertResult upsert(EstateItem item);

    @Override
    void close();
}
