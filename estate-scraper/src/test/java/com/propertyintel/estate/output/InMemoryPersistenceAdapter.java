package com.propertyintel.estate.output;

import com.propertyintel.estate.config.EstateScraperProperties.Output.OutputMode;
import com.propertyintel.estate.model.EstateItem;
import com.propertyintel.estate.model.UpsertResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class InMemoryPersistenceAdapter implements PersistenceAdapter {

    private final Map<String, EstateItem> stored = new LinkedHashMap<>();
    private final List<EstateItem> anonymous = new ArrayList<>();
    private boolean failOnOpen;
    private boolean open;
    private int closeCount;

    public InMemoryPersistenceAdapter failOnOpen() {
        this.failOnOpen = true;
        return this;
    }

    @Override
    public OutputMode mode() {
        return OutputMode.CSV;
    }

    @Override
    public synchronized void open() {
        if (failOnOpen) {
            throw new PersistenceException("backend unreachable", null);
        }
        open = true;
    }

    @Override
    public synchronized UpsertResult upsert(EstateItem item) {
        if (!open) {
            throw new IllegalStateException("not open");
        }
        if (item.getId() == null) {
            anonymous.add(item);
            return UpsertResult.INSERTED;
        }
        return stored.putIfAbsent(item.getId().toString(), item) == null
                ? UpsertResult.INSERTED
                : UpsertResult.SKIPPED_DUPLICATE;
    }

    @Override
    public synchronized void close() {
        open = false;
        closeCount++;
    }

    public synchronized Map<String, EstateItem> getStored() {
        return new LinkedHashMap<>(stored);
    }

    public synchronized int size() {
        return stored.size() + anonymous.size();
    }

    public synchronized int getCloseCount() {
        return closeCount;
    }
}
