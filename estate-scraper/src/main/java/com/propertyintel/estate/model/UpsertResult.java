package com.propertyintel.estate.model;

public enum UpsertResult {
    INSERTED,
    UPDATED,
    SKIPPED_DUPLICATE,
    FAILED;

    public boolean isPersisted() {
        return this == INSERTED || this == UPDATED;
    }
}
