package com.propertyintel.estate.pipeline;

public enum DropReason {
    MISSING_REQUIRED_FIELD("missing-required-field"),
    DUPLICATE_ID("duplicate-id");

    private final String label;

    DropReason(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return label;
    }
}
