package com.propertyintel.estate.model;

import java.util.List;

/**
 * End-of-run reconciliation, derived from {@link RunStatistics}.
 */
public record RunReport(
        List<CategoryLine> categories,
        long totalExpected,
        long totalFetched,
        long valid,
        long invalid,
        long duplicates,
        long persisted,
        int failedTasks,
        List<FetchFailure> failures) {

    public enum CategoryStatus { OK, INCOMPLETE, SKIPPED, PLANNING_FAILED }

    public record CategoryLine(String category, long expected, long fetched, CategoryStatus status) {}

    public long missing() {
        return Math.max(0, totalExpected - totalFetched);
    }

    public boolean isSuccess() {
        return totalFetched >= totalExpected;
    }

    public String verdict() {
        return isSuccess() ? "SUCCESS" : "MISSING-" + missing() + "-RECORDS";
    }
}
