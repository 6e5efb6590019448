package com.propertyintel.estate.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Counters and the seen-id set for a single crawl run.
 *
 * One instance is created per run and handed to every component that
 * records progress. All mutation goes through this object's monitor, so
 * workers finishing pages concurrently cannot lose increments and only one
 * of them can claim a given listing id.
 */
public class RunStatistics {

    private final Map<String, Long> expectedByCategory = new LinkedHashMap<>();
    private final Map<String, Long> fetchedByCategory = new LinkedHashMap<>();
    private final Set<String> skippedCategories = new LinkedHashSet<>();
    private final Set<String> failedCategories = new LinkedHashSet<>();
    private final Map<String, Long> missingByField = new LinkedHashMap<>();
    private final List<FetchFailure> failures = new ArrayList<>();
    private final Set<Object> seenIds = new HashSet<>();

    private long pagesFetched;
    private long itemsEmitted;
    private long valid;
    private long invalid;
    private long duplicates;
    private long counted;
    private long inserted;
    private long updated;
    private long persistSkipped;
    private long persistFailed;

    // ── Planning ────────────────────────────────────────────────────────────

    public synchronized void recordExpected(String category, long expected) {
        expectedByCategory.put(category, expected);
        fetchedByCategory.putIfAbsent(category, 0L);
        if (expected == 0) {
            skippedCategories.add(category);
        }
    }

    public synchronized void recordPlanningFailure(String category, String url, String reason) {
        failedCategories.add(category);
        failures.add(new FetchFailure(category, 0, url, reason));
    }

    // ── Fetching ────────────────────────────────────────────────────────────

    public synchronized void recordPage(String category, int records) {
        pagesFetched++;
        itemsEmitted += records;
        fetchedByCategory.merge(category, (long) records, Long::sum);
    }

    public synchronized void recordTaskFailure(String category, int page, String url, String reason) {
        failures.add(new FetchFailure(category, page, url, reason));
    }

    // ── Pipeline ────────────────────────────────────────────────────────────

    public synchronized void recordValid() {
        valid++;
    }

    public synchronized void recordInvalid(List<String> missingFields) {
        invalid++;
        for (String field : missingFields) {
            missingByField.merge(field, 1L, Long::sum);
        }
    }

    /**
     * Claims {@code id} for this run.
     *
     * @return true if this is the first time the id was seen, false if it is a duplicate
     */
    public synchronized boolean markSeen(Object id) {
        if (seenIds.add(normaliseId(id))) {
            return true;
        }
        duplicates++;
        return false;
    }

    public synchronized void recordCounted() {
        counted++;
    }

    public synchronized void recordUpsert(UpsertResult result) {
        switch (result) {
            case INSERTED -> inserted++;
            case UPDATED -> updated++;
            case SKIPPED_DUPLICATE -> persistSkipped++;
            case FAILED -> persistFailed++;
        }
    }

    // ── Reads ───────────────────────────────────────────────────────────────

    public synchronized Map<String, Long> getExpectedByCategory() {
        return new LinkedHashMap<>(expectedByCategory);
    }

    public synchronized Map<String, Long> getFetchedByCategory() {
        return new LinkedHashMap<>(fetchedByCategory);
    }

    public synchronized long getFetched(String category) {
        return fetchedByCategory.getOrDefault(category, 0L);
    }

    public synchronized Set<String> getSkippedCategories() {
        return new LinkedHashSet<>(skippedCategories);
    }

    public synchronized Set<String> getFailedCategories() {
        return new LinkedHashSet<>(failedCategories);
    }

    public synchronized Map<String, Long> getMissingByField() {
        return new LinkedHashMap<>(missingByField);
    }

    public synchronized long getMissing(String field) {
        return missingByField.getOrDefault(field, 0L);
    }

    public synchronized List<FetchFailure> getFailures() {
        return new ArrayList<>(failures);
    }

    /** Page-level failures only; probe failures are reported per category */
    public synchronized int getFailedTaskCount() {
        return (int) failures.stream().filter(f -> !f.isProbe()).count();
    }

    public synchronized long getTotalExpected() {
        return expectedByCategory.values().stream().mapToLong(Long::longValue).sum();
    }

    public synchronized long getTotalFetched() {
        return itemsEmitted;
    }

    public synchronized long getPagesFetched() {
        return pagesFetched;
    }

    public synchronized long getValid() {
        return valid;
    }

    public synchronized long getInvalid() {
        return invalid;
    }

    public synchronized long getDuplicates() {
        return duplicates;
    }

    public synchronized long getCounted() {
        return counted;
    }

    public synchronized long getInserted() {
        return inserted;
    }

    public synchronized long getUpdated() {
        return updated;
    }

    public synchronized long getPersisted() {
        return inserted + updated;
    }

    public synchronized long getPersistSkipped() {
        return persistSkipped;
    }

    public synchronized long getPersistFailed() {
        return persistFailed;
    }

    // The API returns hash_id as a number; a string "123" from another source is the same listing.
    private static Object normaliseId(Object id) {
        return id instanceof Number n ? Long.toString(n.longValue()) : id.toString();
    }
}
