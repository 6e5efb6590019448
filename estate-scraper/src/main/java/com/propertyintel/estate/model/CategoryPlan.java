package com.propertyintel.estate.model;

import com.propertyintel.estate.config.EstateScraperProperties.Category;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Result of probing one partition: how many listings it holds and how many
 * pages of {@code pageSize} that takes.
 */
public record CategoryPlan(Category category, long expectedCount, int totalPages) {

    public static CategoryPlan of(Category category, long expectedCount, int pageSize) {
        return new CategoryPlan(category, expectedCount, pageCount(expectedCount, pageSize));
    }

    public static int pageCount(long expectedCount, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive, got " + pageSize);
        }
        if (expectedCount <= 0) return 0;
        return (int) ((expectedCount + pageSize - 1) / pageSize);
    }

    public List<FetchTask> tasks() {
        return IntStream.rangeClosed(1, totalPages)
                .mapToObj(page -> new FetchTask(category, page))
                .toList();
    }
}
