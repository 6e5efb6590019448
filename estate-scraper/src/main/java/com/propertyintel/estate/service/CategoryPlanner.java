package com.propertyintel.estate.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.estate.client.FetchClient;
import com.propertyintel.estate.config.EstateScraperProperties;
import com.propertyintel.estate.config.EstateScraperProperties.Category;
import com.propertyintel.estate.model.CategoryPlan;
import com.propertyintel.estate.model.RunStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits the crawl into category partitions small enough to page through.
 *
 * The API stops serving pages past a fixed ceiling, so a single unfiltered
 * query cannot reach every listing. Each configured category is probed with
 * per_page=1 to read result_size, and its page count is derived from that.
 * Partitions that still exceed the ceiling are only logged: they are not
 * split further.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CategoryPlanner {

    private final FetchClient fetchClient;
    private final EstateQueryBuilder queryBuilder;
    private final ObjectMapper objectMapper;
    private final EstateScraperProperties properties;

    /**
     * Probe every category and return the plans that have pages to fetch.
     * Empty categories and failed probes are recorded in {@code stats} and
     * left out of the result.
     */
    public List<CategoryPlan> plan(List<Category> categories, RunStatistics stats) {
        int pageSize = properties.getApi().getPageSize();
        int maxPages = properties.getApi().getMaxPages();
        List<CategoryPlan> plans = new ArrayList<>();

        for (Category category : categories) {
            String url = queryBuilder.probeUrl(category);
            long expected;
            try {
                expected = readResultSize(fetchClient.fetch(url));
            } catch (Exception e) {
                log.error("Count probe failed for category {}, skipping it: {}", category.getName(), e.getMessage(), e);
                stats.recordPlanningFailure(category.getName(), url, e.getMessage());
                continue;
            }

            stats.recordExpected(category.getName(), expected);
            if (expected == 0) {
                log.info("Category {}: no listings, skipping", category.getName());
                continue;
            }

            CategoryPlan plan = CategoryPlan.of(category, expected, pageSize);
            if (maxPages > 0 && plan.totalPages() > maxPages) {
                log.warn("Category {} needs {} pages but the API serves at most {}; "
                                + "listings past page {} will be missing until the partition is narrowed",
                        category.getName(), plan.totalPages(), maxPages, maxPages);
            }
            log.info("Category {}: {} listings in {} pages of {}",
                    category.getName(), expected, plan.totalPages(), pageSize);
            plans.add(plan);
        }

        return plans;
    }

    private long readResultSize(String body) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        JsonNode size = root == null ? null : root.get("result_size");
        if (size == null || !size.isIntegralNumber()) {
            throw new IllegalStateException("Probe response has no integer result_size");
        }
        return size.longValue();
    }
}
