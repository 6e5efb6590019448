package com.propertyintel.estate.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.estate.client.FetchClient;
import com.propertyintel.estate.model.EstateItem;
import com.propertyintel.estate.model.FetchTask;
import com.propertyintel.estate.model.RunStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Fetches one result page and turns it into items.
 *
 * Never throws for a bad page: fetch and parse failures are recorded in
 * the run statistics and the page yields no items.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PageFetcher {

    private final FetchClient fetchClient;
    private final EstateQueryBuilder queryBuilder;
    private final EstateItemMapper mapper;
    private final ObjectMapper objectMapper;

    public List<EstateItem> fetch(FetchTask task, RunStatistics stats) {
        String url = queryBuilder.pageUrl(task.category(), task.page());

        String body;
        try {
            body = fetchClient.fetch(url);
        } catch (Exception e) {
            log.error("Fetch failed for {} page {}: {}", task.categoryName(), task.page(), e.getMessage());
            stats.recordTaskFailure(task.categoryName(), task.page(), url, e.getMessage());
            return List.of();
        }

        JsonNode estates;
        try {
            estates = objectMapper.readTree(body).path("_embedded").path("estates");
        } catch (Exception e) {
            log.error("Unparseable page {} page {}: {}", task.categoryName(), task.page(), e.getMessage());
            stats.recordTaskFailure(task.categoryName(), task.page(), url, "invalid JSON: " + e.getMessage());
            return List.of();
        }

        if (!estates.isArray()) {
            log.error("Page {} page {} has no _embedded.estates list", task.categoryName(), task.page());
            stats.recordTaskFailure(task.categoryName(), task.page(), url, "missing _embedded.estates");
            return List.of();
        }

        if (estates.isEmpty()) {
            log.warn("Page {} of {} came back empty (planner miscount or API drift?)", task.page(), task.categoryName());
        }

        List<EstateItem> items = new ArrayList<>(estates.size());
        for (JsonNode estate : estates) {
            items.add(mapper.map(estate, task));
        }

        stats.recordPage(task.categoryName(), items.size());
        log.info("Fetched {} page {}: {} listings", task.categoryName(), task.page(), items.size());
        return items;
    }
}
