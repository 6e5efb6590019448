package com.propertyintel.estate.service;

import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.estate.client.ScriptedFetchClient;
import com.propertyintel.estate.client.TransientFetchException;
import com.propertyintel.estate.config.EstateScraperProperties;
import com.propertyintel.estate.config.EstateScraperProperties.Category;
import com.propertyintel.estate.model.CategoryPlan;
import com.propertyintel.estate.model.RunStatistics;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CategoryPlannerTest {

    private final Category flats = new Category("flats-sale", 1, 1);
    private final Category land = new Category("land-rent", 3, 2);
    private final Category houses = new Category("houses-sale", 2, 1);

    private EstateScraperProperties properties;
    private EstateQueryBuilder queryBuilder;
    private ScriptedFetchClient client;
    private CategoryPlanner planner;
    private RunStatistics stats;

    @BeforeEach
    void setUp() {
        properties = new EstateScraperProperties();
        queryBuilder = new EstateQueryBuilder(properties);
        client = new ScriptedFetchClient();
        planner = new CategoryPlanner(client, queryBuilder, new ObjectMapper(), properties);
        stats = new RunStatistics();
    }

    @Test
    void testPlansPagesFromResultSize() {
        // Given
        client.respond(queryBuilder.probeUrl(flats), "{\"result_size\": 2500}");

        // When
        List<CategoryPlan> plans = planner.plan(List.of(flats), stats);

        // Then
        assertThat(plans).hasSize(1);
        assertThat(plans.get(0).expectedCount()).isEqualTo(2500);
        assertThat(plans.get(0).totalPages()).isEqualTo(3);
        assertThat(stats.getTotalExpected()).isEqualTo(2500);
        assertThat(client.getCalls()).containsExactly(queryBuilder.probeUrl(flats));
    }

    @Test
    void testProbeAsksForSingleResult() {
        assertThat(queryBuilder.probeUrl(flats))
                .contains("category_main_cb=1")
                .contains("category_type_cb=1")
                .contains("per_page=1")
                .contains("page=1");
    }

    @Test
    void testEmptyCategoryIsSkipped() {
        // Given
        client.respond(queryBuilder.probeUrl(land), "{\"result_size\": 0}");

        // When
        List<CategoryPlan> plans = planner.plan(List.of(land), stats);

        // Then
        assertThat(plans).isEmpty();
        assertThat(stats.getSkippedCategories()).containsExactly("land-rent");
        assertThat(stats.getExpectedByCategory()).containsEntry("land-rent", 0L);
    }

    @Test
    void testFailedProbeDoesNotStopOtherCategories() {
        // Given
        client.fail(queryBuilder.probeUrl(houses),
                new TransientFetchException("HTTP 503", queryBuilder.probeUrl(houses), 503, null));
        client.respond(queryBuilder.probeUrl(flats), "{\"result_size\": 10}");

        // When
        List<CategoryPlan> plans = planner.plan(List.of(houses, flats), stats);

        // Then
        assertThat(plans).extracting(p -> p.category().getName()).containsExactly("flats-sale");
        assertThat(stats.getFailedCategories()).containsExactly("houses-sale");
        assertThat(stats.getFailures()).singleElement()
                .satisfies(f -> {
                    assertThat(f.isProbe()).isTrue();
                    assertThat(f.reason()).isEqualTo("HTTP 503");
                });
        assertThat(stats.getExpectedByCategory()).doesNotContainKey("houses-sale");
    }

    @Test
    void testProbeWithoutResultSizeIsPlanningFailure() {
        // Given
        client.respond(queryBuilder.probeUrl(flats), "{\"_embedded\": {}}");

        // When
        List<CategoryPlan> plans = planner.plan(List.of(flats), stats);

        // Then
        assertThat(plans).isEmpty();
        assertThat(stats.getFailedCategories()).containsExactly("flats-sale");
    }

    @Test
    void testPartitionAboveCeilingIsStillPlanned() {
        // Given
        properties.getApi().setMaxPages(2);
        client.respond(queryBuilder.probeUrl(flats), "{\"result_size\": 5000}");

        // When
        List<CategoryPlan> plans = planner.plan(List.of(flats), stats);

        // Then
        assertThat(plans).singleElement()
                .satisfies(p -> assertThat(p.totalPages()).isEqualTo(6));
    }
}
