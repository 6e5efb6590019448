package com.propertyintel.estate.model;

import static org.assertj.core.api.Assertions.*;

import com.propertyintel.estate.config.EstateScraperProperties.Category;
import java.util.List;
import org.junit.jupiter.api.Test;

class CategoryPlanTest {

    private final Category flats = new Category("flats-sale", 1, 1);

    @Test
    void testPageCountRoundsUp() {
        assertThat(CategoryPlan.pageCount(2500, 999)).isEqualTo(3);
        assertThat(CategoryPlan.pageCount(999, 999)).isEqualTo(1);
        assertThat(CategoryPlan.pageCount(1000, 999)).isEqualTo(2);
        assertThat(CategoryPlan.pageCount(1, 999)).isEqualTo(1);
    }

    @Test
    void testEmptyCategoryHasNoTasks() {
        // Given
        CategoryPlan plan = CategoryPlan.of(flats, 0, 999);

        // When/Then
        assertThat(plan.totalPages()).isZero();
        assertThat(plan.tasks()).isEmpty();
    }

    @Test
    void testTasksCoverEveryPageFromOne() {
        // Given
        CategoryPlan plan = CategoryPlan.of(flats, 2500, 999);

        // When
        List<FetchTask> tasks = plan.tasks();

        // Then
        assertThat(tasks).extracting(FetchTask::page).containsExactly(1, 2, 3);
        assertThat(tasks).extracting(FetchTask::categoryName).containsOnly("flats-sale");
    }

    @Test
    void testRejectsNonPositivePageSize() {
        assertThatThrownBy(() -> CategoryPlan.pageCount(10, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
