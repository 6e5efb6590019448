package com.propertyintel.estate.model;

import com.propertyintel.estate.config.EstateScraperProperties.Category;

public record FetchTask(Category category, int page) {

    public String categoryName() {
        return category.getName();
    }
}
