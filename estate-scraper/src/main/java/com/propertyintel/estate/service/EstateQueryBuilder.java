package com.propertyintel.estate.service;

import com.propertyintel.estate.config.EstateScraperProperties;
import com.propertyintel.estate.config.EstateScraperProperties.Category;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Builds estate search URLs, e.g.
 * {@code /estates?category_main_cb=1&category_type_cb=1&per_page=999&page=2&locality_region_id=10}
 */
@Component
@RequiredArgsConstructor
public class EstateQueryBuilder {

    private final EstateScraperProperties properties;

    /** Single-result query used only to read result_size */
    public String probeUrl(Category category) {
        return url(category, 1, 1);
    }

    public String pageUrl(Category category, int page) {
        return url(category, properties.getApi().getPageSize(), page);
    }

    private String url(Category category, int perPage, int page) {
        UriComponentsBuilder builder = UriComponentsBuilder
                .fromHttpUrl(properties.getApi().getBaseUrl() + "/estates")
                .queryParam("category_main_cb", category.getMainCb())
                .queryParam("category_type_cb", category.getTypeCb())
                .queryParam("per_page", perPage)
                .queryParam("page", page);
        properties.getApi().getExtraParams().forEach(builder::queryParam);
        return builder.toUriString();
    }
}
