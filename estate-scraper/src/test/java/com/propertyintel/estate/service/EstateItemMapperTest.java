package com.propertyintel.estate.service;

import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.estate.config.EstateScraperProperties.Category;
import com.propertyintel.estate.model.EstateItem;
import com.propertyintel.estate.model.FetchTask;
import org.junit.jupiter.api.Test;

class EstateItemMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EstateItemMapper mapper = new EstateItemMapper();
    private final FetchTask task = new FetchTask(new Category("houses-sale", 2, 1), 4);

    @Test
    void testFlattensNestedObjectsWithUnderscores() throws Exception {
        // Given
        String json = """
                {
                  "hash_id": 2151222620,
                  "name": "Prodej rodinného domu 160 m²",
                  "price_czk": {"value_raw": 8990000, "unit": "", "alt": {"value_raw": 56188, "unit": "za m²"}},
                  "gps": {"lat": 50.0875, "lon": 14.4213},
                  "_links": {"self": {"href": "/cs/v2/estates/2151222620"}},
                  "_embedded": {"company": {"id": 9, "name": "RK Praha"}},
                  "new": false
                }
                """;

        // When
        EstateItem item = mapper.map(objectMapper.readTree(json), task);

        // Then
        assertThat(item.getId()).isEqualTo(2151222620L);
        assertThat(item.get("price_czk_value_raw")).isEqualTo(8990000L);
        assertThat(item.get("price_czk_alt_value_raw")).isEqualTo(56188L);
        assertThat(item.get("price_czk_alt_unit")).isEqualTo("za m²");
        assertThat(item.get("gps_lat")).isEqualTo(50.0875);
        assertThat(item.get("links_self_href")).isEqualTo("/cs/v2/estates/2151222620");
        assertThat(item.get("embedded_company_name")).isEqualTo("RK Praha");
        assertThat(item.get("new")).isEqualTo(false);
        assertThat(item.getSourcePage()).isEqualTo(4);
        assertThat(item.getSourceCategory()).isEqualTo("houses-sale");
    }

    @Test
    void testLinkArraysBecomeHrefLists() throws Exception {
        // Given
        String json = """
                {"hash_id": 1, "_links": {"images": [{"href": "a.jpg"}, {"href": "b.jpg"}]},
                 "labelsAll": [["balcony", "cellar"], ["metro"]]}
                """;

        // When
        EstateItem item = mapper.map(objectMapper.readTree(json), task);

        // Then
        assertThat(item.get("links_images")).asList().containsExactly("a.jpg", "b.jpg");
        assertThat(item.get("labelsAll")).asList().containsExactly("balcony", "cellar", "metro");
    }

    @Test
    void testNullValuesAreOmitted() throws Exception {
        // Given
        String json = "{\"hash_id\": 1, \"name\": null, \"gps\": {\"lat\": null}}";

        // When
        EstateItem item = mapper.map(objectMapper.readTree(json), task);

        // Then
        assertThat(item.getFields()).containsOnlyKeys("hash_id");
        assertThat(item.hasValue("name")).isFalse();
    }
}
