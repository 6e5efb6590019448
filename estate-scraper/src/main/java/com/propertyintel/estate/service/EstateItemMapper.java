package com.propertyintel.estate.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.propertyintel.estate.model.EstateItem;
import com.propertyintel.estate.model.FetchTask;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps one raw estate object from the API into a flat {@link EstateItem}.
 *
 * Nested objects become underscore-joined keys with leading underscores
 * dropped per segment:
 * <pre>
 *   price_czk.alt.value_raw      → price_czk_alt_value_raw
 *   _links.self.href             → links_self_href
 *   _embedded.company.logo_small → embedded_company_logo_small
 * </pre>
 * Arrays are kept as lists: link objects contribute their href, nested
 * arrays are flattened. JSON nulls are left out.
 */
@Component
public class EstateItemMapper {

    public EstateItem map(JsonNode estate, FetchTask task) {
        Map<String, Object> fields = new LinkedHashMap<>();
        flatten("", estate, fields);

        return EstateItem.builder()
                .fields(fields)
                .scrapedAt(LocalDateTime.now())
                .sourcePage(task.page())
                .sourceCategory(task.categoryName())
                .build();
    }

    private void flatten(String prefix, JsonNode node, Map<String, Object> out) {
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String key = join(prefix, entry.getKey());
            JsonNode value = entry.getValue();

            if (value.isObject()) {
                flatten(key, value, out);
            } else if (value.isArray()) {
                List<Object> list = new ArrayList<>();
                collect(value, list);
                out.put(key, list);
            } else {
                Object scalar = scalar(value);
                if (scalar != null) out.put(key, scalar);
            }
        }
    }

    private void collect(JsonNode array, List<Object> out) {
        for (JsonNode element : array) {
            if (element.isArray()) {
                collect(element, out);
            } else if (element.isObject()) {
                JsonNode href = element.get("href");
                if (href != null && !href.isNull()) {
                    out.add(href.asText());
                } else {
                    out.add(element.toString());
                }
            } else {
                Object scalar = scalar(element);
                if (scalar != null) out.add(scalar);
            }
        }
    }

    private Object scalar(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) return null;
        if (value.isBoolean()) return value.booleanValue();
        if (value.isIntegralNumber()) return value.longValue();
        if (value.isNumber()) return value.doubleValue();
        return value.asText();
    }

    private String join(String prefix, String key) {
        String segment = stripLeadingUnderscores(key);
        return prefix.isEmpty() ? segment : prefix + "_" + segment;
    }

    private String stripLeadingUnderscores(String key) {
        int i = 0;
        while (i < key.length() - 1 && key.charAt(i) == '_') i++;
        return key.substring(i);
    }
}
