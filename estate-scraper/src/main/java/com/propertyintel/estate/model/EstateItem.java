package com.propertyintel.estate.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One flattened listing on its way through the pipeline.
 *
 * Field names are underscore-joined JSON paths (price_czk_alt_value_raw,
 * embedded_company_name, ...). Absent JSON values have no key at all, so
 * two listings from the same page can expose different field sets.
 */
@Data
@Builder
public class EstateItem {

    public static final String ID_FIELD = "hash_id";

    @Builder.Default
    private Map<String, Object> fields = new LinkedHashMap<>();

    // ── Run metadata ────────────────────────────────────────────────────────
    private LocalDateTime scrapedAt;
    private int sourcePage;
    private String sourceCategory;

    public Object get(String field) {
        return fields.get(field);
    }

    /** The stable listing identifier, or null when the API omitted it */
    public Object getId() {
        return fields.get(ID_FIELD);
    }

    /** Null, blank text and empty lists all count as missing */
    public boolean hasValue(String field) {
        Object value = fields.get(field);
        if (value == null) return false;
        if (value instanceof CharSequence cs) return !cs.toString().isBlank();
        if (value instanceof Collection<?> c) return !c.isEmpty();
        return true;
    }
}
