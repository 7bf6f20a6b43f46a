package com.adharvest.listings.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Flat output unit of a run: one level of keys, scalar values except for explicitly
 * multi-valued fields which are lists.
 *
 * @param id        listing id, always a string, identical across projections
 * @param fields    projected fields in output order
 * @param scopeLabel label of the scope this record was found in
 * @param filters   filters of the originating scope
 */
public record NormalizedRecord(String id, Map<String, Object> fields, String scopeLabel, FilterSet filters) {

    public NormalizedRecord {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }
}
