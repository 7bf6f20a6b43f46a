package com.adharvest.listings.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * One value of the category-dependent attribute filter map. The engine never looks inside;
 * only the page fetcher knows how the marketplace wants it encoded.
 */
public sealed interface FilterValue
        permits FilterValue.Scalar, FilterValue.Range, FilterValue.ValueSet {

    record Scalar(String value) implements FilterValue {
    }

    /** Either bound may be null (open-ended). */
    record Range(Long min, Long max) implements FilterValue {
    }

    record ValueSet(List<String> values) implements FilterValue {
        public ValueSet {
            values = List.copyOf(values);
        }
    }

    /**
     * Converts a loosely typed configuration value (YAML / JSON) into a filter value:
     * a collection becomes a {@link ValueSet}, a map with {@code min}/{@code max} keys a
     * {@link Range}, anything else a {@link Scalar}.
     *
     * @throws IllegalArgumentException when a range bound is not numeric or the value is null
     */
    static FilterValue of(Object raw) {
        if (raw == null) {
            throw new IllegalArgumentException("filter value must not be null");
        }
        if (raw instanceof FilterValue fv) {
            return fv;
        }
        if (raw instanceof Collection<?> items) {
            List<String> values = new ArrayList<>(items.size());
            for (Object item : items) {
                values.add(String.valueOf(item));
            }
            return new ValueSet(values);
        }
        if (raw instanceof Map<?, ?> map) {
            // YAML lists bound into a loose map arrive keyed "0", "1", ...
            if (!map.isEmpty() && map.keySet().stream().allMatch(k -> String.valueOf(k).matches("\\d+"))) {
                return of(new ArrayList<>(map.values()));
            }
            if (!map.containsKey("min") && !map.containsKey("max")) {
                throw new IllegalArgumentException("range filter needs a min or max key, got " + map.keySet());
            }
            return new Range(toLong(map.get("min")), toLong(map.get("max")));
        }
        return new Scalar(String.valueOf(raw));
    }

    private static Long toLong(Object bound) {
        if (bound == null) return null;
        if (bound instanceof Number n) return n.longValue();
        String s = bound.toString().trim();
        if (s.isEmpty() || s.equals("min") || s.equals("max")) return null;
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("range bound is not a number: " + bound, e);
        }
    }
}
