package com.adharvest.listings.model;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Search filters shared by every scope of a run.
 *
 * @param category   marketplace category identifier, null for all categories
 * @param text       free-text query
 * @param price      price bounds, null when unconstrained
 * @param attributes category-specific filters in declaration order
 */
@Builder(toBuilder = true)
public record FilterSet(
        String category,
        String text,
        FilterValue.Range price,
        Map<String, FilterValue> attributes,
        SortOrder sort,
        AdType adType,
        OwnerType ownerType,
        Boolean shippable
) {

    public FilterSet {
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        if (sort == null) sort = SortOrder.NEWEST;
        if (adType == null) adType = AdType.OFFER;
        if (ownerType == null) ownerType = OwnerType.ALL;
    }

    public static FilterSet unfiltered() {
        return FilterSet.builder().build();
    }
}
