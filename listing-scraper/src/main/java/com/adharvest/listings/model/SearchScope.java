package com.adharvest.listings.model;

import java.util.Objects;

/**
 * One resolved (location, filters) combination that the engine pages through on its own.
 *
 * @param label    provenance label copied into every record emitted for this scope
 * @param position 0-based position in the resolved scope list
 */
public record SearchScope(String label, int position, LocationDescriptor location, FilterSet filters) {

    public SearchScope {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(filters, "filters");
    }
}
