package com.adharvest.listings;

import com.adharvest.listings.model.FilterSet;
import com.adharvest.listings.model.LocationDescriptor;
import com.adharvest.listings.model.RawListing;
import com.adharvest.listings.model.SearchScope;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Shared fixtures: a fixed clock and listings dated relative to it.
 */
public final class TestListings {

    /** 2024-06-01 12:00:00 wall clock. */
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

    public static final String FRESH_DATE = "2024-06-01 10:00:00";
    public static final String STALE_DATE = "2024-05-20 08:30:00";

    private TestListings() {
    }

    public static RawListing listing(String id, String indexDate) {
        RawListing raw = new RawListing();
        raw.setId(id);
        raw.setSubject("Listing " + id);
        raw.setUrl("https://www.leboncoin.fr/ad/ventes_immobilieres/" + id);
        raw.setIndexDate(indexDate);
        raw.setFirstPublicationDate(indexDate);
        raw.setPrice(List.of(250_000L));
        return raw;
    }

    public static RawListing fresh(String id) {
        return listing(id, FRESH_DATE);
    }

    public static RawListing stale(String id) {
        return listing(id, STALE_DATE);
    }

    public static SearchScope scope(String label, int position) {
        return new SearchScope(label, position, new LocationDescriptor.Department("75"), FilterSet.unfiltered());
    }
}
