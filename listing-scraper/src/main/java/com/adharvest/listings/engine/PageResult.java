package com.adharvest.listings.engine;

import com.adharvest.listings.model.RawListing;

import java.util.List;

/**
 * Outcome of one page fetch.
 */
public sealed interface PageResult
        permits PageResult.Listings, PageResult.RateLimited, PageResult.TransientError, PageResult.FatalError {

    /**
     * A page of listings in upstream order, possibly empty.
     *
     * @param reportedMaxPages last page number announced by the marketplace, null when unknown
     */
    record Listings(List<RawListing> listings, Integer reportedMaxPages) implements PageResult {
        public Listings {
            listings = List.copyOf(listings);
        }
    }

    record RateLimited(String detail) implements PageResult {
    }

    record TransientError(String detail) implements PageResult {
    }

    record FatalError(String detail) implements PageResult {
    }

    static PageResult listings(List<RawListing> listings) {
        return new Listings(listings, null);
    }

    static PageResult empty() {
        return new Listings(List.of(), null);
    }
}
