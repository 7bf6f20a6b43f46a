package com.adharvest.listings.model;

/**
 * A single page fetch. Created per call and thrown away afterwards.
 */
public record PageRequest(SearchScope scope, int pageIndex, int pageSize) {

    public static final int MAX_PAGE_SIZE = 35;

    public PageRequest {
        if (pageIndex < 1) {
            throw new IllegalArgumentException("pageIndex is 1-based, got " + pageIndex);
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("pageSize must be within 1.." + MAX_PAGE_SIZE + ", got " + pageSize);
        }
    }

    public int offset() {
        return (pageIndex - 1) * pageSize;
    }
}
