package com.adharvest.listings.model;

public enum SortOrder {
    RELEVANCE, NEWEST, OLDEST, CHEAPEST, EXPENSIVE
}
