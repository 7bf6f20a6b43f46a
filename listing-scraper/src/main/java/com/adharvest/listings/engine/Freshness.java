package com.adharvest.listings.engine;

public enum Freshness {
    FRESH, STALE
}
