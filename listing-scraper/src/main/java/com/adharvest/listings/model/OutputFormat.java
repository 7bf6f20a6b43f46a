package com.adharvest.listings.model;

/**
 * Output shape of a normalized record. Compact is a fixed subset of detailed.
 */
public enum OutputFormat {
    DETAILED, COMPACT
}
