package com.adharvest.listings.engine;

/**
 * What happens to a listing classified stale.
 */
public enum StalePolicy {
    /** Emit it anyway; staleness only feeds the consecutive-stale stop. */
    EMIT,
    /** Drop it from the output as well. */
    EXCLUDE
}
