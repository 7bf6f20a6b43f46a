package com.adharvest.listings.engine;

/**
 * Why a scope stopped paginating.
 */
public enum StopReason {
    END_OF_RESULTS,
    STALE_LIMIT,
    PAGE_BUDGET,
    ERROR,
    FATAL,
    ABORTED;

    /** Anything but running out of results counts as an early stop. */
    public boolean isEarlyStop() {
        return this != END_OF_RESULTS;
    }
}
