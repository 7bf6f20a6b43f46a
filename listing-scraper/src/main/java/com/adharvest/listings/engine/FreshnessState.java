package com.adharvest.listings.engine;

/**
 * Consecutive-stale counter of one scope, in page order.
 */
public class FreshnessState {

    private int consecutiveStale;

    /** Folds one classification into the counter and hands it back. */
    public Freshness observe(Freshness freshness) {
        if (freshness == Freshness.STALE) {
            consecutiveStale++;
        } else {
            consecutiveStale = 0;
        }
        return freshness;
    }

    public int consecutiveStale() {
        return consecutiveStale;
    }

    /**
     * The limit is the number of back-to-back stale listings tolerated; the scope stops once
     * the current run of stale listings goes past it. A limit of 0 or less never triggers.
     */
    public boolean limitExceeded(int limit) {
        return limit > 0 && consecutiveStale > limit;
    }
}
