package com.adharvest.listings.engine;

/**
 * Final state of one scope.
 *
 * @param detail error message or abort reason, null when the scope ended normally
 */
public record ScopeOutcome(
        String scopeLabel,
        int position,
        StopReason reason,
        int pagesFetched,
        int recordsEmitted,
        String detail
) {

    public boolean stoppedEarly() {
        return reason.isEarlyStop();
    }
}
