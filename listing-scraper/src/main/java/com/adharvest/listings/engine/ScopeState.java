package com.adharvest.listings.engine;

/**
 * Lifecycle of one scope inside a run. {@code FETCHING} and {@code EVALUATING} are the only
 * live states; every other state is terminal and maps to exactly one {@link StopReason}.
 */
public enum ScopeState {
    FETCHING(null),
    EVALUATING(null),
    STOPPED_END_OF_RESULTS(StopReason.END_OF_RESULTS),
    STOPPED_STALE_LIMIT(StopReason.STALE_LIMIT),
    STOPPED_PAGE_BUDGET(StopReason.PAGE_BUDGET),
    STOPPED_ERROR(StopReason.ERROR),
    STOPPED_FATAL(StopReason.FATAL),
    STOPPED_ABORTED(StopReason.ABORTED);

    private final StopReason stopReason;

    ScopeState(StopReason stopReason) {
        this.stopReason = stopReason;
    }

    public boolean isTerminal() {
        return stopReason != null;
    }

    public StopReason stopReason() {
        if (stopReason == null) {
            throw new IllegalStateException(name() + " is not a terminal state");
        }
        return stopReason;
    }
}
