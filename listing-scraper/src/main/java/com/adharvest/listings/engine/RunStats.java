package com.adharvest.listings.engine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters accumulated across a whole run. Safe to update from several scope workers.
 */
public class RunStats {

    private final AtomicLong listingsSeen = new AtomicLong();
    private final AtomicLong uniqueEmitted = new AtomicLong();
    private final AtomicLong duplicatesSkipped = new AtomicLong();
    private final AtomicLong staleSeen = new AtomicLong();
    private final AtomicLong staleExcluded = new AtomicLong();
    private final AtomicLong listingsWithoutId = new AtomicLong();
    private final AtomicLong pagesFetched = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong rateLimited = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final List<ScopeOutcome> outcomes = new ArrayList<>();

    void listingSeen() { listingsSeen.incrementAndGet(); }
    void recordEmitted() { uniqueEmitted.incrementAndGet(); }
    void duplicateSkipped() { duplicatesSkipped.incrementAndGet(); }
    void staleSeen() { staleSeen.incrementAndGet(); }
    void staleExcluded() { staleExcluded.incrementAndGet(); }
    void listingWithoutId() { listingsWithoutId.incrementAndGet(); }
    void pageFetched() { pagesFetched.incrementAndGet(); }
    void retried() { retries.incrementAndGet(); }
    void rateLimited() { rateLimited.incrementAndGet(); }

    /** @return the error count after this increment */
    long errorRecorded() {
        return errors.incrementAndGet();
    }

    void scopeFinished(ScopeOutcome outcome) {
        synchronized (outcomes) {
            outcomes.add(outcome);
        }
    }

    boolean hasOutcomeFor(int position) {
        synchronized (outcomes) {
            return outcomes.stream().anyMatch(o -> o.position() == position);
        }
    }

    public long getListingsSeen() { return listingsSeen.get(); }
    public long getUniqueEmitted() { return uniqueEmitted.get(); }
    public long getDuplicatesSkipped() { return duplicatesSkipped.get(); }
    public long getStaleSeen() { return staleSeen.get(); }
    public long getStaleExcluded() { return staleExcluded.get(); }
    public long getListingsWithoutId() { return listingsWithoutId.get(); }
    public long getPagesFetched() { return pagesFetched.get(); }
    public long getRetries() { return retries.get(); }
    public long getRateLimited() { return rateLimited.get(); }
    public long getErrors() { return errors.get(); }

    /** Scopes that actually paginated, whatever the way they stopped. */
    public long getScopesProcessed() {
        synchronized (outcomes) {
            return outcomes.stream().filter(o -> o.pagesFetched() > 0 || o.reason() != StopReason.ABORTED).count();
        }
    }

    /** Outcomes ordered by scope position. */
    public List<ScopeOutcome> getOutcomes() {
        synchronized (outcomes) {
            List<ScopeOutcome> copy = new ArrayList<>(outcomes);
            copy.sort(Comparator.comparingInt(ScopeOutcome::position));
            return copy;
        }
    }

    public List<ScopeOutcome> getStoppedEarly() {
        return getOutcomes().stream().filter(ScopeOutcome::stoppedEarly).toList();
    }

    @Override
    public String toString() {
        return "RunStats{seen=" + getListingsSeen()
                + ", unique=" + getUniqueEmitted()
                + ", duplicates=" + getDuplicatesSkipped()
                + ", stale=" + getStaleSeen()
                + ", pages=" + getPagesFetched()
                + ", retries=" + getRetries()
                + ", scopes=" + getScopesProcessed()
                + ", errors=" + getErrors() + "}";
    }
}
