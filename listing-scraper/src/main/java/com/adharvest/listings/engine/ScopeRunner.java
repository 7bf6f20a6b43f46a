package com.adharvest.listings.engine;

import com.adharvest.listings.error.FatalFetchException;
import com.adharvest.listings.error.RunAbortedException;
import com.adharvest.listings.error.TransientFetchException;
import com.adharvest.listings.model.NormalizedRecord;
import com.adharvest.listings.model.PageRequest;
import com.adharvest.listings.model.RawListing;
import com.adharvest.listings.model.SearchScope;
import com.adharvest.listings.normalize.RecordNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Drives one scope through its state machine:
 * FETCHING → EVALUATING → (FETCHING | one of the STOPPED_* states).
 * Not thread-safe; one runner per scope.
 */
@Slf4j
class ScopeRunner {

    /** One fetch including retries; throws the fetch exception taxonomy on failure. */
    @FunctionalInterface
    interface PageCall {
        PageResult.Listings fetch(PageRequest request);
    }

    private final SearchScope scope;
    private final RunPolicy policy;
    private final RunContext context;
    private final PageCall pageCall;
    private final FreshnessGate gate;
    private final RecordNormalizer normalizer;
    private final RecordListener sink;

    private final FreshnessState freshness = new FreshnessState();
    private ScopeState state = ScopeState.FETCHING;
    private int pageIndex = 1;
    private int pagesFetched;
    private int recordsEmitted;
    private PageResult.Listings currentPage;
    private String detail;

    ScopeRunner(SearchScope scope, RunPolicy policy, RunContext context, PageCall pageCall,
                FreshnessGate gate, RecordNormalizer normalizer, RecordListener sink) {
        this.scope = scope;
        this.policy = policy;
        this.context = context;
        this.pageCall = pageCall;
        this.gate = gate;
        this.normalizer = normalizer;
        this.sink = sink;
    }

    ScopeOutcome run() {
        log.info("Scope [{}] started", scope.label());
        while (!state.isTerminal()) {
            state = switch (state) {
                case FETCHING -> fetch();
                case EVALUATING -> evaluate();
                default -> throw new IllegalStateException("Unexpected state " + state);
            };
        }
        ScopeOutcome outcome = new ScopeOutcome(scope.label(), scope.position(), state.stopReason(),
                pagesFetched, recordsEmitted, detail);
        log.info("Scope [{}] stopped: {} after {} pages, {} records",
                scope.label(), outcome.reason(), pagesFetched, recordsEmitted);
        return outcome;
    }

    // ── States ───────────────────────────────────────────────────────────────

    private ScopeState fetch() {
        if (context.isCancelled()) {
            detail = context.abortReason();
            return ScopeState.STOPPED_ABORTED;
        }
        PageRequest request = new PageRequest(scope, pageIndex, policy.pageSize());
        try {
            PageResult.Listings page = pageCall.fetch(request);
            pagesFetched++;
            context.stats().pageFetched();
            log.debug("Scope [{}] page {}: {} listings", scope.label(), pageIndex, page.listings().size());

            if (page.listings().isEmpty()) {
                return ScopeState.STOPPED_END_OF_RESULTS;
            }
            currentPage = page;
            return ScopeState.EVALUATING;

        } catch (FatalFetchException e) {
            if (context.isCancelled()) {
                return aborted();
            }
            log.error("Scope [{}] page {} rejected: {}", scope.label(), pageIndex, e.getMessage());
            detail = e.getMessage();
            context.recordError(policy.errorThreshold());
            return ScopeState.STOPPED_FATAL;

        } catch (TransientFetchException e) {
            // An interrupted backoff wait rethrows the last failure.
            if (context.isCancelled()) {
                return aborted();
            }
            log.warn("Scope [{}] page {} failed after retries: {}", scope.label(), pageIndex, e.getMessage());
            detail = e.getMessage();
            context.recordError(policy.errorThreshold());
            return ScopeState.STOPPED_ERROR;

        } catch (RunAbortedException e) {
            detail = e.getMessage();
            return ScopeState.STOPPED_ABORTED;
        }
    }

    private ScopeState aborted() {
        log.info("Scope [{}] page {} abandoned: run cancelled ({})", scope.label(), pageIndex, context.abortReason());
        detail = context.abortReason();
        return ScopeState.STOPPED_ABORTED;
    }

    private ScopeState evaluate() {
        for (RawListing listing : currentPage.listings()) {
            accept(listing);
        }
        Integer reportedMaxPages = currentPage.reportedMaxPages();
        currentPage = null;

        // Decided only once the whole page has been processed.
        if (freshness.limitExceeded(policy.consecutiveStaleLimit())) {
            detail = freshness.consecutiveStale() + " consecutive stale listings";
            return ScopeState.STOPPED_STALE_LIMIT;
        }
        if (policy.maxPages() > 0 && pageIndex >= policy.maxPages()) {
            return ScopeState.STOPPED_PAGE_BUDGET;
        }
        if (reportedMaxPages != null && pageIndex >= reportedMaxPages) {
            return ScopeState.STOPPED_END_OF_RESULTS;
        }

        try {
            pause(policy.pageDelay(), context);
        } catch (RunAbortedException e) {
            detail = e.getMessage();
            return ScopeState.STOPPED_ABORTED;
        }
        pageIndex++;
        return ScopeState.FETCHING;
    }

    private void accept(RawListing listing) {
        RunStats stats = context.stats();
        stats.listingSeen();

        String id = listing.getId();
        if (id == null || id.isBlank()) {
            stats.listingWithoutId();
            return;
        }
        if (!context.fingerprints().recordIfAbsent(id)) {
            stats.duplicateSkipped();
            return;
        }

        Freshness verdict = freshness.observe(gate.classify(listing));
        if (verdict == Freshness.STALE) {
            stats.staleSeen();
            if (policy.stalePolicy() == StalePolicy.EXCLUDE) {
                stats.staleExcluded();
                return;
            }
        }

        try {
            NormalizedRecord record = normalizer.normalize(listing, scope, policy.outputFormat());
            sink.onRecord(record);
            recordsEmitted++;
            stats.recordEmitted();
        } catch (RuntimeException e) {
            log.error("Scope [{}] could not normalize listing {}: {}", scope.label(), id, e.getMessage(), e);
            context.recordError(policy.errorThreshold());
        }
    }

    /**
     * Sleeps for the given delay unless the run is cancelled first.
     *
     * @throws RunAbortedException if the run is or becomes cancelled
     */
    static void pause(Duration delay, RunContext context) {
        context.checkNotCancelled();
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new RunAbortedException(context.isCancelled() ? context.abortReason() : "interrupted");
        }
        context.checkNotCancelled();
    }
}
