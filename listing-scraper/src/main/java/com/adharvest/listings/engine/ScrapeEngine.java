package com.adharvest.listings.engine;

import com.adharvest.listings.error.FatalFetchException;
import com.adharvest.listings.error.RunAbortedException;
import com.adharvest.listings.error.TransientFetchException;
import com.adharvest.listings.model.NormalizedRecord;
import com.adharvest.listings.model.PageRequest;
import com.adharvest.listings.model.SearchScope;
import com.adharvest.listings.normalize.RecordNormalizer;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns a resolved scope list into a deduplicated stream of normalized records.
 *
 * Pages within a scope are always fetched one at a time, with the configured delay between
 * them. Scopes themselves may run on a bounded worker pool ({@code scopeParallelism}); the
 * fingerprint store and statistics in the {@link RunContext} are shared between workers.
 *
 * Every fetch goes through the {@code pageFetch} Resilience4j retry (exponential backoff on
 * {@link TransientFetchException}) and time limiter (a timeout counts as transient).
 */
@Slf4j
public class ScrapeEngine implements AutoCloseable {

    private final PageFetcher fetcher;
    private final RecordNormalizer normalizer;
    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final Clock clock;
    private final int scopeParallelism;
    private final ExecutorService fetchExecutor;

    public ScrapeEngine(PageFetcher fetcher, RecordNormalizer normalizer, Retry retry,
                        TimeLimiter timeLimiter, Clock clock, int scopeParallelism) {
        this.fetcher = fetcher;
        this.normalizer = normalizer;
        this.retry = retry;
        this.timeLimiter = timeLimiter;
        this.clock = clock;
        this.scopeParallelism = Math.max(1, scopeParallelism);
        this.fetchExecutor = Executors.newCachedThreadPool(namedThreads("page-fetch"));
    }

    public ScrapeResult run(List<SearchScope> scopes, RunPolicy policy, RecordListener listener) {
        return run(scopes, policy, RunContext.create(), listener);
    }

    /**
     * Runs every scope to completion, or until the run is cancelled. Never throws for
     * per-scope failures; they end up in the {@link RunStats} outcomes.
     */
    public ScrapeResult run(List<SearchScope> scopes, RunPolicy policy, RunContext context, RecordListener listener) {
        log.info("Run {} starting: {} scopes, maxPages={}, maxAge={}, staleLimit={}, stalePolicy={}, workers={}",
                context.runId(), scopes.size(), policy.maxPages(), policy.maxAge(),
                policy.consecutiveStaleLimit(), policy.stalePolicy(), Math.min(scopeParallelism, Math.max(1, scopes.size())));

        FreshnessGate gate = new FreshnessGate(policy.maxAge(), clock);
        List<NormalizedRecord> records = new ArrayList<>();
        RecordListener sink = record -> {
            synchronized (records) {
                records.add(record);
                listener.onRecord(record);
            }
        };

        if (!scopes.isEmpty()) {
            runScopes(scopes, policy, context, gate, sink);
        }

        List<NormalizedRecord> emitted;
        synchronized (records) {
            emitted = List.copyOf(records);
        }
        ScrapeResult result = new ScrapeResult(context.runId(), emitted, context.stats(),
                context.isCancelled(), context.abortReason());

        if (result.aborted()) {
            log.error("Run {} aborted ({}): {} records kept, {}", context.runId(), result.abortReason(),
                    emitted.size(), context.stats());
        } else {
            log.info("Run {} completed: {}", context.runId(), context.stats());
        }
        return result;
    }

    @Override
    public void close() {
        fetchExecutor.shutdownNow();
    }

    // ── Scope scheduling ─────────────────────────────────────────────────────

    private void runScopes(List<SearchScope> scopes, RunPolicy policy, RunContext context,
                           FreshnessGate gate, RecordListener sink) {
        int workers = Math.min(scopeParallelism, scopes.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers, namedThreads("scope-" + shortId(context)));
        List<Future<?>> futures = new ArrayList<>(scopes.size());

        try {
            for (SearchScope scope : scopes) {
                futures.add(pool.submit(() -> runScope(scope, workers, policy, context, gate, sink)));
            }
            context.onCancel(() -> futures.forEach(f -> f.cancel(true)));

            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (CancellationException e) {
                    log.debug("Scope worker cancelled for run {}", context.runId());
                } catch (ExecutionException e) {
                    log.error("Scope worker failed unexpectedly: {}", e.getCause().getMessage(), e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    context.cancel("caller interrupted");
                    break;
                }
            }
        } finally {
            pool.shutdownNow();
            awaitQuietly(pool);
        }

        for (SearchScope scope : scopes) {
            if (!context.stats().hasOutcomeFor(scope.position())) {
                context.stats().scopeFinished(new ScopeOutcome(scope.label(), scope.position(),
                        StopReason.ABORTED, 0, 0, context.abortReason()));
            }
        }
    }

    private void runScope(SearchScope scope, int workers, RunPolicy policy, RunContext context,
                          FreshnessGate gate, RecordListener sink) {
        ScopeOutcome outcome;
        try {
            // The first scope each worker picks up starts immediately.
            if (scope.position() >= workers) {
                ScopeRunner.pause(policy.scopeDelay(), context);
            }
            ScopeRunner runner = new ScopeRunner(scope, policy, context,
                    request -> fetchWithRetry(request, policy, context), gate, normalizer, sink);
            outcome = runner.run();
        } catch (RunAbortedException e) {
            outcome = new ScopeOutcome(scope.label(), scope.position(), StopReason.ABORTED, 0, 0, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Scope [{}] crashed: {}", scope.label(), e.getMessage(), e);
            context.recordError(policy.errorThreshold());
            outcome = new ScopeOutcome(scope.label(), scope.position(), StopReason.ERROR, 0, 0, e.getMessage());
        }
        context.stats().scopeFinished(outcome);
    }

    // ── Fetching ─────────────────────────────────────────────────────────────

    PageResult.Listings fetchWithRetry(PageRequest request, RunPolicy policy, RunContext context) {
        AtomicInteger attempts = new AtomicInteger();
        return retry.executeSupplier(() -> {
            context.checkNotCancelled();
            int attempt = attempts.incrementAndGet();
            if (attempt > 1) {
                context.stats().retried();
                log.info("Scope [{}] page {}: attempt {}", request.scope().label(), request.pageIndex(), attempt);
            }
            return fetchOnce(request, policy, context);
        });
    }

    private PageResult.Listings fetchOnce(PageRequest request, RunPolicy policy, RunContext context) {
        PageResult result;
        try {
            result = timeLimiter.executeFutureSupplier(
                    () -> fetchExecutor.submit(() -> fetcher.fetch(request.scope(), request, policy.proxy())));
        } catch (TimeoutException e) {
            throw new TransientFetchException("page " + request.pageIndex() + " timed out after "
                    + timeLimiter.getTimeLimiterConfig().getTimeoutDuration(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunAbortedException(context.isCancelled() ? context.abortReason() : "interrupted while fetching");
        } catch (TransientFetchException | FatalFetchException | RunAbortedException e) {
            throw e;
        } catch (Exception e) {
            throw new TransientFetchException("page " + request.pageIndex() + " failed: " + e.getMessage(), e);
        }

        if (result instanceof PageResult.Listings listings) {
            return listings;
        }
        if (result instanceof PageResult.RateLimited limited) {
            context.stats().rateLimited();
            log.warn("Rate limited on scope [{}] page {}: {}", request.scope().label(), request.pageIndex(), limited.detail());
            throw new TransientFetchException("rate limited: " + limited.detail());
        }
        if (result instanceof PageResult.TransientError transientError) {
            throw new TransientFetchException(transientError.detail());
        }
        if (result instanceof PageResult.FatalError fatal) {
            throw new FatalFetchException(fatal.detail());
        }
        throw new TransientFetchException("page fetcher returned no result");
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static String shortId(RunContext context) {
        String id = context.runId();
        return id.length() > 8 ? id.substring(0, 8) : id;
    }

    private static void awaitQuietly(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
                log.warn("Scope workers did not stop within a minute");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
