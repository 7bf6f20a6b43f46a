package com.adharvest.listings.service;

import com.adharvest.listings.config.ScraperConfiguration;
import com.adharvest.listings.config.ScraperProperties;
import com.adharvest.listings.engine.RecordListener;
import com.adharvest.listings.engine.RunContext;
import com.adharvest.listings.engine.ScopeOutcome;
import com.adharvest.listings.engine.ScrapeEngine;
import com.adharvest.listings.engine.ScrapeResult;
import com.adharvest.listings.engine.StopReason;
import com.adharvest.listings.model.ScrapeRun;
import com.adharvest.listings.output.OutputRouter;
import com.adharvest.listings.request.ScrapeRequest;
import com.adharvest.listings.request.SearchRequestFactory;
import com.adharvest.listings.request.SearchRequestFactory.PreparedRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Orchestrates scrape runs: prepares the request, drives the engine, writes the output and
 * keeps the run summary for the status endpoint.
 *
 * Configuration errors surface synchronously from {@link #start} and {@link #runNow};
 * anything after that is recorded on the {@link ScrapeRun}. Only the most recent finished
 * runs are kept ({@code listing-scraper.engine.run-history}).
 */
@Service
@Slf4j
public class ListingScrapeService {

    private final SearchRequestFactory requestFactory;
    private final ScrapeEngine engine;
    private final OutputRouter outputRouter;
    private final TaskExecutor runExecutor;
    private final ScraperProperties properties;

    private final Map<String, ScrapeRun> runs = new ConcurrentHashMap<>();
    private final Map<String, RunContext> active = new ConcurrentHashMap<>();
    private final Queue<String> finished = new ConcurrentLinkedQueue<>();

    public ListingScrapeService(SearchRequestFactory requestFactory,
                                ScrapeEngine engine,
                                OutputRouter outputRouter,
                                @Qualifier(ScraperConfiguration.RUN_EXECUTOR) TaskExecutor runExecutor,
                                ScraperProperties properties) {
        this.requestFactory = requestFactory;
        this.engine = engine;
        this.outputRouter = outputRouter;
        this.runExecutor = runExecutor;
        this.properties = properties;
    }

    /**
     * Validates the request and queues it on the run executor.
     *
     * @return the run in RUNNING state
     * @throws TaskRejectedException when the run queue is full
     */
    public ScrapeRun start(ScrapeRequest request, String source) {
        PreparedRun prepared = requestFactory.prepare(request);
        RunContext context = RunContext.create();
        ScrapeRun run = register(context, prepared, source);

        try {
            runExecutor.execute(() -> execute(run, context, prepared));
        } catch (TaskRejectedException e) {
            runs.remove(run.getRunId());
            active.remove(run.getRunId());
            log.warn("Run {} rejected: run queue is full", run.getRunId());
            throw e;
        }
        return run;
    }

    /**
     * Validates the request and runs it on the calling thread.
     */
    public ScrapeRun runNow(ScrapeRequest request, String source) {
        PreparedRun prepared = requestFactory.prepare(request);
        RunContext context = RunContext.create();
        ScrapeRun run = register(context, prepared, source);
        execute(run, context, prepared);
        return run;
    }

    public Optional<ScrapeRun> get(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    /** All known runs, newest first. */
    public List<ScrapeRun> list() {
        Collection<ScrapeRun> all = runs.values();
        return all.stream()
                .sorted(Comparator.comparing(ScrapeRun::getStartedAt).reversed())
                .toList();
    }

    /**
     * @return false when the run is unknown or already finished
     */
    public boolean cancel(String runId) {
        RunContext context = active.get(runId);
        if (context == null) {
            return false;
        }
        return context.cancel("cancelled by user");
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ScrapeRun register(RunContext context, PreparedRun prepared, String source) {
        ScrapeRun run = ScrapeRun.builder()
                .runId(context.runId())
                .source(source)
                .scopesResolved(prepared.scopes().size())
                .startedAt(LocalDateTime.now())
                .status("RUNNING")
                .stats(context.stats())
                .build();
        runs.put(run.getRunId(), run);
        active.put(run.getRunId(), context);
        return run;
    }

    private void execute(ScrapeRun run, RunContext context, PreparedRun prepared) {
        log.info("Run {} ({}): {} scopes", run.getRunId(), run.getSource(), prepared.scopes().size());
        try {
            ScrapeResult result = engine.run(prepared.scopes(), prepared.policy(), context, RecordListener.noop());

            run.setRecordsEmitted(result.records().size());
            outputRouter.write(result.records(), run.getRunId());

            run.setStatus(status(result));
            if (result.aborted()) {
                run.setErrorMessage(result.abortReason());
            } else if ("PARTIAL".equals(run.getStatus())) {
                run.setErrorMessage(firstFailure(result));
            }

        } catch (Exception e) {
            log.error("Run {} failed: {}", run.getRunId(), e.getMessage(), e);
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
        } finally {
            active.remove(run.getRunId());
            run.setCompletedAt(LocalDateTime.now());
            outputRouter.writeScrapeRun(run);
            log.info("Run {} finished with status {}: {} records", run.getRunId(), run.getStatus(), run.getRecordsEmitted());
            finished.add(run.getRunId());
            evictFinishedRuns();
        }
    }

    private void evictFinishedRuns() {
        int history = properties.getEngine().getRunHistory();
        while (history > 0 && finished.size() > history) {
            String evicted = finished.poll();
            if (evicted == null) {
                break;
            }
            runs.remove(evicted);
            log.debug("Run {} dropped from history", evicted);
        }
    }

    static String status(ScrapeResult result) {
        if (result.aborted()) {
            return "ABORTED";
        }
        boolean failedScopes = result.stats().getOutcomes().stream().anyMatch(ListingScrapeService::failed);
        return failedScopes ? "PARTIAL" : "SUCCESS";
    }

    private static boolean failed(ScopeOutcome outcome) {
        return outcome.reason() == StopReason.ERROR || outcome.reason() == StopReason.FATAL;
    }

    private static String firstFailure(ScrapeResult result) {
        return result.stats().getOutcomes().stream()
                .filter(ListingScrapeService::failed)
                .map(o -> o.scopeLabel() + ": " + o.detail())
                .findFirst()
                .orElse(null);
    }
}
