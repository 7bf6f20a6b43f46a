package com.adharvest.listings.config;

import com.adharvest.listings.error.ConfigurationException;
import com.adharvest.listings.model.ScrapeRun;
import com.adharvest.listings.request.ScrapeRequest;
import com.adharvest.listings.service.ListingScrapeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class ScrapeController {

    private final ListingScrapeService scrapeService;
    private final ScraperProperties properties;

    // ── Scrape triggers ───────────────────────────────────────────────────────

    /**
     * Start a run. The body is a scrape request; without a body the configured default
     * request is used.
     *
     * POST /scrape/runs
     */
    @PostMapping("/scrape/runs")
    public ResponseEntity<Map<String, String>> trigger(@RequestBody(required = false) ScrapeRequest request) {
        ScrapeRequest effective = request != null ? request : properties.getRequest();
        try {
            ScrapeRun run = scrapeService.start(effective, "api");
            return ResponseEntity.accepted().body(Map.of("status", "accepted", "runId", run.getRunId()));
        } catch (ConfigurationException e) {
            log.warn("Rejected scrape request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (TaskRejectedException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "too many scrape runs queued, retry later"));
        }
    }

    @PostMapping("/scrape/runs/{runId}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String runId) {
        if (scrapeService.get(runId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        boolean cancelled = scrapeService.cancel(runId);
        return ResponseEntity.accepted().body(Map.of("runId", runId, "cancelled", String.valueOf(cancelled)));
    }

    // ── Run status ────────────────────────────────────────────────────────────

    @GetMapping("/scrape/runs/{runId}")
    public ResponseEntity<ScrapeRun> run(@PathVariable String runId) {
        return scrapeService.get(runId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/scrape/runs")
    public ResponseEntity<List<ScrapeRun>> runs() {
        return ResponseEntity.ok(scrapeService.list());
    }

    @GetMapping("/scrape/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
                "service", "adharvest-listing-scraper",
                "version", "1.0.0",
                "source", properties.getApi().getBaseUrl(),
                "outputMode", properties.getOutput().getMode().name(),
                "scopeParallelism", properties.getEngine().getScopeParallelism()
        ));
    }
}
