package com.adharvest.listings.model;

import com.adharvest.listings.engine.RunStats;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each scrape run for the status endpoint and the run summary file.
 */
@Data
@Builder
public class ScrapeRun {

    private String runId;           // UUID
    private String source;          // "api", "scheduler", ...
    private int scopesResolved;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | PARTIAL | ABORTED | FAILED
    private int recordsEmitted;
    private String errorMessage;    // null on success
    private RunStats stats;
}
