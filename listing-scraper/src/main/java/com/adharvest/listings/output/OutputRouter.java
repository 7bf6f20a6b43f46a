package com.adharvest.listings.output;

import com.adharvest.listings.config.ScraperProperties;
import com.adharvest.listings.config.ScraperProperties.Output.OutputMode;
import com.adharvest.listings.model.NormalizedRecord;
import com.adharvest.listings.model.ScrapeRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Routes output to the appropriate sink(s) based on configuration.
 * Supports NONE, CSV, JSON, or BOTH modes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final CsvWriter csvWriter;
    private final JsonDatasetWriter jsonWriter;
    private final ScraperProperties properties;

    public void write(List<NormalizedRecord> records, String runId) {
        OutputMode mode = properties.getOutput().getMode();

        switch (mode) {
            case NONE -> log.debug("Output disabled, {} records kept in memory only", records.size());
            case CSV -> csvWriter.write(records, runId);
            case JSON -> jsonWriter.write(records, runId);
            case BOTH -> {
                csvWriter.write(records, runId);
                jsonWriter.write(records, runId);
            }
        }
    }

    public void writeScrapeRun(ScrapeRun run) {
        try {
            if (properties.getOutput().getMode() != OutputMode.NONE) {
                jsonWriter.writeScrapeRun(run);
            }
        } catch (Exception e) {
            log.warn("Failed to write scrape run metadata: {}", e.getMessage());
        }
    }
}
