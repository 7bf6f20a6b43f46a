package com.adharvest.listings.engine;

import com.adharvest.listings.model.NormalizedRecord;

import java.util.List;

/**
 * Everything a finished run produced. When {@code aborted} is set the records are partial.
 */
public record ScrapeResult(
        String runId,
        List<NormalizedRecord> records,
        RunStats stats,
        boolean aborted,
        String abortReason
) {

    public boolean anyScopeStoppedEarly() {
        return !stats.getStoppedEarly().isEmpty();
    }
}
