package com.adharvest.listings.engine;

import com.adharvest.listings.model.OutputFormat;
import com.adharvest.listings.model.PageRequest;
import com.adharvest.listings.model.ProxySettings;
import lombok.Builder;

import java.time.Duration;

/**
 * Per-run knobs of the engine.
 *
 * @param maxPages              fetch calls allowed per scope, 0 for unbounded
 * @param maxAge                freshness window, null or zero disables it
 * @param consecutiveStaleLimit stale listings tolerated back to back before a scope stops
 * @param errorThreshold        errors after which the whole run is aborted, 0 disables
 */
@Builder(toBuilder = true)
public record RunPolicy(
        int pageSize,
        int maxPages,
        Duration maxAge,
        int consecutiveStaleLimit,
        StalePolicy stalePolicy,
        Duration pageDelay,
        Duration scopeDelay,
        int errorThreshold,
        OutputFormat outputFormat,
        ProxySettings proxy
) {

    public static final int DEFAULT_STALE_LIMIT = 5;

    public RunPolicy {
        if (pageSize == 0) pageSize = PageRequest.MAX_PAGE_SIZE;
        if (stalePolicy == null) stalePolicy = StalePolicy.EMIT;
        if (pageDelay == null) pageDelay = Duration.ZERO;
        if (scopeDelay == null) scopeDelay = Duration.ZERO;
        if (outputFormat == null) outputFormat = OutputFormat.DETAILED;
        if (proxy == null) proxy = ProxySettings.none();
        if (pageSize < 1 || pageSize > PageRequest.MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("pageSize must be within 1.." + PageRequest.MAX_PAGE_SIZE);
        }
        if (maxPages < 0) throw new IllegalArgumentException("maxPages must be >= 0");
        if (errorThreshold < 0) throw new IllegalArgumentException("errorThreshold must be >= 0");
    }

    public static RunPolicy defaults() {
        return RunPolicy.builder().consecutiveStaleLimit(DEFAULT_STALE_LIMIT).build();
    }
}
