package com.adharvest.listings.request;

import com.adharvest.listings.engine.StalePolicy;
import com.adharvest.listings.location.LocationSpec;
import com.adharvest.listings.location.LocationType;
import com.adharvest.listings.model.AdType;
import com.adharvest.listings.model.OutputFormat;
import com.adharvest.listings.model.OwnerType;
import com.adharvest.listings.model.ProxySettings;
import com.adharvest.listings.model.SortOrder;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A declarative scrape request, bound from the REST body or from
 * {@code listing-scraper.request} in application.yml.
 *
 * Either set the search fields directly or give a marketplace search {@code url}; fields set
 * explicitly win over what the URL says.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScrapeRequest {

    // ── Search ───────────────────────────────────────────────────────────────
    private String url;
    private String category;
    private String text;
    private LocationType locationType;
    private List<LocationSpec> locations = new ArrayList<>();

    /** name → scalar, list of values, or {min, max} */
    private Map<String, Object> filters = new LinkedHashMap<>();

    private Long priceMin;
    private Long priceMax;
    private SortOrder sort;
    private AdType adType;
    private OwnerType ownerType;
    private Boolean shippable;

    // ── Pagination & freshness ───────────────────────────────────────────────
    /** 0 = unbounded */
    private int maxPages = 10;
    private int pageSize = 35;
    /** 0 = disabled; fractional days allowed */
    private double maxAgeDays = 0;
    private int consecutiveStaleLimit = 5;
    private StalePolicy stalePolicy = StalePolicy.EMIT;

    // ── Pacing & budgets ─────────────────────────────────────────────────────
    private long pageDelayMs = 0;
    private long scopeDelayMs = 0;
    /** null = use listing-scraper.engine.error-threshold */
    private Integer errorThreshold;

    // ── Output & transport ───────────────────────────────────────────────────
    private OutputFormat outputFormat = OutputFormat.DETAILED;
    private ProxySettings proxy;
}
