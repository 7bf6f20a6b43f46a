package com.adharvest.listings.request;

import com.adharvest.listings.engine.RunPolicy;
import com.adharvest.listings.error.ConfigurationException;
import com.adharvest.listings.location.LocationResolver;
import com.adharvest.listings.location.LocationType;
import com.adharvest.listings.model.FilterSet;
import com.adharvest.listings.model.FilterValue;
import com.adharvest.listings.model.PageRequest;
import com.adharvest.listings.model.SearchScope;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates a {@link ScrapeRequest} and turns it into the scope list and policy of a run.
 * Every problem surfaces here as a {@link ConfigurationException}, before any fetch.
 */
@Slf4j
public class SearchRequestFactory {

    /** Scopes and policy ready for the engine. */
    public record PreparedRun(List<SearchScope> scopes, RunPolicy policy) {
    }

    private final LocationResolver locationResolver;
    private final SearchUrlParser urlParser;
    private final int defaultErrorThreshold;

    public SearchRequestFactory(LocationResolver locationResolver, SearchUrlParser urlParser, int defaultErrorThreshold) {
        this.locationResolver = locationResolver;
        this.urlParser = urlParser;
        this.defaultErrorThreshold = defaultErrorThreshold;
    }

    public PreparedRun prepare(ScrapeRequest request) {
        if (request == null) {
            throw new ConfigurationException("scrape request is required");
        }
        ScrapeRequest effective = request.getUrl() != null && !request.getUrl().isBlank()
                ? withUrl(request)
                : request;

        FilterSet filters = filters(effective);
        LocationType type = effective.getLocationType() != null ? effective.getLocationType() : LocationType.NONE;
        List<SearchScope> scopes = locationResolver.resolve(type, effective.getLocations(), filters);
        RunPolicy policy = policy(effective);

        log.info("Prepared run: {} scopes ({}), category={}, maxPages={}, format={}",
                scopes.size(), type, filters.category(), policy.maxPages(), policy.outputFormat());
        return new PreparedRun(scopes, policy);
    }

    // ── Filters ──────────────────────────────────────────────────────────────

    FilterSet filters(ScrapeRequest request) {
        Long min = request.getPriceMin();
        Long max = request.getPriceMax();
        if (min != null && min < 0 || max != null && max < 0) {
            throw new ConfigurationException("price bounds must not be negative");
        }
        if (min != null && max != null && min > max) {
            throw new ConfigurationException("priceMin " + min + " is greater than priceMax " + max);
        }

        Map<String, FilterValue> attributes = new LinkedHashMap<>();
        if (request.getFilters() != null) {
            request.getFilters().forEach((name, raw) -> {
                if (name == null || name.isBlank()) {
                    throw new ConfigurationException("filter name must not be blank");
                }
                try {
                    attributes.put(name, FilterValue.of(raw));
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException("filter " + name + ": " + e.getMessage(), e);
                }
            });
        }

        return FilterSet.builder()
                .category(blankToNull(request.getCategory()))
                .text(blankToNull(request.getText()))
                .price(min == null && max == null ? null : new FilterValue.Range(min, max))
                .attributes(attributes)
                .sort(request.getSort())
                .adType(request.getAdType())
                .ownerType(request.getOwnerType())
                .shippable(request.getShippable())
                .build();
    }

    // ── Policy ───────────────────────────────────────────────────────────────

    RunPolicy policy(ScrapeRequest request) {
        if (request.getPageSize() < 1 || request.getPageSize() > PageRequest.MAX_PAGE_SIZE) {
            throw new ConfigurationException("pageSize must be within 1.." + PageRequest.MAX_PAGE_SIZE
                    + ", got " + request.getPageSize());
        }
        requireNotNegative("maxPages", request.getMaxPages());
        requireNotNegative("maxAgeDays", request.getMaxAgeDays());
        requireNotNegative("consecutiveStaleLimit", request.getConsecutiveStaleLimit());
        requireNotNegative("pageDelayMs", request.getPageDelayMs());
        requireNotNegative("scopeDelayMs", request.getScopeDelayMs());
        int errorThreshold = request.getErrorThreshold() != null ? request.getErrorThreshold() : defaultErrorThreshold;
        requireNotNegative("errorThreshold", errorThreshold);

        Duration maxAge = request.getMaxAgeDays() > 0
                ? Duration.ofSeconds(Math.round(request.getMaxAgeDays() * Duration.ofDays(1).toSeconds()))
                : null;

        return RunPolicy.builder()
                .pageSize(request.getPageSize())
                .maxPages(request.getMaxPages())
                .maxAge(maxAge)
                .consecutiveStaleLimit(request.getConsecutiveStaleLimit())
                .stalePolicy(request.getStalePolicy())
                .pageDelay(Duration.ofMillis(request.getPageDelayMs()))
                .scopeDelay(Duration.ofMillis(request.getScopeDelayMs()))
                .errorThreshold(errorThreshold)
                .outputFormat(request.getOutputFormat())
                .proxy(request.getProxy())
                .build();
    }

    // ── URL merge ────────────────────────────────────────────────────────────

    /** Search fields from the URL, overridden by anything the request sets itself. */
    private ScrapeRequest withUrl(ScrapeRequest request) {
        ScrapeRequest fromUrl = urlParser.parse(request.getUrl());

        ScrapeRequest merged = new ScrapeRequest();
        merged.setUrl(request.getUrl());
        merged.setCategory(first(request.getCategory(), fromUrl.getCategory()));
        merged.setText(first(request.getText(), fromUrl.getText()));
        if (request.getLocationType() != null || !isEmpty(request.getLocations())) {
            merged.setLocationType(request.getLocationType());
            merged.setLocations(request.getLocations());
        } else {
            merged.setLocationType(fromUrl.getLocationType());
            merged.setLocations(fromUrl.getLocations());
        }
        Map<String, Object> filters = new LinkedHashMap<>(fromUrl.getFilters());
        if (request.getFilters() != null) {
            filters.putAll(request.getFilters());
        }
        merged.setFilters(filters);
        merged.setPriceMin(first(request.getPriceMin(), fromUrl.getPriceMin()));
        merged.setPriceMax(first(request.getPriceMax(), fromUrl.getPriceMax()));
        merged.setSort(first(request.getSort(), fromUrl.getSort()));
        merged.setAdType(first(request.getAdType(), fromUrl.getAdType()));
        merged.setOwnerType(first(request.getOwnerType(), fromUrl.getOwnerType()));
        merged.setShippable(first(request.getShippable(), fromUrl.getShippable()));

        merged.setMaxPages(request.getMaxPages());
        merged.setPageSize(request.getPageSize());
        merged.setMaxAgeDays(request.getMaxAgeDays());
        merged.setConsecutiveStaleLimit(request.getConsecutiveStaleLimit());
        merged.setStalePolicy(request.getStalePolicy());
        merged.setPageDelayMs(request.getPageDelayMs());
        merged.setScopeDelayMs(request.getScopeDelayMs());
        merged.setErrorThreshold(request.getErrorThreshold());
        merged.setOutputFormat(request.getOutputFormat());
        merged.setProxy(request.getProxy());
        return merged;
    }

    private static <T> T first(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }

    private static boolean isEmpty(List<?> list) {
        return list == null || list.isEmpty();
    }

    private static void requireNotNegative(String name, double value) {
        if (value < 0) {
            throw new ConfigurationException(name + " must not be negative, got " + value);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
