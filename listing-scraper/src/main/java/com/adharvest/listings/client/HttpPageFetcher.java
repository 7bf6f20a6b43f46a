package com.adharvest.listings.client;

import com.adharvest.listings.config.ScraperProperties;
import com.adharvest.listings.engine.PageFetcher;
import com.adharvest.listings.engine.PageResult;
import com.adharvest.listings.model.FilterSet;
import com.adharvest.listings.model.FilterValue;
import com.adharvest.listings.model.LocationDescriptor;
import com.adharvest.listings.model.OwnerType;
import com.adharvest.listings.model.PageRequest;
import com.adharvest.listings.model.ProxySettings;
import com.adharvest.listings.model.SearchScope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Page fetcher over the marketplace JSON search endpoint.
 *
 * Only transport and the page envelope are handled here: the scope and filters are encoded
 * into the search body, the response is read into {@link SearchPageResponse}, and HTTP
 * failures are classified into {@link PageResult} variants. Retries and pacing belong to the
 * engine.
 *
 * Classification: 429 and 403 (anti-bot block) are rate limiting, 5xx and I/O failures are
 * transient, any other 4xx is fatal.
 */
@Slf4j
public class HttpPageFetcher implements PageFetcher {

    private final RestTemplateBuilder builder;
    private final ScraperProperties.Api api;
    private final RestTemplate direct;
    private final Map<ProxySettings, RestTemplate> proxied = new ConcurrentHashMap<>();

    public HttpPageFetcher(RestTemplateBuilder builder, ScraperProperties properties) {
        this.builder = builder;
        this.api = properties.getApi();
        this.direct = build(null);
    }

    @Override
    public PageResult fetch(SearchScope scope, PageRequest page, ProxySettings proxy) {
        String url = UriComponentsBuilder
                .fromHttpUrl(api.getBaseUrl())
                .path(api.getSearchPath())
                .toUriString();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (api.getApiKey() != null && !api.getApiKey().isBlank()) {
            headers.set("api_key", api.getApiKey());
        }
        if (proxy != null && proxy.isConfigured() && proxy.username() != null) {
            String credentials = proxy.username() + ":" + (proxy.password() == null ? "" : proxy.password());
            headers.set(HttpHeaders.PROXY_AUTHORIZATION,
                    "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
        }

        Map<String, Object> body = searchBody(scope, page);
        log.debug("POST {} scope=[{}] page={} offset={}", url, scope.label(), page.pageIndex(), page.offset());

        try {
            SearchPageResponse response = templateFor(proxy)
                    .postForObject(url, new HttpEntity<>(body, headers), SearchPageResponse.class);
            if (response == null || response.getAds() == null) {
                return PageResult.empty();
            }
            if (page.pageIndex() == 1) {
                log.info("Scope [{}]: {} listings in {} pages upstream",
                        scope.label(), response.getTotal(), response.getMaxPages());
            }
            return new PageResult.Listings(response.getAds(), response.getMaxPages());

        } catch (HttpStatusCodeException e) {
            return classify(e.getStatusCode(), e.getResponseBodyAsString(), page);

        } catch (ResourceAccessException e) {
            log.warn("Network error on page {} of [{}]: {}", page.pageIndex(), scope.label(), e.getMessage());
            return new PageResult.TransientError("network error: " + e.getMessage());

        } catch (RestClientException e) {
            log.warn("Unreadable response on page {} of [{}]: {}", page.pageIndex(), scope.label(), e.getMessage());
            return new PageResult.TransientError("unreadable response: " + e.getMessage());
        }
    }

    // ── Request body ─────────────────────────────────────────────────────────

    Map<String, Object> searchBody(SearchScope scope, PageRequest page) {
        FilterSet filters = scope.filters();

        Map<String, Object> enums = new LinkedHashMap<>();
        enums.put("ad_type", List.of(filters.adType().name().toLowerCase(Locale.ROOT)));
        Map<String, Object> ranges = new LinkedHashMap<>();
        if (filters.price() != null) {
            ranges.put("price", range(filters.price()));
        }
        filters.attributes().forEach((name, value) -> {
            if (value instanceof FilterValue.Range r) {
                ranges.put(name, range(r));
            } else if (value instanceof FilterValue.ValueSet set) {
                enums.put(name, set.values());
            } else if (value instanceof FilterValue.Scalar scalar) {
                enums.put(name, List.of(scalar.value()));
            }
        });

        Map<String, Object> filterBody = new LinkedHashMap<>();
        if (filters.category() != null) {
            filterBody.put("category", Map.of("id", filters.category()));
        }
        filterBody.put("enums", enums);
        if (filters.text() != null) {
            filterBody.put("keywords", Map.of("text", filters.text()));
        }
        filterBody.put("location", location(scope.location(), filters));
        filterBody.put("ranges", ranges);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("filters", filterBody);
        body.put("limit", page.pageSize());
        body.put("offset", page.offset());
        body.put("page", page.pageIndex());
        putSort(body, filters);
        if (filters.ownerType() != OwnerType.ALL) {
            body.put("owner_type", filters.ownerType().name().toLowerCase(Locale.ROOT));
        }
        return body;
    }

    private Map<String, Object> location(LocationDescriptor descriptor, FilterSet filters) {
        Map<String, Object> location = new LinkedHashMap<>();
        if (descriptor instanceof LocationDescriptor.City city) {
            Map<String, Object> area = new LinkedHashMap<>();
            area.put("lat", city.lat());
            area.put("lng", city.lng());
            area.put("radius", city.radius());
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("locationType", "city");
            entry.put("area", area);
            if (city.name() != null) entry.put("city", city.name());
            if (city.zipcode() != null) entry.put("zipcode", city.zipcode());
            location.put("locations", List.of(entry));
        } else if (descriptor instanceof LocationDescriptor.Department department) {
            location.put("departments", List.of(department.code()));
        } else if (descriptor instanceof LocationDescriptor.Region region) {
            location.put("regions", List.of(region.name()));
        }
        if (Boolean.TRUE.equals(filters.shippable())) {
            location.put("shippable", true);
        }
        return location;
    }

    private void putSort(Map<String, Object> body, FilterSet filters) {
        switch (filters.sort()) {
            case NEWEST -> { body.put("sort_by", "time"); body.put("sort_order", "desc"); }
            case OLDEST -> { body.put("sort_by", "time"); body.put("sort_order", "asc"); }
            case CHEAPEST -> { body.put("sort_by", "price"); body.put("sort_order", "asc"); }
            case EXPENSIVE -> { body.put("sort_by", "price"); body.put("sort_order", "desc"); }
            case RELEVANCE -> body.put("sort_by", "relevance");
        }
    }

    private Map<String, Object> range(FilterValue.Range range) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (range.min() != null) out.put("min", range.min());
        if (range.max() != null) out.put("max", range.max());
        return out;
    }

    // ── Transport ────────────────────────────────────────────────────────────

    private PageResult classify(HttpStatusCode status, String body, PageRequest page) {
        int code = status.value();
        if (code == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return new PageResult.RateLimited("HTTP 429 on page " + page.pageIndex());
        }
        if (code == HttpStatus.FORBIDDEN.value()) {
            // Anti-bot walls (Datadome) answer 403; they usually lift after backing off.
            String hint = body != null && body.toLowerCase(Locale.ROOT).contains("datadome") ? " (datadome)" : "";
            return new PageResult.RateLimited("HTTP 403 access blocked" + hint + " on page " + page.pageIndex());
        }
        if (status.is5xxServerError()) {
            return new PageResult.TransientError("HTTP " + code + " on page " + page.pageIndex());
        }
        log.error("Search rejected with HTTP {} on page {}: {}", code, page.pageIndex(), body);
        return new PageResult.FatalError("HTTP " + code + " rejected search on page " + page.pageIndex());
    }

    private RestTemplate templateFor(ProxySettings proxy) {
        if (proxy == null || !proxy.isConfigured()) {
            return direct;
        }
        return proxied.computeIfAbsent(proxy, this::build);
    }

    private RestTemplate build(ProxySettings proxy) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(api.getConnectTimeoutMs());
        factory.setReadTimeout(api.getReadTimeoutMs());
        if (proxy != null) {
            int port = proxy.port() != null ? proxy.port() : 8000;
            factory.setProxy(new Proxy(Proxy.Type.HTTP, new InetSocketAddress(proxy.host(), port)));
            log.info("Using proxy {}:{}", proxy.host(), port);
        }
        return builder
                .requestFactory(() -> factory)
                .defaultHeader(HttpHeaders.USER_AGENT, api.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
