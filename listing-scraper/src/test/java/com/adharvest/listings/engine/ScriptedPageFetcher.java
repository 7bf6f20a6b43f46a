package com.adharvest.listings.engine;

import com.adharvest.listings.model.PageRequest;
import com.adharvest.listings.model.ProxySettings;
import com.adharvest.listings.model.RawListing;
import com.adharvest.listings.model.SearchScope;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Supplier;

/**
 * In-memory page fetcher. Pages are scripted per scope label; unscripted pages come back empty.
 */
class ScriptedPageFetcher implements PageFetcher {

    private final Map<String, List<Supplier<PageResult>>> pages = new ConcurrentHashMap<>();
    private final Queue<String> calls = new ConcurrentLinkedQueue<>();
    private Supplier<PageResult> fallback = PageResult::empty;

    ScriptedPageFetcher page(String scope, Supplier<PageResult> page) {
        pages.computeIfAbsent(scope, k -> new ArrayList<>()).add(page);
        return this;
    }

    ScriptedPageFetcher page(String scope, Integer reportedMaxPages, RawListing... listings) {
        PageResult result = new PageResult.Listings(List.of(listings), reportedMaxPages);
        return page(scope, () -> result);
    }

    ScriptedPageFetcher otherwise(Supplier<PageResult> fallback) {
        this.fallback = fallback;
        return this;
    }

    @Override
    public PageResult fetch(SearchScope scope, PageRequest page, ProxySettings proxy) {
        calls.add(scope.label() + "#" + page.pageIndex());
        List<Supplier<PageResult>> scripted = pages.getOrDefault(scope.label(), List.of());
        int index = page.pageIndex() - 1;
        return index < scripted.size() ? scripted.get(index).get() : fallback.get();
    }

    List<String> calls() {
        return List.copyOf(calls);
    }

    long callsFor(String scope) {
        return calls.stream().filter(c -> c.startsWith(scope + "#")).count();
    }
}
