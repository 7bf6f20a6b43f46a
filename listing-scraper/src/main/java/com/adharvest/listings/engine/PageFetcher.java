package com.adharvest.listings.engine;

import com.adharvest.listings.model.PageRequest;
import com.adharvest.listings.model.ProxySettings;
import com.adharvest.listings.model.SearchScope;

/**
 * Fetches one page of raw listings for a scope. Implementations report failures as
 * {@link PageResult} variants; an exception escaping {@code fetch} is treated as transient.
 */
@FunctionalInterface
public interface PageFetcher {

    PageResult fetch(SearchScope scope, PageRequest page, ProxySettings proxy);
}
