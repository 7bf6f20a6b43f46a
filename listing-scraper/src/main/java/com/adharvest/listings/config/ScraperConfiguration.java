package com.adharvest.listings.config;

import com.adharvest.listings.client.HttpPageFetcher;
import com.adharvest.listings.engine.PageFetcher;
import com.adharvest.listings.engine.ScrapeEngine;
import com.adharvest.listings.location.LocationResolver;
import com.adharvest.listings.normalize.RecordNormalizer;
import com.adharvest.listings.request.SearchRequestFactory;
import com.adharvest.listings.request.SearchUrlParser;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the engine and its collaborators. The {@code pageFetch} retry and time limiter
 * instances are configured under {@code resilience4j.*} in application.yml.
 */
@Configuration
public class ScraperConfiguration {

    public static final String PAGE_FETCH = "pageFetch";
    public static final String RUN_EXECUTOR = "scrapeRunExecutor";

    @Bean
    public Clock clock(ScraperProperties properties) {
        return Clock.system(ZoneId.of(properties.getEngine().getTimezone()));
    }

    @Bean
    public Retry pageFetchRetry(RetryRegistry registry) {
        return registry.retry(PAGE_FETCH);
    }

    @Bean
    public TimeLimiter pageFetchTimeLimiter(TimeLimiterRegistry registry) {
        return registry.timeLimiter(PAGE_FETCH);
    }

    @Bean
    public PageFetcher pageFetcher(RestTemplateBuilder builder, ScraperProperties properties) {
        return new HttpPageFetcher(builder, properties);
    }

    @Bean
    public RecordNormalizer recordNormalizer(Clock clock) {
        return new RecordNormalizer(clock);
    }

    @Bean
    public LocationResolver locationResolver() {
        return new LocationResolver();
    }

    @Bean
    public SearchUrlParser searchUrlParser() {
        return new SearchUrlParser();
    }

    @Bean
    public SearchRequestFactory searchRequestFactory(LocationResolver locationResolver,
                                                     SearchUrlParser urlParser,
                                                     ScraperProperties properties) {
        return new SearchRequestFactory(locationResolver, urlParser, properties.getEngine().getErrorThreshold());
    }

    @Bean
    public ScrapeEngine scrapeEngine(PageFetcher pageFetcher, RecordNormalizer normalizer,
                                     Retry pageFetchRetry, TimeLimiter pageFetchTimeLimiter,
                                     Clock clock, ScraperProperties properties) {
        return new ScrapeEngine(pageFetcher, normalizer, pageFetchRetry, pageFetchTimeLimiter,
                clock, properties.getEngine().getScopeParallelism());
    }

    @Bean(name = RUN_EXECUTOR)
    public ThreadPoolTaskExecutor scrapeRunExecutor(ScraperProperties properties) {
        ScraperProperties.Engine engine = properties.getEngine();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(engine.getMaxConcurrentRuns());
        executor.setMaxPoolSize(engine.getMaxConcurrentRuns());
        executor.setQueueCapacity(engine.getRunQueueCapacity());
        executor.setThreadNamePrefix("scrape-run-");
        return executor;
    }
}
