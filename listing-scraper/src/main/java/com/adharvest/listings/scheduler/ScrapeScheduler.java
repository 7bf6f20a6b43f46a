package com.adharvest.listings.scheduler;

import com.adharvest.listings.config.ScraperProperties;
import com.adharvest.listings.service.ListingScrapeService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup scraping of the configured request
 * ({@code listing-scraper.request}).
 *
 * Default schedule: every day at 06:00 in the marketplace timezone, only when
 * {@code listing-scraper.scheduling.enabled} is true.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScrapeScheduler {

    private final ListingScrapeService scrapeService;
    private final ScraperProperties properties;

    @PostConstruct
    public void onStartup() {
        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, starting configured scrape");
            trigger("startup");
        } else if (properties.getScheduling().isEnabled()) {
            log.info("Scraper ready. Next scheduled run: {}", properties.getScheduling().getCron());
        } else {
            log.info("Scraper ready. Scheduling disabled, runs via POST /scrape/runs");
        }
    }

    @Scheduled(cron = "${listing-scraper.scheduling.cron:0 0 6 * * ?}",
            zone = "${listing-scraper.engine.timezone:Europe/Paris}")
    public void scheduledScrape() {
        if (!properties.getScheduling().isEnabled()) {
            return;
        }
        log.info("Scheduled scrape triggered");
        trigger("scheduler");
    }

    private void trigger(String source) {
        try {
            scrapeService.start(properties.getRequest(), source);
        } catch (Exception e) {
            log.error("{} scrape failed to start: {}", source, e.getMessage(), e);
        }
    }
}
