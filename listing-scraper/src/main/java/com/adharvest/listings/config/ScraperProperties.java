package com.adharvest.listings.config;

import com.adharvest.listings.request.ScrapeRequest;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "listing-scraper")
@Data
public class ScraperProperties {

    private Api api = new Api();
    private Engine engine = new Engine();
    private Output output = new Output();
    private Scheduling scheduling = new Scheduling();

    /** Request run by the scheduler and on startup. */
    private ScrapeRequest request = new ScrapeRequest();

    @Data
    public static class Api {
        private String baseUrl = "https://api.leboncoin.fr";
        private String searchPath = "/finder/search";
        private int connectTimeoutMs = 10_000;
        private int readTimeoutMs = 30_000;
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/124.0 Safari/537.36";
        private String apiKey;
    }

    @Data
    public static class Engine {
        /** Scopes scraped at the same time. Pages within a scope are always sequential. */
        private int scopeParallelism = 1;
        /** Run-wide error count that aborts the run; 0 disables. Requests may override it. */
        private int errorThreshold = 0;
        /** Zone of the marketplace timestamps. */
        private String timezone = "Europe/Paris";
        /** Runs executing at the same time; further runs wait in the queue. */
        private int maxConcurrentRuns = 2;
        private int runQueueCapacity = 10;
        /** Finished runs kept for the status endpoint; 0 keeps all. */
        private int runHistory = 50;
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.JSON;
        private String outputDir = "/data/output";
        private boolean includeHeader = true;

        public enum OutputMode {
            NONE, CSV, JSON, BOTH
        }
    }

    @Data
    public static class Scheduling {
        private boolean enabled = false;
        private String cron = "0 0 6 * * ?";
        private boolean runOnStartup = false;
    }
}
