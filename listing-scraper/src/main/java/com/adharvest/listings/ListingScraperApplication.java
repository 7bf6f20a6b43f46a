package com.adharvest.listings;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class ListingScraperApplication {

    public static void main(String[] args) {
        SpringApplication.run(ListingScraperApplication.class, args);
    }
}
