package com.adharvest.listings.engine;

import com.adharvest.listings.model.RawListing;
import com.adharvest.listings.normalize.ListingDates;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Classifies listings against a maximum age.
 *
 * The index date is the recency timestamp, the first publication date its fallback.
 * A listing with neither is fresh. A listing exactly {@code maxAge} old is fresh.
 * A null, zero or negative max age disables the gate.
 */
public class FreshnessGate {

    private final Duration maxAge;
    private final Clock clock;

    public FreshnessGate(Duration maxAge, Clock clock) {
        this.maxAge = maxAge;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return maxAge != null && !maxAge.isZero() && !maxAge.isNegative();
    }

    public Freshness classify(RawListing listing) {
        LocalDateTime timestamp = ListingDates.parse(listing.getIndexDate(), clock.getZone())
                .or(() -> ListingDates.parse(listing.getFirstPublicationDate(), clock.getZone()))
                .orElse(null);
        return classify(timestamp);
    }

    public Freshness classify(LocalDateTime timestamp) {
        if (!isEnabled() || timestamp == null) {
            return Freshness.FRESH;
        }
        Duration age = Duration.between(timestamp, LocalDateTime.now(clock));
        return age.compareTo(maxAge) > 0 ? Freshness.STALE : Freshness.FRESH;
    }
}
