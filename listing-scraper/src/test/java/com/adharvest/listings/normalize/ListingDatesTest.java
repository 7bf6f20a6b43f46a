package com.adharvest.listings.normalize;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class ListingDatesTest {

    private static final ZoneId PARIS = ZoneId.of("Europe/Paris");

    @Test
    void shouldConvertOffsetTimestampToMarketplaceTime() {
        assertThat(ListingDates.parse("2024-05-31T13:30:00Z", PARIS))
                .contains(LocalDateTime.of(2024, 5, 31, 15, 30));
        assertThat(ListingDates.normalize("2024-01-15T08:00:00+00:00", PARIS)).isEqualTo("2024-01-15 09:00:00");
    }

    @Test
    void shouldKeepLocalTimestampsAsMarketplaceTime() {
        assertThat(ListingDates.normalize("2024-05-31 13:30:00", PARIS)).isEqualTo("2024-05-31 13:30:00");
        assertThat(ListingDates.normalize("2024-05-31T13:30:00.250", PARIS)).isEqualTo("2024-05-31 13:30:00");
        assertThat(ListingDates.normalize("2024-05-31", PARIS)).isEqualTo("2024-05-31 00:00:00");
    }

    @Test
    void shouldPassUnparseableValuesThrough() {
        assertThat(ListingDates.parse("yesterday", PARIS)).isEmpty();
        assertThat(ListingDates.normalize("yesterday", PARIS)).isEqualTo("yesterday");
        assertThat(ListingDates.normalize("  ", PARIS)).isNull();
    }
}
