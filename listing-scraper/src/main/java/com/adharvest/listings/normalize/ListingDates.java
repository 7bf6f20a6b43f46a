package com.adharvest.listings.normalize;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Date handling for marketplace timestamps. Output is always {@code yyyy-MM-dd HH:mm:ss}.
 */
public final class ListingDates {

    public static final DateTimeFormatter OUTPUT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private ListingDates() {
    }

    private static List<Function<String, LocalDateTime>> parsers(ZoneId zone) {
        return List.of(
                s -> LocalDateTime.parse(s, OUTPUT),
                s -> LocalDateTime.parse(s, DateTimeFormatter.ISO_LOCAL_DATE_TIME),
                s -> OffsetDateTime.parse(s).atZoneSameInstant(zone).toLocalDateTime(),
                s -> LocalDate.parse(s).atStartOfDay()
        );
    }

    /**
     * Parses the formats the marketplace has been seen to use. Local timestamps are taken as
     * marketplace time; offset timestamps are converted to {@code zone}. Blank or unparseable
     * input gives an empty result.
     */
    public static Optional<LocalDateTime> parse(String value, ZoneId zone) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return parsers(zone).stream()
                .map(parser -> tryParse(parser, trimmed))
                .filter(Objects::nonNull)
                .findFirst();
    }

    /** Normalized form of a raw timestamp; unparseable values pass through unchanged. */
    public static String normalize(String value, ZoneId zone) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return parse(value, zone).map(OUTPUT::format).orElse(value);
    }

    public static String format(LocalDateTime value) {
        return value == null ? null : OUTPUT.format(value);
    }

    private static LocalDateTime tryParse(Function<String, LocalDateTime> parser, String value) {
        try {
            return parser.apply(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
