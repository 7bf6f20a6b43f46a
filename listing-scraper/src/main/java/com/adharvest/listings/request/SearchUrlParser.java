package com.adharvest.listings.request;

import com.adharvest.listings.error.ConfigurationException;
import com.adharvest.listings.location.LocationSpec;
import com.adharvest.listings.location.LocationType;
import com.adharvest.listings.model.AdType;
import com.adharvest.listings.model.OwnerType;
import com.adharvest.listings.model.SortOrder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a marketplace search URL into the search part of a {@link ScrapeRequest}.
 *
 * Example:
 * <pre>
 * /recherche?category=9&amp;text=maison&amp;locations=Nanterre_92000__48.88822_2.19428_4049,d_75
 *           &amp;price=100000-300000&amp;square=50-max&amp;real_estate_type=1,2&amp;owner_type=private
 * </pre>
 *
 * Location tokens: {@code City_zip__lat_lng[_radius]} (coordinates given),
 * {@code City_zip} (coordinates from {@link KnownCities}), {@code d_<code>} (department),
 * {@code r_<name>} (region). All tokens of one URL must be of the same kind.
 * Unknown query parameters become attribute filters: {@code a-b} ranges, comma lists, or a
 * one-element list for single values.
 */
@Slf4j
public class SearchUrlParser {

    private static final Pattern RANGE = Pattern.compile("^(\\d+|min)-(\\d+|max)$");
    private static final Set<String> IGNORED = Set.of("page", "kst", "from", "order");

    public ScrapeRequest parse(String url) {
        if (url == null || url.isBlank()) {
            throw new ConfigurationException("search URL is empty");
        }
        MultiValueMap<String, String> params;
        try {
            params = UriComponentsBuilder.fromUriString(url.trim()).build().getQueryParams();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("search URL is not valid: " + url, e);
        }
        if (params.isEmpty()) {
            throw new ConfigurationException("search URL has no query parameters: " + url);
        }

        ScrapeRequest request = new ScrapeRequest();
        Map<String, Object> filters = new LinkedHashMap<>();
        String order = decoded(params.getFirst("order"));

        for (Map.Entry<String, List<String>> entry : params.entrySet()) {
            String key = entry.getKey();
            String value = decoded(entry.getValue().isEmpty() ? null : entry.getValue().get(0));
            if (value == null || value.isBlank() || IGNORED.contains(key)) {
                continue;
            }
            switch (key) {
                case "text" -> request.setText(value);
                case "category" -> request.setCategory(value);
                case "locations" -> applyLocations(request, value);
                case "price" -> applyPrice(request, value);
                case "owner_type" -> request.setOwnerType(ownerType(value));
                case "ad_type" -> request.setAdType(adType(value));
                case "sort" -> request.setSort(sort(value, order));
                case "shippable" -> request.setShippable("1".equals(value) || "true".equalsIgnoreCase(value));
                default -> filters.put(key, filterValue(key, value));
            }
        }
        request.setFilters(filters);
        if (request.getLocationType() == null) {
            request.setLocationType(LocationType.NONE);
        }
        log.debug("Parsed search URL into {}", request);
        return request;
    }

    // ── Locations ────────────────────────────────────────────────────────────

    private void applyLocations(ScrapeRequest request, String value) {
        LocationType type = null;
        List<LocationSpec> specs = new ArrayList<>();
        for (String token : value.split(",")) {
            token = token.trim();
            if (token.isEmpty()) continue;

            LocationType tokenType;
            LocationSpec spec;
            if (token.startsWith("d_")) {
                tokenType = LocationType.DEPARTMENT;
                spec = LocationSpec.builder().code(token.substring(2)).build();
            } else if (token.startsWith("r_")) {
                tokenType = LocationType.REGION;
                spec = LocationSpec.builder().name(token.substring(2).replace('_', ' ')).build();
            } else {
                tokenType = LocationType.CITY;
                spec = cityToken(token);
            }
            if (type != null && type != tokenType) {
                throw new ConfigurationException("search URL mixes " + type + " and " + tokenType + " locations");
            }
            type = tokenType;
            specs.add(spec);
        }
        if (type != null) {
            request.setLocationType(type);
            request.setLocations(specs);
        }
    }

    private LocationSpec cityToken(String token) {
        String[] halves = token.split("__", 2);
        String[] nameParts = halves[0].split("_");
        String name = halves[0];
        String zipcode = null;
        if (nameParts.length >= 2 && nameParts[nameParts.length - 1].chars().allMatch(Character::isDigit)) {
            name = String.join("_", Arrays.copyOf(nameParts, nameParts.length - 1));
            zipcode = nameParts[nameParts.length - 1];
        }
        String displayName = name.replace('_', ' ');

        if (halves.length == 2 && !halves[1].isBlank()) {
            String[] coords = halves[1].split("_");
            try {
                double lat = Double.parseDouble(coords[0]);
                double lng = Double.parseDouble(coords[1]);
                // lat_lng[_radius[_default-radius]]; a token without radius means the city itself
                int radius = coords.length > 2 ? Integer.parseInt(coords[2]) : 0;
                return LocationSpec.builder().city(displayName).zipcode(zipcode)
                        .lat(lat).lng(lng).radius(radius).build();
            } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                throw new ConfigurationException("location token has invalid coordinates: " + token, e);
            }
        }

        KnownCities.Coordinates known = KnownCities.lookup(name)
                .orElseThrow(() -> new ConfigurationException(
                        "location token " + token + " has no coordinates and the city is not known"));
        return LocationSpec.builder()
                .city(displayName)
                .zipcode(zipcode != null ? zipcode : known.zipcode())
                .lat(known.lat())
                .lng(known.lng())
                .radius(0)
                .build();
    }

    // ── Values ───────────────────────────────────────────────────────────────

    private void applyPrice(ScrapeRequest request, String value) {
        Matcher m = RANGE.matcher(value);
        if (m.matches()) {
            request.setPriceMin(bound(m.group(1)));
            request.setPriceMax(bound(m.group(2)));
            return;
        }
        try {
            long price = Long.parseLong(value);
            request.setPriceMin(price);
            request.setPriceMax(price);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("price is not a range: " + value, e);
        }
    }

    private Object filterValue(String key, String value) {
        Matcher m = RANGE.matcher(value);
        if (m.matches()) {
            Map<String, Object> range = new LinkedHashMap<>();
            range.put("min", bound(m.group(1)));
            range.put("max", bound(m.group(2)));
            return range;
        }
        List<String> values = Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .toList();
        log.trace("Filter {} -> {}", key, values);
        return values;
    }

    private Long bound(String token) {
        return token.equals("min") || token.equals("max") ? null : Long.valueOf(token);
    }

    private OwnerType ownerType(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "private" -> OwnerType.PRIVATE;
            case "pro" -> OwnerType.PRO;
            default -> OwnerType.ALL;
        };
    }

    private AdType adType(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "offer" -> AdType.OFFER;
            case "demand" -> AdType.DEMAND;
            default -> throw new ConfigurationException("unknown ad_type: " + value);
        };
    }

    private SortOrder sort(String value, String order) {
        boolean ascending = "asc".equalsIgnoreCase(order);
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "time" -> ascending ? SortOrder.OLDEST : SortOrder.NEWEST;
            case "price" -> "desc".equalsIgnoreCase(order) ? SortOrder.EXPENSIVE : SortOrder.CHEAPEST;
            case "relevance" -> SortOrder.RELEVANCE;
            default -> throw new ConfigurationException("unknown sort: " + value);
        };
    }

    private static String decoded(String value) {
        return value == null ? null : UriUtils.decode(value, StandardCharsets.UTF_8);
    }
}
