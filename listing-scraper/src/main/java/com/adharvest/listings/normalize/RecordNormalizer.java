package com.adharvest.listings.normalize;

import com.adharvest.listings.model.FilterSet;
import com.adharvest.listings.model.NormalizedRecord;
import com.adharvest.listings.model.OutputFormat;
import com.adharvest.listings.model.RawListing;
import com.adharvest.listings.model.SearchScope;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Maps raw marketplace ads to flat output records.
 *
 * Nested structures are flattened with fixed prefixes: {@code location_} for the ad location,
 * {@code owner_} for the seller, {@code attr_} for category attributes. Image URLs stay a list.
 * The detailed projection always carries every fixed key (null when absent); the compact
 * projection is a fixed key list cut out of the detailed one.
 */
@Slf4j
public class RecordNormalizer {

    public static final String LOCATION_PREFIX = "location_";
    public static final String OWNER_PREFIX = "owner_";
    public static final String ATTRIBUTE_PREFIX = "attr_";

    public static final List<String> COMPACT_FIELDS = List.of(
            "id", "url", "subject", "price", "category_name",
            "first_publication_date", "index_date",
            "location_city", "location_zipcode", "location_department_name",
            "owner_type", "image_count", "thumbnail_url",
            "search_scope", "scraped_at"
    );

    private final Clock clock;

    public RecordNormalizer(Clock clock) {
        this.clock = clock;
    }

    public NormalizedRecord normalize(RawListing raw, SearchScope scope, OutputFormat format) {
        Map<String, Object> detailed = detailed(raw, scope);
        Map<String, Object> fields = format == OutputFormat.COMPACT ? compact(detailed) : detailed;
        return new NormalizedRecord((String) detailed.get("id"), fields, scope.label(), scope.filters());
    }

    // ── Projections ──────────────────────────────────────────────────────────

    private Map<String, Object> detailed(RawListing raw, SearchScope scope) {
        Map<String, Object> out = new LinkedHashMap<>();

        out.put("id", idOf(raw));
        out.put("url", raw.getUrl());
        out.put("subject", raw.getSubject());
        out.put("body", raw.getBody());
        out.put("brand", raw.getBrand());
        out.put("category_id", raw.getCategoryId());
        out.put("category_name", raw.getCategoryName());
        out.put("ad_type", raw.getAdType());
        out.put("status", raw.getStatus());
        out.put("price", firstPrice(raw.getPrice()));
        out.put("price_cents", raw.getPriceCents());
        out.put("first_publication_date", ListingDates.normalize(raw.getFirstPublicationDate(), clock.getZone()));
        out.put("index_date", ListingDates.normalize(raw.getIndexDate(), clock.getZone()));
        out.put("expiration_date", ListingDates.normalize(raw.getExpirationDate(), clock.getZone()));
        out.put("has_phone", raw.getHasPhone());

        putImages(out, raw.getImages());
        putLocation(out, raw.getLocation());
        putOwner(out, raw.getOwner());
        putAttributes(out, raw.getAttributes());

        FilterSet filters = scope.filters();
        out.put("search_scope", scope.label());
        out.put("search_category", filters.category());
        out.put("search_location", scope.location().describe());
        out.put("search_text", filters.text());
        out.put("scraped_at", ListingDates.format(LocalDateTime.now(clock)));
        return out;
    }

    private Map<String, Object> compact(Map<String, Object> detailed) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String field : COMPACT_FIELDS) {
            if (detailed.containsKey(field)) {
                out.put(field, detailed.get(field));
            }
        }
        return out;
    }

    // ── Flattening ───────────────────────────────────────────────────────────

    private void putImages(Map<String, Object> out, RawListing.Images images) {
        List<String> urls = null;
        if (images != null) {
            urls = images.getUrlsLarge() != null && !images.getUrlsLarge().isEmpty()
                    ? images.getUrlsLarge()
                    : images.getUrls();
        }
        urls = withoutNulls(urls);

        Integer count = images != null && images.getCount() != null ? images.getCount() : urls.size();
        out.put("image_count", count);
        out.put("images", urls);
        out.put("thumbnail_url", images == null ? null
                : images.getThumbUrl() != null ? images.getThumbUrl() : images.getSmallUrl());
    }

    private void putLocation(Map<String, Object> out, RawListing.Location loc) {
        boolean present = loc != null;
        out.put(LOCATION_PREFIX + "country_id", present ? loc.getCountryId() : null);
        out.put(LOCATION_PREFIX + "region_id", present ? loc.getRegionId() : null);
        out.put(LOCATION_PREFIX + "region_name", present ? loc.getRegionName() : null);
        out.put(LOCATION_PREFIX + "department_id", present ? loc.getDepartmentId() : null);
        out.put(LOCATION_PREFIX + "department_name", present ? loc.getDepartmentName() : null);
        out.put(LOCATION_PREFIX + "city", present ? loc.getCity() : null);
        out.put(LOCATION_PREFIX + "city_label", present ? loc.getCityLabel() : null);
        out.put(LOCATION_PREFIX + "zipcode", present ? loc.getZipcode() : null);
        out.put(LOCATION_PREFIX + "lat", present ? loc.getLat() : null);
        out.put(LOCATION_PREFIX + "lng", present ? loc.getLng() : null);
    }

    private void putOwner(Map<String, Object> out, RawListing.Owner owner) {
        boolean present = owner != null;
        out.put(OWNER_PREFIX + "store_id", present ? owner.getStoreId() : null);
        out.put(OWNER_PREFIX + "user_id", present ? owner.getUserId() : null);
        out.put(OWNER_PREFIX + "type", present ? owner.getType() : null);
        out.put(OWNER_PREFIX + "name", present ? owner.getName() : null);
        out.put(OWNER_PREFIX + "siren", present ? owner.getSiren() : null);
        out.put(OWNER_PREFIX + "no_salesmen", present ? owner.getNoSalesmen() : null);
    }

    /**
     * One {@code attr_<key>} per attribute. Labels win over codes; multi-valued attributes
     * stay lists. Attributes without a key are dropped.
     */
    private void putAttributes(Map<String, Object> out, List<RawListing.Attribute> attributes) {
        if (attributes == null) return;
        for (RawListing.Attribute attribute : attributes) {
            String key = attributeKey(attribute.getKey());
            if (key == null) {
                log.debug("Dropping attribute without key: {}", attribute);
                continue;
            }
            out.put(ATTRIBUTE_PREFIX + key, attributeValue(attribute));
        }
    }

    private Object attributeValue(RawListing.Attribute attribute) {
        List<String> many = notEmpty(attribute.getValuesLabel()) ? attribute.getValuesLabel() : attribute.getValues();
        if (notEmpty(many) && many.size() > 1) {
            return withoutNulls(many);
        }
        if (attribute.getValueLabel() != null) return attribute.getValueLabel();
        if (attribute.getValue() != null) return attribute.getValue();
        return notEmpty(many) ? many.get(0) : null;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String idOf(RawListing raw) {
        if (raw.getId() == null || raw.getId().isBlank()) {
            throw new IllegalArgumentException("listing has no id");
        }
        return raw.getId().trim();
    }

    private Long firstPrice(List<Long> price) {
        return price == null || price.isEmpty() ? null : price.get(0);
    }

    /**
     * Attribute keys become snake_case: "real_estate_type", "mileage", "fuel".
     */
    private String attributeKey(String key) {
        if (key == null || key.isBlank()) return null;
        return key.trim()
                .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
                .replaceAll("[^A-Za-z0-9]+", "_")
                .toLowerCase(Locale.ROOT);
    }

    private List<String> withoutNulls(List<String> values) {
        return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
    }

    private boolean notEmpty(List<String> values) {
        return values != null && !values.isEmpty();
    }
}
