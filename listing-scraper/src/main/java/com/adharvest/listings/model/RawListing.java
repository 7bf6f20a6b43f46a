package com.adharvest.listings.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * Raw ad as returned by the marketplace search endpoint.
 * Kept separate from the normalized record to isolate API coupling; anything not
 * declared here is ignored on read and never reaches the output.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawListing {

    /** Listing id. Numeric upstream, read as text so the output is stable. */
    @JsonProperty("list_id")
    @JsonAlias("id")
    private String id;

    @JsonProperty("first_publication_date")
    private String firstPublicationDate;

    /** Last time the marketplace re-indexed the ad (bumps, edits). */
    @JsonProperty("index_date")
    private String indexDate;

    @JsonProperty("expiration_date")
    private String expirationDate;

    private String status;

    @JsonProperty("category_id")
    private String categoryId;

    @JsonProperty("category_name")
    private String categoryName;

    private String subject;

    private String body;

    private String brand;

    @JsonProperty("ad_type")
    private String adType;

    private String url;

    /** The API returns the price as a one-element array. */
    private List<Long> price;

    @JsonProperty("price_cents")
    private Long priceCents;

    @JsonProperty("has_phone")
    private Boolean hasPhone;

    private Images images;

    private List<Attribute> attributes;

    private Location location;

    private Owner owner;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Images {
        @JsonProperty("thumb_url")
        private String thumbUrl;

        @JsonProperty("small_url")
        private String smallUrl;

        @JsonProperty("nb_images")
        private Integer count;

        private List<String> urls;

        @JsonProperty("urls_large")
        private List<String> urlsLarge;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Attribute {
        private String key;

        @JsonProperty("key_label")
        private String keyLabel;

        private String value;

        @JsonProperty("value_label")
        private String valueLabel;

        private List<String> values;

        @JsonProperty("values_label")
        private List<String> valuesLabel;

        private Boolean generic;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Location {
        @JsonProperty("country_id")
        private String countryId;

        @JsonProperty("region_id")
        private String regionId;

        @JsonProperty("region_name")
        private String regionName;

        @JsonProperty("department_id")
        private String departmentId;

        @JsonProperty("department_name")
        private String departmentName;

        @JsonProperty("city_label")
        private String cityLabel;

        private String city;

        private String zipcode;

        private Double lat;

        private Double lng;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Owner {
        @JsonProperty("store_id")
        private String storeId;

        @JsonProperty("user_id")
        private String userId;

        /** "private" or "pro" */
        private String type;

        private String name;

        private String siren;

        @JsonProperty("no_salesmen")
        private Boolean noSalesmen;
    }
}
