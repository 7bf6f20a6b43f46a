package com.adharvest.listings.location;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Loosely typed location descriptor as it arrives from configuration or the REST body.
 * Which fields are required depends on the request's {@link LocationType}:
 * lat/lng (and optionally radius, city, zipcode) for CITY, code for DEPARTMENT,
 * name for REGION.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LocationSpec {

    /** Overrides the generated scope label. */
    private String label;

    private String city;
    private String zipcode;
    private Double lat;
    private Double lng;
    /** Metres. */
    private Integer radius;

    private String code;

    private String name;
}
