package com.adharvest.listings.client;

import com.adharvest.listings.model.RawListing;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * Envelope of one search response page.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchPageResponse {

    private Integer total;

    @JsonProperty("max_pages")
    private Integer maxPages;

    private List<RawListing> ads;
}
