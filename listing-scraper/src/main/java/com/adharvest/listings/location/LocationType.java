package com.adharvest.listings.location;

/**
 * How the location descriptors of a request are to be read.
 */
public enum LocationType {
    NONE, CITY, DEPARTMENT, REGION
}
