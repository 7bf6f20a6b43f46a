package com.adharvest.listings.model;

/**
 * Geographic constraint of a search scope.
 */
public sealed interface LocationDescriptor
        permits LocationDescriptor.None, LocationDescriptor.City,
                LocationDescriptor.Department, LocationDescriptor.Region {

    /** Human-readable label used as output provenance when the caller gives none. */
    String describe();

    record None() implements LocationDescriptor {
        @Override
        public String describe() {
            return "All locations";
        }
    }

    /**
     * Circle around a point. Radius is in metres, 0 means the city itself only.
     */
    record City(double lat, double lng, int radius, String name, String zipcode) implements LocationDescriptor {
        @Override
        public String describe() {
            String place = name != null && !name.isBlank() ? name : String.format("%.5f,%.5f", lat, lng);
            if (zipcode != null && !zipcode.isBlank()) {
                place = place + " " + zipcode;
            }
            return radius > 0 ? place + " (+" + radius + "m)" : place;
        }
    }

    record Department(String code) implements LocationDescriptor {
        @Override
        public String describe() {
            return "Department " + code;
        }
    }

    record Region(String name) implements LocationDescriptor {
        @Override
        public String describe() {
            return "Region " + name;
        }
    }
}
