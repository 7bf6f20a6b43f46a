package com.adharvest.listings.location;

import com.adharvest.listings.error.ConfigurationException;
import com.adharvest.listings.model.FilterSet;
import com.adharvest.listings.model.LocationDescriptor;
import com.adharvest.listings.model.SearchScope;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Expands a location type and its descriptors into the ordered scope list of a run.
 *
 * One scope per descriptor, in input order; duplicates are kept. Invalid descriptors fail the
 * whole request with a {@link ConfigurationException} before anything is fetched.
 */
@Slf4j
public class LocationResolver {

    public static final int DEFAULT_RADIUS_METRES = 10_000;

    /** Metropolitan 01-95 (with Corsica as 2A/2B) and overseas 971-976. */
    private static final Pattern DEPARTMENT_CODE = Pattern.compile("^(0[1-9]|[1-8]\\d|9[0-5]|2A|2B|97[1-6])$");

    public List<SearchScope> resolve(LocationType type, List<LocationSpec> specs, FilterSet filters) {
        if (type == null) {
            throw new ConfigurationException("location type is required");
        }
        List<LocationSpec> descriptors = specs == null ? List.of() : specs;

        if (type == LocationType.NONE) {
            if (!descriptors.isEmpty()) {
                throw new ConfigurationException("location type NONE does not take descriptors, got " + descriptors.size());
            }
            LocationDescriptor none = new LocationDescriptor.None();
            return List.of(new SearchScope(none.describe(), 0, none, filters));
        }
        if (descriptors.isEmpty()) {
            throw new ConfigurationException("location type " + type + " needs at least one descriptor");
        }

        List<SearchScope> scopes = new ArrayList<>(descriptors.size());
        for (int i = 0; i < descriptors.size(); i++) {
            LocationSpec spec = descriptors.get(i);
            if (spec == null) {
                throw new ConfigurationException("location #" + (i + 1) + " is empty");
            }
            LocationDescriptor descriptor = toDescriptor(type, spec, i + 1);
            String label = spec.getLabel() != null && !spec.getLabel().isBlank()
                    ? spec.getLabel().trim()
                    : descriptor.describe();
            scopes.add(new SearchScope(label, i, descriptor, filters));
        }
        log.debug("Resolved {} {} scopes", scopes.size(), type);
        return List.copyOf(scopes);
    }

    private LocationDescriptor toDescriptor(LocationType type, LocationSpec spec, int ordinal) {
        return switch (type) {
            case CITY -> city(spec, ordinal);
            case DEPARTMENT -> department(spec, ordinal);
            case REGION -> region(spec, ordinal);
            case NONE -> throw new IllegalStateException("NONE has no descriptors");
        };
    }

    private LocationDescriptor.City city(LocationSpec spec, int ordinal) {
        if (spec.getLat() == null || spec.getLng() == null) {
            throw new ConfigurationException("city location #" + ordinal + " needs lat and lng");
        }
        double lat = spec.getLat();
        double lng = spec.getLng();
        if (lat < -90 || lat > 90 || lng < -180 || lng > 180) {
            throw new ConfigurationException("city location #" + ordinal + " has invalid coordinates " + lat + "," + lng);
        }
        int radius = spec.getRadius() == null ? DEFAULT_RADIUS_METRES : spec.getRadius();
        if (radius < 0) {
            throw new ConfigurationException("city location #" + ordinal + " has a negative radius");
        }
        return new LocationDescriptor.City(lat, lng, radius, trimToNull(spec.getCity()), trimToNull(spec.getZipcode()));
    }

    private LocationDescriptor.Department department(LocationSpec spec, int ordinal) {
        String code = trimToNull(spec.getCode());
        if (code == null) {
            throw new ConfigurationException("department location #" + ordinal + " needs a code");
        }
        code = code.toUpperCase(Locale.ROOT);
        if (code.length() == 1 && Character.isDigit(code.charAt(0))) {
            code = "0" + code;
        }
        if (!DEPARTMENT_CODE.matcher(code).matches()) {
            throw new ConfigurationException("department location #" + ordinal + " has unknown code " + spec.getCode());
        }
        return new LocationDescriptor.Department(code);
    }

    private LocationDescriptor.Region region(LocationSpec spec, int ordinal) {
        String name = trimToNull(spec.getName());
        if (name == null) {
            throw new ConfigurationException("region location #" + ordinal + " needs a name");
        }
        return new LocationDescriptor.Region(name);
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
