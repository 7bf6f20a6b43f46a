package com.adharvest.listings.request;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Centre coordinates of the larger French cities, used to complete URL location tokens
 * that carry only a name and postcode.
 */
public final class KnownCities {

    public record Coordinates(double lat, double lng, String zipcode) {
    }

    private static final Map<String, Coordinates> CITIES = Map.ofEntries(
            Map.entry("paris", new Coordinates(48.8566, 2.3522, "75000")),
            Map.entry("lyon", new Coordinates(45.7640, 4.8357, "69000")),
            Map.entry("marseille", new Coordinates(43.2965, 5.3698, "13000")),
            Map.entry("toulouse", new Coordinates(43.6047, 1.4442, "31000")),
            Map.entry("nice", new Coordinates(43.7102, 7.2620, "06000")),
            Map.entry("nantes", new Coordinates(47.2184, -1.5536, "44000")),
            Map.entry("strasbourg", new Coordinates(48.5734, 7.7521, "67000")),
            Map.entry("montpellier", new Coordinates(43.6110, 3.8767, "34000")),
            Map.entry("bordeaux", new Coordinates(44.8378, -0.5792, "33000")),
            Map.entry("lille", new Coordinates(50.6292, 3.0573, "59000")),
            Map.entry("rennes", new Coordinates(48.1173, -1.6778, "35000")),
            Map.entry("reims", new Coordinates(49.2583, 4.0317, "51100")),
            Map.entry("saint_etienne", new Coordinates(45.4397, 4.3872, "42000")),
            Map.entry("toulon", new Coordinates(43.1242, 5.9280, "83000")),
            Map.entry("le_havre", new Coordinates(49.4944, 0.1079, "76600")),
            Map.entry("grenoble", new Coordinates(45.1885, 5.7245, "38000")),
            Map.entry("dijon", new Coordinates(47.3220, 5.0415, "21000")),
            Map.entry("angers", new Coordinates(47.4784, -0.5632, "49000")),
            Map.entry("nimes", new Coordinates(43.8367, 4.3601, "30000")),
            Map.entry("villeurbanne", new Coordinates(45.7667, 4.8833, "69100")),
            Map.entry("saint_denis", new Coordinates(48.9361, 2.3574, "93200")),
            Map.entry("le_mans", new Coordinates(48.0061, 0.1996, "72000")),
            Map.entry("aix_en_provence", new Coordinates(43.5263, 5.4454, "13100")),
            Map.entry("clermont_ferrand", new Coordinates(45.7772, 3.0870, "63000")),
            Map.entry("brest", new Coordinates(48.3905, -4.4860, "29200")),
            Map.entry("tours", new Coordinates(47.3941, 0.6848, "37000")),
            Map.entry("limoges", new Coordinates(45.8336, 1.2611, "87000")),
            Map.entry("amiens", new Coordinates(49.8943, 2.2958, "80000")),
            Map.entry("perpignan", new Coordinates(42.6886, 2.8948, "66000")),
            Map.entry("metz", new Coordinates(49.1193, 6.1757, "57000")),
            Map.entry("nanterre", new Coordinates(48.8938, 2.2064, "92000")),
            Map.entry("boulogne_billancourt", new Coordinates(48.8355, 2.2413, "92100")),
            Map.entry("orleans", new Coordinates(47.9029, 1.9093, "45000")),
            Map.entry("mulhouse", new Coordinates(47.7508, 7.3359, "68100")),
            Map.entry("rouen", new Coordinates(49.4432, 1.0993, "76000")),
            Map.entry("caen", new Coordinates(49.1829, -0.3707, "14000")),
            Map.entry("dunkerque", new Coordinates(51.0343, 2.3768, "59140")),
            Map.entry("nancy", new Coordinates(48.6921, 6.1844, "54000"))
    );

    private KnownCities() {
    }

    public static Optional<Coordinates> lookup(String cityName) {
        if (cityName == null || cityName.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(CITIES.get(key(cityName)));
    }

    /** "Aix-en-Provence", "aix en provence" and "Aix_en_Provence" share a key. */
    static String key(String cityName) {
        String ascii = Normalizer.normalize(cityName.trim(), Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        return ascii.toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
    }
}
