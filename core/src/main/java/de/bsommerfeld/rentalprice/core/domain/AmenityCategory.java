package de.bsommerfeld.rentalprice.core.domain;

import java.util.List;
import java.util.Locale;

/**
 * Amenity groups scored by the amenity engine. Each group ships a default
 * synonym list; configuration may replace the list but not add or remove
 * groups.
 */
public enum AmenityCategory {

    ESSENTIAL("essential", 0.3, List.of(
            "Wifi", "Internet", "Wireless Internet", "Kitchen", "Air conditioning",
            "Heating", "TV", "Cable TV", "Hot water")),
    PREMIUM("premium", 0.5, List.of(
            "Pool", "Swimming pool", "Gym", "Elevator", "Doorman", "Free parking", "Washer", "Dryer")),
    WORK_FRIENDLY("work_friendly", 0.2, List.of(
            "Laptop friendly workspace", "Desk", "Ethernet connection", "Printer"));

    private final String key;
    private final double defaultWeight;
    private final List<String> defaultSynonyms;

    AmenityCategory(String key, double defaultWeight, List<String> defaultSynonyms) {
        this.key = key;
        this.defaultWeight = defaultWeight;
        this.defaultSynonyms = defaultSynonyms;
    }

    public String key() {
        return key;
    }

    public double defaultWeight() {
        return defaultWeight;
    }

    public List<String> defaultSynonyms() {
        return defaultSynonyms;
    }

    public static AmenityCategory fromKey(String value) {
        if (value == null)
            throw new IllegalArgumentException("Amenity category must not be null");
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (AmenityCategory category : values()) {
            if (category.key.equals(normalized))
                return category;
        }
        throw new IllegalArgumentException("Unknown amenity category: " + value);
    }
}
