package de.bsommerfeld.rentalprice.features.amenity;

import java.util.List;

/**
 * Individually flagged amenities with the keywords that identify them.
 */
public enum KeyAmenity {

    WIFI("wifi", List.of("wifi", "wireless internet", "internet")),
    POOL("pool", List.of("pool")),
    PARKING("parking", List.of("parking")),
    AC("ac", List.of("air conditioning", "a/c", "central air")),
    KITCHEN("kitchen", List.of("kitchen")),
    WASHER("washer", List.of("washer", "washing machine")),
    TV("tv", List.of("tv", "cable"));

    private final String key;
    private final List<String> keywords;

    KeyAmenity(String key, List<String> keywords) {
        this.key = key;
        this.keywords = keywords;
    }

    public String column() {
        return "has_" + key;
    }

    public List<String> keywords() {
        return keywords;
    }
}
