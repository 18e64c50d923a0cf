package de.bsommerfeld.rentalprice.core.domain;

import java.util.Locale;

/**
 * Categories of points of interest that feed the distance and density
 * features. The {@link #key()} is embedded in feature column names, so it
 * must stay stable across releases.
 */
public enum PoiCategory {

    BEACH("beach"),
    TOURIST_ATTRACTION("tourist_attraction"),
    RESTAURANT("restaurant"),
    BAR("bar"),
    CAFE("cafe"),
    TRANSIT("transit"),
    SHOPPING("shopping"),
    SUPERMARKET("supermarket"),
    HEALTHCARE("healthcare"),
    PARK("park"),
    MUSEUM("museum"),
    VIEWPOINT("viewpoint");

    private final String key;

    PoiCategory(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Resolves a category from its key ({@code tourist_attraction}) or
     * constant name ({@code TOURIST_ATTRACTION}).
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static PoiCategory fromKey(String value) {
        if (value == null)
            throw new IllegalArgumentException("POI category must not be null");
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (PoiCategory category : values()) {
            if (category.key.equals(normalized))
                return category;
        }
        throw new IllegalArgumentException("Unknown POI category: " + value);
    }
}
