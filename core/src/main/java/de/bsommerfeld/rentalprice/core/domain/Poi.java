package de.bsommerfeld.rentalprice.core.domain;

import java.util.Objects;

/**
 * A geocoded point of interest. Loaded once per city and read-only for the
 * duration of a feature run.
 *
 * @param id       source identifier, unique within a city
 * @param name     display name, may be {@code null}
 * @param location coordinates (polygon sources are reduced to their centroid
 *                 upstream)
 * @param category category the point contributes to
 */
public record Poi(String id, String name, GeoPoint location, PoiCategory category) {

    public Poi {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(category, "category");
    }

    public Poi(String id, double latitude, double longitude, PoiCategory category) {
        this(id, null, new GeoPoint(latitude, longitude), category);
    }
}
