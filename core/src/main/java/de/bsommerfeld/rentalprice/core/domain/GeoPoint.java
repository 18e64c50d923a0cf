package de.bsommerfeld.rentalprice.core.domain;

/**
 * WGS84 coordinate pair in decimal degrees.
 *
 * @param latitude  -90.0 to 90.0
 * @param longitude -180.0 to 180.0
 */
public record GeoPoint(double latitude, double longitude) {

    public GeoPoint {
        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0)
            throw new IllegalArgumentException("Latitude out of range: " + latitude);
        if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0)
            throw new IllegalArgumentException("Longitude out of range: " + longitude);
    }
}
