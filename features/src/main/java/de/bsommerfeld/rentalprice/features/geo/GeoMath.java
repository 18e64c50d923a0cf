package de.bsommerfeld.rentalprice.features.geo;

import de.bsommerfeld.rentalprice.core.domain.GeoPoint;

/**
 * Great-circle helpers on a spherical earth.
 */
public final class GeoMath {

    public static final double EARTH_RADIUS_KM = 6371.0;

    /** Length of one degree of latitude. */
    public static final double KM_PER_DEGREE = EARTH_RADIUS_KM * Math.PI / 180.0;

    private GeoMath() {
    }

    public static double haversineKm(GeoPoint a, GeoPoint b) {
        return haversineKm(a.latitude(), a.longitude(), b.latitude(), b.longitude());
    }

    public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = Math.toRadians(lat2 - lat1);
        double dLambda = Math.toRadians(lon2 - lon1);
        double h = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        return 2 * EARTH_RADIUS_KM * Math.asin(Math.min(1.0, Math.sqrt(h)));
    }

    /** Latitude span, in degrees, that contains every point within {@code km}. */
    public static double latitudeSpan(double km) {
        return km / KM_PER_DEGREE;
    }
}
