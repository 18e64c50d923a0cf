package de.bsommerfeld.rentalprice.features.geo;

import de.bsommerfeld.rentalprice.core.domain.GeoPoint;
import de.bsommerfeld.rentalprice.core.domain.Poi;
import de.bsommerfeld.rentalprice.core.domain.PoiCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only nearest-neighbour and radius queries over a preloaded POI set.
 *
 * <p>
 * POIs are kept per category in an array sorted by latitude (then id,
 * then longitude). A query only scans the latitude band that can contain
 * a hit and computes the exact haversine distance inside it. The scan
 * order is fixed, so ties always resolve to the same POI.
 *
 * <p>
 * Instances are immutable after construction and safe for unsynchronised
 * concurrent reads.
 */
public final class GeospatialIndex {

    private static final Logger LOG = LoggerFactory.getLogger(GeospatialIndex.class);

    /** Returned by {@link #nearestDistance} when no POI lies within the cap. */
    public static final double NO_POI_WITHIN_CAP = -1.0;

    private static final Comparator<Poi> SCAN_ORDER = Comparator
            .comparingDouble((Poi p) -> p.location().latitude())
            .thenComparing(Poi::id)
            .thenComparingDouble(p -> p.location().longitude());

    private final Map<PoiCategory, CategoryBucket> buckets = new EnumMap<>(PoiCategory.class);
    private final double distanceCapKm;

    public GeospatialIndex(Collection<Poi> pois, double distanceCapKm) {
        if (!(distanceCapKm > 0)) {
            throw new IllegalArgumentException("distance cap must be positive: " + distanceCapKm);
        }
        this.distanceCapKm = distanceCapKm;

        Map<PoiCategory, List<Poi>> grouped = new EnumMap<>(PoiCategory.class);
        for (Poi poi : pois) {
            grouped.computeIfAbsent(poi.category(), c -> new ArrayList<>()).add(poi);
        }
        for (Map.Entry<PoiCategory, List<Poi>> entry : grouped.entrySet()) {
            List<Poi> list = entry.getValue();
            list.sort(SCAN_ORDER);
            buckets.put(entry.getKey(), new CategoryBucket(list));
        }
        LOG.debug("Indexed {} POIs in {} categories (cap {} km)", pois.size(), buckets.size(), distanceCapKm);
    }

    public double distanceCapKm() {
        return distanceCapKm;
    }

    public int size(PoiCategory category) {
        CategoryBucket bucket = buckets.get(category);
        return bucket == null ? 0 : bucket.lat.length;
    }

    /**
     * Great-circle distance to the closest POI of {@code category}, or
     * {@link #NO_POI_WITHIN_CAP} when none lies within the cap (inclusive).
     */
    public double nearestDistance(GeoPoint point, PoiCategory category) {
        CategoryBucket bucket = buckets.get(category);
        if (bucket == null) {
            return NO_POI_WITHIN_CAP;
        }
        double best = Double.POSITIVE_INFINITY;
        double span = GeoMath.latitudeSpan(distanceCapKm);
        double maxLat = point.latitude() + span;
        for (int i = bucket.lowerBound(point.latitude() - span); i < bucket.lat.length && bucket.lat[i] <= maxLat; i++) {
            double d = GeoMath.haversineKm(point.latitude(), point.longitude(), bucket.lat[i], bucket.lon[i]);
            if (d < best) {
                best = d;
            }
        }
        return best <= distanceCapKm ? best : NO_POI_WITHIN_CAP;
    }

    /** Number of POIs of {@code category} within {@code radiusKm} (inclusive). */
    public int countWithin(GeoPoint point, PoiCategory category, double radiusKm) {
        CategoryBucket bucket = buckets.get(category);
        if (bucket == null || radiusKm < 0) {
            return 0;
        }
        double span = GeoMath.latitudeSpan(radiusKm);
        double maxLat = point.latitude() + span;
        int count = 0;
        for (int i = bucket.lowerBound(point.latitude() - span); i < bucket.lat.length && bucket.lat[i] <= maxLat; i++) {
            if (GeoMath.haversineKm(point.latitude(), point.longitude(), bucket.lat[i], bucket.lon[i]) <= radiusKm) {
                count++;
            }
        }
        return count;
    }

    private static final class CategoryBucket {
        final double[] lat;
        final double[] lon;

        CategoryBucket(List<Poi> sorted) {
            lat = new double[sorted.size()];
            lon = new double[sorted.size()];
            for (int i = 0; i < sorted.size(); i++) {
                lat[i] = sorted.get(i).location().latitude();
                lon[i] = sorted.get(i).location().longitude();
            }
        }

        /** First index whose latitude is {@code >= minLat}. */
        int lowerBound(double minLat) {
            int lo = 0;
            int hi = lat.length;
            while (lo < hi) {
                int mid = (lo + hi) >>> 1;
                if (lat[mid] < minLat) {
                    lo = mid + 1;
                } else {
                    hi = mid;
                }
            }
            return lo;
        }
    }
}
