package de.bsommerfeld.rentalprice.features.geo;

import de.bsommerfeld.rentalprice.core.domain.GeoPoint;
import de.bsommerfeld.rentalprice.core.domain.Listing;
import de.bsommerfeld.rentalprice.core.domain.PoiCategory;
import de.bsommerfeld.rentalprice.features.engine.PerListingFeatureEngine;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per configured POI category: {@code distance_to_<key>} (km, or
 * {@link GeospatialIndex#NO_POI_WITHIN_CAP}) and
 * {@code density_<key>_<radius>km}. Followed by an overall
 * {@code accessibility_score} and a {@code transport_score}, both
 * {@code 1 / (distance + 0.1)} with misses counted at the cap.
 *
 * <p>
 * Categories without any loaded POI still produce their columns.
 */
public class DistanceDensityEngine extends PerListingFeatureEngine {

    public static final String NAME = "distance_density";

    private static final double SCORE_OFFSET_KM = 0.1;

    private final GeospatialIndex index;
    private final List<PoiCategory> categories;
    private final double densityRadiusKm;
    private final List<String> columns;

    public DistanceDensityEngine(GeospatialIndex index, List<PoiCategory> categories, double densityRadiusKm) {
        this.index = index;
        this.categories = List.copyOf(categories);
        this.densityRadiusKm = densityRadiusKm;

        List<String> cols = new ArrayList<>();
        String radiusLabel = radiusLabel(densityRadiusKm);
        for (PoiCategory category : this.categories) {
            cols.add(distanceColumn(category));
            cols.add("density_" + category.key() + "_" + radiusLabel + "km");
        }
        cols.add("accessibility_score");
        cols.add("transport_score");
        this.columns = Collections.unmodifiableList(cols);
    }

    public static String distanceColumn(PoiCategory category) {
        return "distance_to_" + category.key();
    }

    static String radiusLabel(double radiusKm) {
        return BigDecimal.valueOf(radiusKm).stripTrailingZeros().toPlainString();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> columns() {
        return columns;
    }

    @Override
    protected double[] computeRow(Listing listing, List<String> warnings) {
        GeoPoint point = listing.location();
        double cap = index.distanceCapKm();
        double[] row = new double[columns.size()];
        double distanceSum = 0.0;
        double transit = cap;
        int col = 0;
        for (PoiCategory category : categories) {
            double distance = index.nearestDistance(point, category);
            double effective = distance == GeospatialIndex.NO_POI_WITHIN_CAP ? cap : distance;
            distanceSum += effective;
            if (category == PoiCategory.TRANSIT) {
                transit = effective;
            }
            row[col++] = distance;
            row[col++] = index.countWithin(point, category, densityRadiusKm);
        }
        double meanDistance = categories.isEmpty() ? cap : distanceSum / categories.size();
        row[col++] = 1.0 / (meanDistance + SCORE_OFFSET_KM);
        row[col] = 1.0 / (transit + SCORE_OFFSET_KM);
        return row;
    }

    @Override
    public double[] sentinelRow() {
        double[] row = new double[columns.size()];
        int col = 0;
        for (int i = 0; i < categories.size(); i++) {
            row[col++] = GeospatialIndex.NO_POI_WITHIN_CAP;
            row[col++] = 0.0;
        }
        double floor = 1.0 / (index.distanceCapKm() + SCORE_OFFSET_KM);
        row[col++] = floor;
        row[col] = floor;
        return row;
    }
}
