package de.bsommerfeld.rentalprice.features.assembly;

import de.bsommerfeld.rentalprice.core.config.PipelineConfig;
import de.bsommerfeld.rentalprice.core.domain.Poi;
import de.bsommerfeld.rentalprice.features.amenity.AmenityEngine;
import de.bsommerfeld.rentalprice.features.amenity.AmenityParser;
import de.bsommerfeld.rentalprice.features.base.BaseAttributeEngine;
import de.bsommerfeld.rentalprice.features.engine.FeatureEngine;
import de.bsommerfeld.rentalprice.features.geo.DistanceDensityEngine;
import de.bsommerfeld.rentalprice.features.geo.GeospatialIndex;
import de.bsommerfeld.rentalprice.features.grid.GridAggregationEngine;
import de.bsommerfeld.rentalprice.features.temporal.TemporalFeatureEngine;
import de.bsommerfeld.rentalprice.features.trust.ReviewTrustEngine;

import java.time.LocalDate;
import java.util.List;

/**
 * Builds the standard engine line-up for one run, in column-contract
 * order: base, distance/density, grid, temporal, review trust, amenity.
 */
public final class FeatureEngines {

    private FeatureEngines() {
    }

    public static List<FeatureEngine> standard(PipelineConfig config, List<Poi> pois, LocalDate referenceDate) {
        GeospatialIndex index = new GeospatialIndex(pois, config.getGeo().getDistanceCapKm());
        return List.of(
                new BaseAttributeEngine(),
                new DistanceDensityEngine(index, config.getGeo().getPoiCategories(), config.getGeo().getDensityRadiusKm()),
                new GridAggregationEngine(config.getGeo().getGridCellSizeDegrees()),
                new TemporalFeatureEngine(referenceDate, config.getTemporal().getHolidays(),
                        config.getTemporal().getHolidayWindowDays()),
                new ReviewTrustEngine(config.getTrust(), referenceDate),
                new AmenityEngine(config.getAmenity(), new AmenityParser()));
    }
}
