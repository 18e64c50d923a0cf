package de.bsommerfeld.rentalprice.features.geo;

import com.google.common.util.concurrent.MoreExecutors;
import de.bsommerfeld.rentalprice.core.domain.Listing;
import de.bsommerfeld.rentalprice.core.domain.Poi;
import de.bsommerfeld.rentalprice.core.domain.PoiCategory;
import de.bsommerfeld.rentalprice.features.engine.EngineOutput;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class DistanceDensityEngineTest {

    private static final List<PoiCategory> CATEGORIES = List.of(PoiCategory.BEACH, PoiCategory.TRANSIT, PoiCategory.MUSEUM);

    private static double value(DistanceDensityEngine engine, EngineOutput output, int row, String column) {
        return output.rows()[row][engine.columns().indexOf(column)];
    }

    @Test
    void columns_shouldFollowCategoryOrderThenScores() {
        var engine = new DistanceDensityEngine(new GeospatialIndex(List.of(), 10.0), CATEGORIES, 1.0);

        assertEquals(List.of(
                "distance_to_beach", "density_beach_1km",
                "distance_to_transit", "density_transit_1km",
                "distance_to_museum", "density_museum_1km",
                "accessibility_score", "transport_score"), engine.columns());
    }

    @Test
    void columns_shouldCarryFractionalRadius() {
        var engine = new DistanceDensityEngine(new GeospatialIndex(List.of(), 10.0), List.of(PoiCategory.BAR), 0.5);

        assertTrue(engine.columns().contains("density_bar_0.5km"));
    }

    @Test
    void compute_listingOnBeach_shouldHaveZeroDistanceAndDensity() {
        var index = new GeospatialIndex(List.of(new Poi("beach-1", -22.9711, -43.1822, PoiCategory.BEACH)), 10.0);
        var engine = new DistanceDensityEngine(index, CATEGORIES, 1.0);
        Listing listing = Listing.builder("L1", -22.9711, -43.1822).build();

        EngineOutput output = engine.compute(List.of(listing), MoreExecutors.newDirectExecutorService());

        assertEquals(0.0, value(engine, output, 0, "distance_to_beach"), 0.0);
        assertTrue(value(engine, output, 0, "density_beach_1km") >= 1);
        assertTrue(output.failures().isEmpty());
    }

    @Test
    void compute_categoryWithoutPois_shouldEmitSentinelAndZeroDensity() {
        var index = new GeospatialIndex(List.of(new Poi("beach-1", -22.9711, -43.1822, PoiCategory.BEACH)), 10.0);
        var engine = new DistanceDensityEngine(index, CATEGORIES, 1.0);
        Listing listing = Listing.builder("L1", -22.9711, -43.1822).build();

        EngineOutput output = engine.compute(List.of(listing), MoreExecutors.newDirectExecutorService());

        assertEquals(GeospatialIndex.NO_POI_WITHIN_CAP, value(engine, output, 0, "distance_to_museum"));
        assertEquals(0.0, value(engine, output, 0, "density_museum_1km"));
        assertEquals(1.0 / 10.1, value(engine, output, 0, "transport_score"), 1e-12);
    }

    @Test
    void compute_shouldScoreAccessibilityWithCapForMisses() {
        var index = new GeospatialIndex(List.of(
                new Poi("beach-1", -22.9711, -43.1822, PoiCategory.BEACH),
                new Poi("transit-1", -22.9711, -43.1822, PoiCategory.TRANSIT)), 10.0);
        var engine = new DistanceDensityEngine(index, CATEGORIES, 1.0);
        Listing listing = Listing.builder("L1", -22.9711, -43.1822).build();

        EngineOutput output = engine.compute(List.of(listing), MoreExecutors.newDirectExecutorService());

        // mean distance = (0 + 0 + 10) / 3
        assertEquals(1.0 / (10.0 / 3 + 0.1), value(engine, output, 0, "accessibility_score"), 1e-12);
        assertEquals(1.0 / 0.1, value(engine, output, 0, "transport_score"), 1e-9);
    }

    @Test
    void compute_shouldKeepInputOrderAcrossChunks() {
        var index = new GeospatialIndex(List.of(new Poi("beach-1", -22.90, -43.10, PoiCategory.BEACH)), 50.0);
        var engine = new DistanceDensityEngine(index, List.of(PoiCategory.BEACH), 1.0);
        List<Listing> listings = new ArrayList<>();
        for (int i = 0; i < 300; i++) {
            listings.add(Listing.builder("L" + i, -22.90 - i * 0.001, -43.10).build());
        }

        ExecutorService executor = Executors.newFixedThreadPool(4);
        EngineOutput output;
        try {
            output = engine.compute(listings, executor);
        } finally {
            executor.shutdownNow();
        }

        for (int i = 1; i < 300; i++) {
            assertTrue(output.rows()[i][0] > output.rows()[i - 1][0]);
        }
    }
}
