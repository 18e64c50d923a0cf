package de.bsommerfeld.rentalprice.core.config;

import de.bsommerfeld.rentalprice.core.domain.AmenityCategory;
import de.bsommerfeld.rentalprice.core.domain.PoiCategory;
import de.bsommerfeld.rentalprice.core.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.MonthDay;

import static org.junit.jupiter.api.Assertions.*;

class ConfigDefaultsTest {

    @Test
    void pipelineConfig_shouldInitializeWithDefaults() {
        var config = new PipelineConfig();

        assertNotNull(config.getGeo());
        assertNotNull(config.getTemporal());
        assertNotNull(config.getTrust());
        assertNotNull(config.getAmenity());
        assertNotNull(config.getModel());
        assertTrue(config.getParallelism() >= 1);
        assertSame(config, config.validate());
    }

    @Test
    void geoConfig_shouldCoverEveryCategory() {
        var config = new GeoConfig();

        assertEquals(PoiCategory.values().length, config.getPoiCategories().size());
        assertEquals(0.01, config.getGridCellSizeDegrees(), 1e-9);
        assertEquals(1.0, config.getDensityRadiusKm(), 1e-9);
        assertEquals(10.0, config.getDistanceCapKm(), 1e-9);
    }

    @Test
    void temporalConfig_shouldHaveEightFixedHolidays() {
        var config = new TemporalConfig();

        assertEquals(8, config.getHolidays().size());
        assertTrue(config.getHolidays().contains(MonthDay.of(12, 25)));
        assertTrue(config.getHolidays().contains(MonthDay.of(1, 1)));
        assertEquals(1, config.getHolidayWindowDays());
    }

    @Test
    void trustConfig_shouldUseDocumentedWeights() {
        var config = new TrustConfig();

        assertEquals(0.4, config.getRatingWeight(), 1e-9);
        assertEquals(0.3, config.getReviewCountWeight(), 1e-9);
        assertEquals(0.3, config.getSufficiencyWeight(), 1e-9);
        assertEquals(5, config.getMinReviews());
        assertEquals(100, config.getReviewSaturation());
        assertEquals(3, config.getProfessionalHostListings());
    }

    @Test
    void amenityConfig_shouldFallBackToCategoryDefaults() {
        var config = new AmenityConfig();

        assertEquals(0.3, config.weight(AmenityCategory.ESSENTIAL), 1e-9);
        assertEquals(0.5, config.weight(AmenityCategory.PREMIUM), 1e-9);
        assertEquals(0.2, config.weight(AmenityCategory.WORK_FRIENDLY), 1e-9);
        assertEquals(3, config.resolvedSynonyms().size());
    }

    @Test
    void modelConfig_shouldDefaultToSeed42AndRmse() {
        var config = new ModelConfig();

        assertEquals(42L, config.getRandomSeed());
        assertEquals(0.2, config.getHeldOutFraction(), 1e-9);
        assertEquals("rmse", config.getPrimaryMetric());
        assertEquals(WeightStrategy.UNIFORM, config.getEnsembleWeighting());
        assertEquals(RegressorType.RIDGE, config.getRegressors().get(0).getType());
    }

    @Test
    void validate_shouldRejectEmptyRegressorList() {
        var config = new PipelineConfig();
        config.getModel().getRegressors().clear();

        assertThrows(ConfigurationException.class, config::validate);
    }

    @Test
    void validate_shouldRejectNegativeRegressorWeight() {
        var config = new PipelineConfig();
        config.getModel().getRegressors().get(0).setWeight(-1.0);

        assertThrows(ConfigurationException.class, config::validate);
    }

    @Test
    void validate_shouldRejectNonPositiveDistanceCap() {
        var config = new PipelineConfig();
        config.getGeo().setDistanceCapKm(0.0);

        assertThrows(ConfigurationException.class, config::validate);
    }
}
