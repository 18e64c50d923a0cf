package de.bsommerfeld.rentalprice.core.config;

import de.bsommerfeld.rentalprice.core.domain.AmenityCategory;
import de.bsommerfeld.rentalprice.core.domain.PoiCategory;
import de.bsommerfeld.rentalprice.core.exception.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.MonthDay;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigLoaderTest {

    private static String toml(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    @Test
    void parse_shouldOverrideOnlyGivenKeys() {
        PipelineConfig config = PipelineConfigLoader.parse(toml(
                "parallelism = 2",
                "",
                "[geo]",
                "poi-categories = [\"beach\", \"transit\"]",
                "density-radius-km = 0.5",
                "",
                "[model]",
                "random-seed = 7",
                "ensemble-weighting = \"CONFIGURED\""));

        assertEquals(2, config.getParallelism());
        assertEquals(List.of(PoiCategory.BEACH, PoiCategory.TRANSIT), config.getGeo().getPoiCategories());
        assertEquals(0.5, config.getGeo().getDensityRadiusKm(), 1e-9);
        assertEquals(10.0, config.getGeo().getDistanceCapKm(), 1e-9);
        assertEquals(7L, config.getModel().getRandomSeed());
        assertEquals(WeightStrategy.CONFIGURED, config.getModel().getEnsembleWeighting());
        assertEquals(3, config.getModel().getRegressors().size());
    }

    @Test
    void parse_shouldReadRegressorTables() {
        PipelineConfig config = PipelineConfigLoader.parse(toml(
                "[[model.regressors]]",
                "name = \"ridge\"",
                "type = \"RIDGE\"",
                "alpha = 2.5",
                "",
                "[[model.regressors]]",
                "name = \"forest\"",
                "type = \"RANDOM_FOREST\"",
                "trees = 20",
                "weight = 3.0"));

        List<RegressorConfig> regressors = config.getModel().getRegressors();
        assertEquals(2, regressors.size());
        assertEquals(RegressorType.RIDGE, regressors.get(0).getType());
        assertEquals(2.5, regressors.get(0).getAlpha(), 1e-9);
        assertEquals(20, regressors.get(1).getTrees());
        assertEquals(3.0, regressors.get(1).getWeight(), 1e-9);
    }

    @Test
    void parse_shouldMergeAmenityOverridesWithDefaults() {
        PipelineConfig config = PipelineConfigLoader.parse(toml(
                "[amenity.weights]",
                "essential = 0.5",
                "premium = 0.3",
                "",
                "[amenity.synonyms]",
                "work_friendly = [\"Desk\"]"));

        AmenityConfig amenity = config.getAmenity();
        assertEquals(0.5, amenity.weight(AmenityCategory.ESSENTIAL), 1e-9);
        assertEquals(0.2, amenity.weight(AmenityCategory.WORK_FRIENDLY), 1e-9);
        assertEquals(List.of("Desk"), amenity.synonyms(AmenityCategory.WORK_FRIENDLY));
        assertEquals(AmenityCategory.PREMIUM.defaultSynonyms(), amenity.synonyms(AmenityCategory.PREMIUM));
    }

    @Test
    void parse_shouldRejectUnknownKeys() {
        assertThrows(ConfigurationException.class, () -> PipelineConfigLoader.parse(toml(
                "[geo]",
                "no-such-key = 1")));
    }

    @Test
    void parse_shouldRejectUnknownRegressorType() {
        assertThrows(ConfigurationException.class, () -> PipelineConfigLoader.parse(toml(
                "[[model.regressors]]",
                "name = \"mystery\"",
                "type = \"NEURAL_NET\"")));
    }

    @Test
    void parse_shouldRejectTrustWeightsNotSummingToOne() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> PipelineConfigLoader.parse(toml(
                "[trust]",
                "rating-weight = 0.9")));
        assertTrue(e.getMessage().contains("trust score"));
    }

    @Test
    void parse_shouldRejectDuplicateRegressorNames() {
        assertThrows(ConfigurationException.class, () -> PipelineConfigLoader.parse(toml(
                "[[model.regressors]]",
                "name = \"a\"",
                "type = \"RIDGE\"",
                "",
                "[[model.regressors]]",
                "name = \"a\"",
                "type = \"OLS\"")));
    }

    @Test
    void parse_shouldRejectAllZeroConfiguredWeights() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> PipelineConfigLoader.parse(toml(
                "[model]",
                "ensemble-weighting = \"CONFIGURED\"",
                "",
                "[[model.regressors]]",
                "name = \"ridge\"",
                "type = \"RIDGE\"",
                "weight = 0.0",
                "",
                "[[model.regressors]]",
                "name = \"forest\"",
                "type = \"RANDOM_FOREST\"",
                "weight = 0.0")));
        assertTrue(e.getMessage().contains("CONFIGURED"));
    }

    @Test
    void parse_allZeroWeights_shouldBeAcceptedWhenWeightsAreNotConfigured() {
        PipelineConfig config = PipelineConfigLoader.parse(toml(
                "[model]",
                "ensemble-weighting = \"UNIFORM\"",
                "",
                "[[model.regressors]]",
                "name = \"ridge\"",
                "type = \"RIDGE\"",
                "weight = 0.0"));

        assertEquals(0.0, config.getModel().getRegressors().get(0).getWeight(), 1e-9);
    }

    @Test
    void parse_shouldRejectBlankAmenitySynonym() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> PipelineConfigLoader.parse(toml(
                "[amenity.synonyms]",
                "premium = [\"Pool\", \" \"]")));
        assertTrue(e.getMessage().contains("blank synonym"));
    }

    @Test
    void parse_shouldRejectUnknownPoiCategory() {
        assertThrows(ConfigurationException.class, () -> PipelineConfigLoader.parse(toml(
                "[geo]",
                "poi-categories = [\"volcano\"]")));
    }

    @Test
    void parse_shouldRejectMalformedHoliday() {
        assertThrows(ConfigurationException.class, () -> PipelineConfigLoader.parse(toml(
                "[temporal]",
                "holidays = [\"25.12.\"]")));
    }

    @Test
    void parse_shouldRejectHeldOutFractionOutsideUnitInterval() {
        assertThrows(ConfigurationException.class, () -> PipelineConfigLoader.parse(toml(
                "[model]",
                "held-out-fraction = 1.0")));
    }

    @Test
    void parse_blankInput_shouldReturnDefaults() {
        PipelineConfig config = PipelineConfigLoader.parse("  ");
        assertEquals(42L, config.getModel().getRandomSeed());
    }

    @Test
    void load_shouldReadFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("pricing.toml");
        Files.writeString(file, "[temporal]\nholidays = [\"07-04\"]\n");

        PipelineConfig config = PipelineConfigLoader.load(file);

        assertEquals(List.of(MonthDay.of(7, 4)), config.getTemporal().getHolidays());
    }

    @Test
    void load_missingFile_shouldThrow(@TempDir Path dir) {
        assertThrows(ConfigurationException.class, () -> PipelineConfigLoader.load(dir.resolve("absent.toml")));
    }

    @Test
    void loadResource_shouldReadClasspathFile() {
        PipelineConfig config = PipelineConfigLoader.loadResource("pricing-test.toml");
        assertEquals(0.02, config.getGeo().getGridCellSizeDegrees(), 1e-9);
    }

    @Test
    void loadResource_missing_shouldThrow() {
        assertThrows(ConfigurationException.class, () -> PipelineConfigLoader.loadResource("nope.toml"));
    }
}
