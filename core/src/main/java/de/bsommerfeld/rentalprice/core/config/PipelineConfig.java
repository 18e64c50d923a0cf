package de.bsommerfeld.rentalprice.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.rentalprice.core.domain.AmenityCategory;
import de.bsommerfeld.rentalprice.core.exception.ConfigurationException;

import java.time.format.DateTimeParseException;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Root of the pricing configuration. Every field carries its default, so a
 * freshly constructed instance is a complete, valid configuration.
 */
public class PipelineConfig {

    private static final double WEIGHT_TOLERANCE = 1e-6;

    @JsonProperty("parallelism")
    private int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());

    @JsonProperty("geo")
    private GeoConfig geo = new GeoConfig();

    @JsonProperty("temporal")
    private TemporalConfig temporal = new TemporalConfig();

    @JsonProperty("trust")
    private TrustConfig trust = new TrustConfig();

    @JsonProperty("amenity")
    private AmenityConfig amenity = new AmenityConfig();

    @JsonProperty("model")
    private ModelConfig model = new ModelConfig();

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public GeoConfig getGeo() {
        return geo;
    }

    public TemporalConfig getTemporal() {
        return temporal;
    }

    public TrustConfig getTrust() {
        return trust;
    }

    public AmenityConfig getAmenity() {
        return amenity;
    }

    public ModelConfig getModel() {
        return model;
    }

    /**
     * Checks cross-field constraints that binding alone cannot express.
     *
     * @return this instance, for chaining after loading
     * @throws ConfigurationException naming the first offending key
     */
    public PipelineConfig validate() {
        if (parallelism < 1) {
            throw new ConfigurationException("parallelism must be at least 1, was " + parallelism);
        }
        validateGeo();
        validateTemporal();
        validateTrust();
        validateAmenity();
        validateModel();
        return this;
    }

    private void validateGeo() {
        if (geo.getPoiCategoryNames() == null || geo.getPoiCategoryNames().isEmpty()) {
            throw new ConfigurationException("geo.poi-categories must not be empty");
        }
        try {
            if (new HashSet<>(geo.getPoiCategories()).size() != geo.getPoiCategoryNames().size()) {
                throw new ConfigurationException("geo.poi-categories contains duplicates: " + geo.getPoiCategoryNames());
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("geo.poi-categories: " + e.getMessage(), e);
        }
        requirePositive("geo.grid-cell-size-degrees", geo.getGridCellSizeDegrees());
        requirePositive("geo.density-radius-km", geo.getDensityRadiusKm());
        requirePositive("geo.distance-cap-km", geo.getDistanceCapKm());
    }

    private void validateTemporal() {
        try {
            temporal.getHolidays();
        } catch (DateTimeParseException | NullPointerException e) {
            throw new ConfigurationException("temporal.holidays must be MM-dd dates: " + temporal.getHolidayNames(), e);
        }
        if (temporal.getHolidayWindowDays() < 0) {
            throw new ConfigurationException("temporal.holiday-window-days must not be negative");
        }
    }

    private void validateTrust() {
        requirePositive("trust.rating-scale", trust.getRatingScale());
        requirePositive("trust.review-saturation", trust.getReviewSaturation());
        requirePositive("trust.tenure-cap-years", trust.getTenureCapYears());
        if (trust.getMinReviews() < 0) {
            throw new ConfigurationException("trust.min-reviews must not be negative");
        }
        requireWeightSet("trust score", Map.of(
                "rating-weight", trust.getRatingWeight(),
                "review-count-weight", trust.getReviewCountWeight(),
                "sufficiency-weight", trust.getSufficiencyWeight()));
        requireWeightSet("host quality", Map.of(
                "superhost-weight", trust.getSuperhostWeight(),
                "response-rate-weight", trust.getResponseRateWeight(),
                "verification-weight", trust.getVerificationWeight(),
                "tenure-weight", trust.getTenureWeight()));
    }

    private void validateAmenity() {
        for (String key : amenity.getWeights().keySet()) {
            requireKnownAmenityCategory(key);
        }
        for (String key : amenity.getSynonyms().keySet()) {
            requireKnownAmenityCategory(key);
        }
        double sum = 0.0;
        for (AmenityCategory category : AmenityCategory.values()) {
            double weight = amenity.weight(category);
            if (weight < 0 || Double.isNaN(weight)) {
                throw new ConfigurationException("amenity weight for " + category.key() + " must not be negative");
            }
            sum += weight;
            List<String> synonyms = amenity.synonyms(category);
            if (synonyms.isEmpty()) {
                throw new ConfigurationException("amenity category " + category.key() + " has no synonyms");
            }
            for (String synonym : synonyms) {
                if (synonym == null || synonym.isBlank()) {
                    throw new ConfigurationException("amenity category " + category.key() + " has a blank synonym");
                }
            }
        }
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new ConfigurationException("amenity weights must sum to 1, was " + sum);
        }
    }

    private void validateModel() {
        if (model.getTargetColumn() == null || model.getTargetColumn().isBlank()) {
            throw new ConfigurationException("model.target-column must be set");
        }
        requireOpenUnit("model.held-out-fraction", model.getHeldOutFraction());
        requireOpenUnit("model.validation-fraction", model.getValidationFraction());
        if (model.getTrainingTimeoutSeconds() < 0) {
            throw new ConfigurationException("model.training-timeout-seconds must not be negative");
        }
        if (model.getOptimizationTrials() < 1) {
            throw new ConfigurationException("model.optimization-trials must be at least 1");
        }
        if (model.getCvFolds() < 2) {
            throw new ConfigurationException("model.cv-folds must be at least 2");
        }
        if (model.getEnsembleWeighting() == null) {
            throw new ConfigurationException("model.ensemble-weighting must be set");
        }
        List<RegressorConfig> regressors = model.getRegressors();
        if (regressors == null || regressors.isEmpty()) {
            throw new ConfigurationException("model.regressors must name at least one regressor");
        }
        Set<String> names = new HashSet<>();
        double weightSum = 0;
        for (RegressorConfig regressor : regressors) {
            if (regressor.getName() == null || regressor.getName().isBlank()) {
                throw new ConfigurationException("every regressor needs a name");
            }
            if (regressor.getType() == null) {
                throw new ConfigurationException("regressor " + regressor.getName() + " has no type");
            }
            if (!names.add(regressor.getName())) {
                throw new ConfigurationException("duplicate regressor name: " + regressor.getName());
            }
            if (regressor.getWeight() < 0 || Double.isNaN(regressor.getWeight())) {
                throw new ConfigurationException("regressor " + regressor.getName() + " has a negative weight");
            }
            weightSum += regressor.getWeight();
        }
        if (model.getEnsembleWeighting() == WeightStrategy.CONFIGURED && !(weightSum > 0)) {
            throw new ConfigurationException(
                    "model.regressors weights must not all be zero when ensemble-weighting is CONFIGURED");
        }
    }

    private static void requireKnownAmenityCategory(String key) {
        try {
            AmenityCategory.fromKey(key);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("unknown amenity category: " + key, e);
        }
    }

    private static void requirePositive(String key, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new ConfigurationException(key + " must be positive, was " + value);
        }
    }

    private static void requireOpenUnit(String key, double value) {
        if (!(value > 0 && value < 1)) {
            throw new ConfigurationException(key + " must lie in (0, 1), was " + value);
        }
    }

    private static void requireWeightSet(String group, Map<String, Double> weights) {
        double sum = 0.0;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            if (entry.getValue() < 0 || Double.isNaN(entry.getValue())) {
                throw new ConfigurationException(group + " " + entry.getKey() + " must not be negative");
            }
            sum += entry.getValue();
        }
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new ConfigurationException(group + " weights must sum to 1, was " + sum);
        }
    }
}
