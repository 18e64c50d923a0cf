package de.bsommerfeld.rentalprice.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Training, ensembling and evaluation settings.
 */
public class ModelConfig {

    @JsonProperty("target-column")
    private String targetColumn = "price";

    @JsonProperty("held-out-fraction")
    private double heldOutFraction = 0.2;

    @JsonProperty("random-seed")
    private long randomSeed = 42L;

    /** 0 disables the per-model timeout. */
    @JsonProperty("training-timeout-seconds")
    private long trainingTimeoutSeconds = 0L;

    @JsonProperty("ensemble-weighting")
    private WeightStrategy ensembleWeighting = WeightStrategy.UNIFORM;

    @JsonProperty("optimization-trials")
    private int optimizationTrials = 200;

    @JsonProperty("validation-fraction")
    private double validationFraction = 0.2;

    @JsonProperty("primary-metric")
    private String primaryMetric = "rmse";

    @JsonProperty("cv-folds")
    private int cvFolds = 5;

    @JsonProperty("regressors")
    private List<RegressorConfig> regressors = defaultRegressors();

    private static List<RegressorConfig> defaultRegressors() {
        List<RegressorConfig> list = new ArrayList<>();
        list.add(new RegressorConfig("ridge", RegressorType.RIDGE));
        RegressorConfig forest = new RegressorConfig("random_forest", RegressorType.RANDOM_FOREST);
        forest.setMaxDepth(20);
        forest.setMaxNodes(500);
        list.add(forest);
        list.add(new RegressorConfig("gradient_boosting", RegressorType.GRADIENT_BOOSTING));
        return list;
    }

    public String getTargetColumn() {
        return targetColumn;
    }

    public void setTargetColumn(String targetColumn) {
        this.targetColumn = targetColumn;
    }

    public double getHeldOutFraction() {
        return heldOutFraction;
    }

    public void setHeldOutFraction(double heldOutFraction) {
        this.heldOutFraction = heldOutFraction;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(long randomSeed) {
        this.randomSeed = randomSeed;
    }

    public long getTrainingTimeoutSeconds() {
        return trainingTimeoutSeconds;
    }

    public void setTrainingTimeoutSeconds(long trainingTimeoutSeconds) {
        this.trainingTimeoutSeconds = trainingTimeoutSeconds;
    }

    public WeightStrategy getEnsembleWeighting() {
        return ensembleWeighting;
    }

    public void setEnsembleWeighting(WeightStrategy ensembleWeighting) {
        this.ensembleWeighting = ensembleWeighting;
    }

    public int getOptimizationTrials() {
        return optimizationTrials;
    }

    public void setOptimizationTrials(int optimizationTrials) {
        this.optimizationTrials = optimizationTrials;
    }

    public double getValidationFraction() {
        return validationFraction;
    }

    public void setValidationFraction(double validationFraction) {
        this.validationFraction = validationFraction;
    }

    public String getPrimaryMetric() {
        return primaryMetric;
    }

    public void setPrimaryMetric(String primaryMetric) {
        this.primaryMetric = primaryMetric;
    }

    public int getCvFolds() {
        return cvFolds;
    }

    public void setCvFolds(int cvFolds) {
        this.cvFolds = cvFolds;
    }

    public List<RegressorConfig> getRegressors() {
        return regressors;
    }

    public void setRegressors(List<RegressorConfig> regressors) {
        this.regressors = regressors;
    }
}
