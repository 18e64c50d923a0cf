package de.bsommerfeld.rentalprice.model.evaluation;

import de.bsommerfeld.rentalprice.core.config.ModelConfig;
import de.bsommerfeld.rentalprice.core.config.RegressorConfig;
import de.bsommerfeld.rentalprice.core.exception.ConfigurationException;
import de.bsommerfeld.rentalprice.features.matrix.FeatureMatrix;
import de.bsommerfeld.rentalprice.model.regressor.FittedRegressor;
import de.bsommerfeld.rentalprice.model.regressor.Regressor;
import de.bsommerfeld.rentalprice.model.regressor.RegressorFactory;
import de.bsommerfeld.rentalprice.model.training.ModelOrchestrator;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Seeded k-fold cross-validation of a single configured regressor. Rows
 * without a known target are skipped.
 */
public class CrossValidator {

    private static final Logger LOG = LoggerFactory.getLogger(CrossValidator.class);

    private final ModelConfig config;
    private final RegressorFactory factory;

    public CrossValidator(ModelConfig config, RegressorFactory factory) {
        this.config = config;
        this.factory = factory;
    }

    /**
     * @throws ConfigurationException if no regressor is configured under
     *                                {@code regressorName} or the target is
     *                                missing
     * @throws IllegalArgumentException if there are fewer labelled rows than folds
     * @throws de.bsommerfeld.rentalprice.core.exception.TrainingFailureException if a fold cannot be fitted
     */
    public CrossValidationResult crossValidate(FeatureMatrix matrix, String targetColumn, String regressorName,
            Metric metric) {
        RegressorConfig entry = config.getRegressors().stream()
                .filter(r -> r.getName().equals(regressorName))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException("No regressor configured as " + regressorName));
        if (!matrix.schema().contains(targetColumn)) {
            throw new ConfigurationException("Target column not in feature matrix: " + targetColumn);
        }
        int k = config.getCvFolds();
        List<Integer> rows = new ArrayList<>();
        double[] target = matrix.column(targetColumn);
        for (int i = 0; i < target.length; i++) {
            if (Double.isFinite(target[i])) {
                rows.add(i);
            }
        }
        if (rows.size() < k) {
            throw new IllegalArgumentException(rows.size() + " labelled rows cannot fill " + k + " folds");
        }
        Collections.shuffle(rows, new Random(config.getRandomSeed()));

        List<String> predictors = ModelOrchestrator.predictorColumns(matrix, targetColumn);
        double[][] x = matrix.columns(predictors);
        Regressor regressor = factory.create(entry, config.getRandomSeed());

        double[] scores = new double[k];
        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (int fold = 0; fold < k; fold++) {
            List<Integer> held = new ArrayList<>();
            List<Integer> fit = new ArrayList<>();
            for (int i = 0; i < rows.size(); i++) {
                (i % k == fold ? held : fit).add(rows.get(i));
            }
            double[][] trainX = new double[fit.size()][];
            double[] trainY = new double[fit.size()];
            for (int i = 0; i < fit.size(); i++) {
                trainX[i] = x[fit.get(i)];
                trainY[i] = target[fit.get(i)];
            }
            FittedRegressor fitted = regressor.fit(trainX, trainY);
            double[] actual = new double[held.size()];
            double[] predicted = new double[held.size()];
            for (int i = 0; i < held.size(); i++) {
                actual[i] = target[held.get(i)];
                predicted[i] = fitted.predict(x[held.get(i)]);
            }
            scores[fold] = metric.compute(actual, predicted);
            stats.addValue(scores[fold]);
            LOG.debug("Fold {}/{} of {}: {} = {}", fold + 1, k, regressorName, metric.key(), scores[fold]);
        }
        LOG.info("Cross-validated {} over {} folds: {} = {} +/- {}", regressorName, k, metric.key(),
                stats.getMean(), stats.getStandardDeviation());
        return new CrossValidationResult(regressorName, metric, scores, stats.getMean(),
                stats.getStandardDeviation());
    }
}
