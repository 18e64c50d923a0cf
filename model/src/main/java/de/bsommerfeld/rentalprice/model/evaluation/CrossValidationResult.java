package de.bsommerfeld.rentalprice.model.evaluation;

/**
 * Per-fold scores of one regressor for one metric, with their mean and
 * sample standard deviation.
 */
public record CrossValidationResult(String regressorName, Metric metric, double[] foldScores, double mean,
        double standardDeviation) {

    public CrossValidationResult {
        foldScores = foldScores.clone();
    }

    @Override
    public double[] foldScores() {
        return foldScores.clone();
    }

    public int folds() {
        return foldScores.length;
    }
}
