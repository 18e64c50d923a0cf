package de.bsommerfeld.rentalprice.model.regressor;

import de.bsommerfeld.rentalprice.core.config.RegressorType;
import de.bsommerfeld.rentalprice.core.exception.TrainingFailureException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

/**
 * Ordinary least squares with intercept. Fails on collinear or constant
 * predictors, which is common for feature matrices built for a single
 * reference date; ridge is the robust linear baseline.
 */
public class OlsRegressor implements Regressor {

    private static final double SINGULARITY_THRESHOLD = 1e-8;

    private final String name;

    public OlsRegressor(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public RegressorType type() {
        return RegressorType.OLS;
    }

    @Override
    public FittedRegressor fit(double[][] x, double[] y) {
        int width = Matrices.requireRectangular(name, x, y);
        if (x.length <= width + 1) {
            throw new TrainingFailureException(name, "need more rows (" + x.length + ") than predictors (" + width + ")");
        }
        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
        double[] beta;
        try {
            ols.newSampleData(y, x);
            beta = ols.estimateRegressionParameters();
        } catch (SingularMatrixException e) {
            throw new TrainingFailureException(name, "design matrix is singular", e);
        } catch (MathIllegalArgumentException e) {
            throw new TrainingFailureException(name, e.getMessage(), e);
        }
        Matrices.requireFinite(name, beta, "coefficients");
        return row -> {
            double sum = beta[0];
            for (int j = 0; j < row.length; j++) {
                sum += beta[j + 1] * row[j];
            }
            return sum;
        };
    }
}
