package de.bsommerfeld.rentalprice.model.regressor;

import de.bsommerfeld.rentalprice.core.config.RegressorType;
import de.bsommerfeld.rentalprice.core.exception.TrainingFailureException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.stream.IntStream;

/**
 * L2-regularised linear regression on standardised predictors.
 *
 * <p>
 * Columns are centred and scaled to unit variance; constant columns carry
 * no information and are left out. The intercept is the target mean, and
 * {@code (XᵀX + αI)β = Xᵀy} is solved by Cholesky decomposition, which is
 * always possible for {@code α > 0}.
 */
public class RidgeRegressor implements Regressor {

    private static final double ZERO_VARIANCE = 1e-12;

    private final String name;
    private final double alpha;

    public RidgeRegressor(String name, double alpha) {
        if (!(alpha > 0)) {
            throw new IllegalArgumentException("ridge alpha must be positive: " + alpha);
        }
        this.name = name;
        this.alpha = alpha;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public RegressorType type() {
        return RegressorType.RIDGE;
    }

    @Override
    public FittedRegressor fit(double[][] x, double[] y) {
        int width = Matrices.requireRectangular(name, x, y);
        int n = x.length;

        double[] mean = new double[width];
        double[] scale = new double[width];
        for (double[] row : x) {
            for (int j = 0; j < width; j++) {
                mean[j] += row[j];
            }
        }
        for (int j = 0; j < width; j++) {
            mean[j] /= n;
        }
        for (double[] row : x) {
            for (int j = 0; j < width; j++) {
                double d = row[j] - mean[j];
                scale[j] += d * d;
            }
        }
        int[] active = IntStream.range(0, width)
                .filter(j -> Math.sqrt(scale[j] / n) > ZERO_VARIANCE)
                .toArray();
        for (int j : active) {
            scale[j] = Math.sqrt(scale[j] / n);
        }

        double yMean = 0.0;
        for (double v : y) {
            yMean += v;
        }
        yMean /= n;
        double intercept = yMean;

        if (active.length == 0) {
            return row -> intercept;
        }

        int k = active.length;
        double[][] z = new double[n][k];
        for (int i = 0; i < n; i++) {
            for (int a = 0; a < k; a++) {
                int j = active[a];
                z[i][a] = (x[i][j] - mean[j]) / scale[j];
            }
        }
        RealMatrix zm = new Array2DRowRealMatrix(z, false);
        RealMatrix gram = zm.transpose().multiply(zm);
        for (int a = 0; a < k; a++) {
            gram.addToEntry(a, a, alpha);
        }
        double[] centred = new double[n];
        for (int i = 0; i < n; i++) {
            centred[i] = y[i] - yMean;
        }
        RealVector rhs = zm.transpose().operate(new ArrayRealVector(centred, false));

        double[] beta;
        try {
            beta = new CholeskyDecomposition(gram).getSolver().solve(rhs).toArray();
        } catch (NonPositiveDefiniteMatrixException | NonSymmetricMatrixException e) {
            throw new TrainingFailureException(name, "regularised system is not positive definite", e);
        }
        Matrices.requireFinite(name, beta, "coefficients");

        double[] coefficients = new double[width];
        double offset = intercept;
        for (int a = 0; a < k; a++) {
            int j = active[a];
            coefficients[j] = beta[a] / scale[j];
            offset -= coefficients[j] * mean[j];
        }
        double bias = offset;
        return row -> {
            double sum = bias;
            for (int j = 0; j < coefficients.length; j++) {
                sum += coefficients[j] * row[j];
            }
            return sum;
        };
    }
}
