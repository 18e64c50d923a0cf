package de.bsommerfeld.rentalprice.model.regressor;

import de.bsommerfeld.rentalprice.core.exception.TrainingFailureException;

/**
 * Input checks shared by the regressors.
 */
final class Matrices {

    private Matrices() {
    }

    static int requireRectangular(String model, double[][] x, double[] y) {
        if (x.length == 0) {
            throw new TrainingFailureException(model, "no training rows");
        }
        if (x.length != y.length) {
            throw new TrainingFailureException(model, x.length + " rows but " + y.length + " targets");
        }
        int width = x[0].length;
        for (double[] row : x) {
            if (row.length != width) {
                throw new TrainingFailureException(model, "ragged predictor matrix");
            }
        }
        return width;
    }

    static void requireFinite(String model, double[] values, String what) {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new TrainingFailureException(model, "non-finite " + what);
            }
        }
    }
}
