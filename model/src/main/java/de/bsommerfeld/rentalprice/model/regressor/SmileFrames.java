package de.bsommerfeld.rentalprice.model.regressor;

import smile.data.DataFrame;
import smile.data.Tuple;
import smile.data.formula.Formula;
import smile.data.type.StructType;

/**
 * Bridges plain arrays to Smile's data frame API. Predictors are named
 * {@code x0..xN} and the target {@code y} is the last column.
 */
final class SmileFrames {

    static final String TARGET = "y";

    private SmileFrames() {
    }

    static DataFrame frame(double[][] x, double[] y) {
        int width = x[0].length;
        double[][] data = new double[x.length][width + 1];
        for (int i = 0; i < x.length; i++) {
            System.arraycopy(x[i], 0, data[i], 0, width);
            data[i][width] = y[i];
        }
        String[] names = new String[width + 1];
        for (int j = 0; j < width; j++) {
            names[j] = "x" + j;
        }
        names[width] = TARGET;
        return DataFrame.of(data, names);
    }

    static Formula formula() {
        return Formula.lhs(TARGET);
    }

    /** Wraps a predictor row in a tuple of the training schema; the target slot is ignored. */
    static Tuple tuple(double[] row, StructType schema) {
        double[] padded = new double[row.length + 1];
        System.arraycopy(row, 0, padded, 0, row.length);
        return Tuple.of(padded, schema);
    }
}
