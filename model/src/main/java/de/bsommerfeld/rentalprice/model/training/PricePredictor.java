package de.bsommerfeld.rentalprice.model.training;

import de.bsommerfeld.rentalprice.features.matrix.FeatureMatrix;
import de.bsommerfeld.rentalprice.features.matrix.FeatureVector;

/**
 * Anything that turns a feature row into a nightly price estimate.
 */
public interface PricePredictor {

    String name();

    double predict(FeatureVector row);

    default double[] predict(FeatureMatrix matrix) {
        double[] out = new double[matrix.rowCount()];
        for (int i = 0; i < out.length; i++) {
            out[i] = predict(matrix.row(i));
        }
        return out;
    }
}
