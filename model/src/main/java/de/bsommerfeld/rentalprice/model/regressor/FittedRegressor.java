package de.bsommerfeld.rentalprice.model.regressor;

/**
 * Fitted parameters of a {@link Regressor}. Thread-safe for prediction.
 */
@FunctionalInterface
public interface FittedRegressor {

    /** Prediction for one row with the training column layout. */
    double predict(double[] x);
}
