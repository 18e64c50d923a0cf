package de.bsommerfeld.rentalprice.model.regressor;

import de.bsommerfeld.rentalprice.core.config.RegressorType;

/**
 * Pluggable regression algorithm. Implementations are stateless
 * descriptions of an algorithm plus hyper-parameters; {@link #fit}
 * produces an independent, immutable {@link FittedRegressor}.
 *
 * <p>
 * {@code fit} may be called concurrently from several threads with
 * different inputs.
 */
public interface Regressor {

    String name();

    RegressorType type();

    /**
     * @param x row-major predictors, every row the same width
     * @param y targets, one per row, all finite
     * @throws de.bsommerfeld.rentalprice.core.exception.TrainingFailureException
     *         if the algorithm cannot fit the data
     */
    FittedRegressor fit(double[][] x, double[] y);
}
