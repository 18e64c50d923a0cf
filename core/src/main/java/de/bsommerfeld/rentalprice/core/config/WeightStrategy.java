package de.bsommerfeld.rentalprice.core.config;

/** How ensemble weights are derived from the trained base models. */
public enum WeightStrategy {
    /** Every trained model gets 1/k. */
    UNIFORM,
    /** Weights from each regressor's {@code weight} entry, renormalised over trained models. */
    CONFIGURED,
    /** Seeded random search on a validation slice of the training partition, minimising MAE. */
    OPTIMIZED
}
