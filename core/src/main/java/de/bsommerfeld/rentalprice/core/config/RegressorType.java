package de.bsommerfeld.rentalprice.core.config;

/** Regression algorithms a {@link RegressorConfig} can select. */
public enum RegressorType {
    OLS,
    RIDGE,
    RANDOM_FOREST,
    GRADIENT_BOOSTING
}
