package de.bsommerfeld.rentalprice.model.regressor;

import de.bsommerfeld.rentalprice.core.config.RegressorConfig;
import de.bsommerfeld.rentalprice.core.exception.ConfigurationException;

/**
 * Creates {@link Regressor} instances from configuration entries.
 */
public class RegressorFactory {

    /**
     * @param seed run seed; tree ensembles derive their randomness from it
     * @throws ConfigurationException for unusable hyper-parameters
     */
    public Regressor create(RegressorConfig config, long seed) {
        if (config.getType() == null) {
            throw new ConfigurationException("regressor " + config.getName() + " has no type");
        }
        switch (config.getType()) {
            case OLS:
                return new OlsRegressor(config.getName());
            case RIDGE:
                if (!(config.getAlpha() > 0)) {
                    throw new ConfigurationException("ridge regressor " + config.getName() + " needs alpha > 0");
                }
                return new RidgeRegressor(config.getName(), config.getAlpha());
            case RANDOM_FOREST:
                requireTrees(config);
                return new SmileRandomForestRegressor(config, seed);
            case GRADIENT_BOOSTING:
                requireTrees(config);
                if (!(config.getShrinkage() > 0 && config.getShrinkage() <= 1)) {
                    throw new ConfigurationException("regressor " + config.getName() + " needs shrinkage in (0, 1]");
                }
                return new SmileGradientBoostingRegressor(config, seed);
            default:
                throw new ConfigurationException("unsupported regressor type " + config.getType());
        }
    }

    private static void requireTrees(RegressorConfig config) {
        if (config.getTrees() < 1 || config.getMaxDepth() < 1) {
            throw new ConfigurationException("regressor " + config.getName() + " needs trees >= 1 and max-depth >= 1");
        }
        if (!(config.getSubsample() > 0 && config.getSubsample() <= 1)) {
            throw new ConfigurationException("regressor " + config.getName() + " needs subsample in (0, 1]");
        }
    }
}
