package de.bsommerfeld.rentalprice.model.regressor;

import de.bsommerfeld.rentalprice.core.config.RegressorConfig;
import de.bsommerfeld.rentalprice.core.config.RegressorType;
import de.bsommerfeld.rentalprice.core.exception.TrainingFailureException;
import smile.base.cart.Loss;
import smile.data.DataFrame;
import smile.data.type.StructType;
import smile.math.MathEx;
import smile.regression.GradientTreeBoost;

/**
 * Least-squares gradient tree boosting backed by Smile. Smile draws its
 * subsamples from a thread-local generator, which is seeded on the fitting
 * thread right before training.
 */
public class SmileGradientBoostingRegressor implements Regressor {

    private final String name;
    private final int trees;
    private final int maxDepth;
    private final int maxNodes;
    private final int nodeSize;
    private final double shrinkage;
    private final double subsample;
    private final long seed;

    public SmileGradientBoostingRegressor(RegressorConfig config, long seed) {
        this.name = config.getName();
        this.trees = config.getTrees();
        this.maxDepth = config.getMaxDepth();
        this.maxNodes = config.getMaxNodes();
        this.nodeSize = config.getNodeSize();
        this.shrinkage = config.getShrinkage();
        this.subsample = config.getSubsample();
        this.seed = seed;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public RegressorType type() {
        return RegressorType.GRADIENT_BOOSTING;
    }

    @Override
    public FittedRegressor fit(double[][] x, double[] y) {
        Matrices.requireRectangular(name, x, y);
        DataFrame frame = SmileFrames.frame(x, y);
        GradientTreeBoost model;
        try {
            MathEx.setSeed(seed);
            model = GradientTreeBoost.fit(SmileFrames.formula(), frame, Loss.ls(), trees, maxDepth,
                    Math.max(2, maxNodes), Math.max(1, nodeSize), shrinkage, subsample);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new TrainingFailureException(name, "gradient boosting fit failed: " + e.getMessage(), e);
        }
        StructType schema = frame.schema();
        return row -> model.predict(SmileFrames.tuple(row, schema));
    }
}
