package de.bsommerfeld.rentalprice.model.regressor;

import de.bsommerfeld.rentalprice.core.config.RegressorConfig;
import de.bsommerfeld.rentalprice.core.config.RegressorType;
import de.bsommerfeld.rentalprice.core.exception.TrainingFailureException;
import smile.data.DataFrame;
import smile.data.type.StructType;
import smile.regression.RandomForest;

import java.util.stream.LongStream;

/**
 * Random forest regression backed by Smile. Every tree receives its own
 * seed derived from the run seed, so a fit is reproducible.
 */
public class SmileRandomForestRegressor implements Regressor {

    private final String name;
    private final int trees;
    private final int mtry;
    private final int maxDepth;
    private final int maxNodes;
    private final int nodeSize;
    private final double subsample;
    private final long seed;

    public SmileRandomForestRegressor(RegressorConfig config, long seed) {
        this.name = config.getName();
        this.trees = config.getTrees();
        this.mtry = config.getMtry();
        this.maxDepth = config.getMaxDepth();
        this.maxNodes = config.getMaxNodes();
        this.nodeSize = config.getNodeSize();
        this.subsample = config.getSubsample();
        this.seed = seed;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public RegressorType type() {
        return RegressorType.RANDOM_FOREST;
    }

    @Override
    public FittedRegressor fit(double[][] x, double[] y) {
        int width = Matrices.requireRectangular(name, x, y);
        DataFrame frame = SmileFrames.frame(x, y);
        int features = mtry > 0 ? Math.min(mtry, width) : Math.max(1, width / 3);
        RandomForest forest;
        try {
            forest = RandomForest.fit(SmileFrames.formula(), frame, trees, features, maxDepth,
                    Math.max(2, maxNodes), Math.max(1, nodeSize), subsample,
                    LongStream.range(0, trees).map(i -> seed * 31 + i));
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new TrainingFailureException(name, "random forest fit failed: " + e.getMessage(), e);
        }
        StructType schema = frame.schema();
        return row -> forest.predict(SmileFrames.tuple(row, schema));
    }
}
