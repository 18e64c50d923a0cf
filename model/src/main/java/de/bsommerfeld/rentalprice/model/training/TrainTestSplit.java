package de.bsommerfeld.rentalprice.model.training;

import de.bsommerfeld.rentalprice.features.matrix.FeatureMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Reproducible train/test partition of a feature matrix. Rows without a
 * known target are left out of both sides.
 */
public final class TrainTestSplit {

    private static final Logger LOG = LoggerFactory.getLogger(TrainTestSplit.class);

    private final FeatureMatrix train;
    private final FeatureMatrix test;
    private final int excluded;

    private TrainTestSplit(FeatureMatrix train, FeatureMatrix test, int excluded) {
        this.train = train;
        this.test = test;
        this.excluded = excluded;
    }

    /**
     * Shuffles the labelled row indices with {@code new Random(seed)} and
     * takes the first {@code ceil(n * heldOutFraction)} as the test set.
     * Both sides keep the matrix's row order.
     *
     * @throws IllegalArgumentException if fewer than two labelled rows exist
     *                                  or either side would be empty
     */
    public static TrainTestSplit of(FeatureMatrix matrix, String targetColumn, double heldOutFraction, long seed) {
        if (!(heldOutFraction > 0 && heldOutFraction < 1)) {
            throw new IllegalArgumentException("held-out fraction must be in (0, 1): " + heldOutFraction);
        }
        int[] labelled = labelledRows(matrix, targetColumn);
        int excluded = matrix.rowCount() - labelled.length;
        if (excluded > 0) {
            LOG.warn("Excluding {} rows with unknown {} from training", excluded, targetColumn);
        }
        int n = labelled.length;
        if (n < 2) {
            throw new IllegalArgumentException("need at least 2 rows with a known " + targetColumn + ", got " + n);
        }
        int testSize = (int) Math.ceil(n * heldOutFraction);
        if (testSize >= n) {
            throw new IllegalArgumentException("held-out fraction " + heldOutFraction + " leaves no training rows");
        }

        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            order.add(i);
        }
        Collections.shuffle(order, new Random(seed));

        int[] testIdx = new int[testSize];
        int[] trainIdx = new int[n - testSize];
        for (int i = 0; i < testSize; i++) {
            testIdx[i] = labelled[order.get(i)];
        }
        for (int i = testSize; i < n; i++) {
            trainIdx[i - testSize] = labelled[order.get(i)];
        }
        Arrays.sort(testIdx);
        Arrays.sort(trainIdx);

        LOG.debug("Split {} rows: {} train, {} test (seed {})", n, trainIdx.length, testIdx.length, seed);
        return new TrainTestSplit(matrix.select(trainIdx), matrix.select(testIdx), excluded);
    }

    static int[] labelledRows(FeatureMatrix matrix, String targetColumn) {
        double[] target = matrix.column(targetColumn);
        return IntStream.range(0, target.length)
                .filter(i -> Double.isFinite(target[i]))
                .toArray();
    }

    public FeatureMatrix train() {
        return train;
    }

    public FeatureMatrix test() {
        return test;
    }

    /** Rows dropped because their target was unknown. */
    public int excluded() {
        return excluded;
    }
}
