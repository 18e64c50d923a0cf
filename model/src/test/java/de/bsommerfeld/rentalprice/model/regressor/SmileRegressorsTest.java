package de.bsommerfeld.rentalprice.model.regressor;

import de.bsommerfeld.rentalprice.core.config.RegressorType;
import de.bsommerfeld.rentalprice.features.matrix.FeatureMatrix;
import de.bsommerfeld.rentalprice.model.ModelFixtures;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SmileRegressorsTest {

    private final FeatureMatrix data = ModelFixtures.linear(200, 5L);
    private final double[][] x = ModelFixtures.predictors(data);
    private final double[] y = data.column(ModelFixtures.TARGET);

    @Test
    void randomForest_shouldFollowDominantFeature() {
        FittedRegressor fitted = new SmileRandomForestRegressor(ModelFixtures.forest("rf"), 42L).fit(x, y);

        assertTrue(fitted.predict(new double[] {9, 2}) > fitted.predict(new double[] {1, 2}) + 30);
    }

    @Test
    void randomForest_sameSeed_shouldPredictIdentically() {
        FittedRegressor first = new SmileRandomForestRegressor(ModelFixtures.forest("rf"), 7L).fit(x, y);
        FittedRegressor second = new SmileRandomForestRegressor(ModelFixtures.forest("rf"), 7L).fit(x, y);

        for (double[] row : x) {
            assertEquals(first.predict(row), second.predict(row));
        }
    }

    @Test
    void gradientBoosting_shouldBeatTheMeanOnTrainingRows() {
        FittedRegressor fitted = new SmileGradientBoostingRegressor(ModelFixtures.boosting("gbt"), 42L).fit(x, y);

        double mean = 0;
        for (double v : y) {
            mean += v;
        }
        mean /= y.length;
        double modelError = 0;
        double meanError = 0;
        for (int i = 0; i < y.length; i++) {
            modelError += Math.abs(fitted.predict(x[i]) - y[i]);
            meanError += Math.abs(mean - y[i]);
        }

        assertTrue(modelError < meanError / 2);
    }

    @Test
    void types_shouldMatchImplementation() {
        assertEquals("rf", new SmileRandomForestRegressor(ModelFixtures.forest("rf"), 1L).name());
        assertEquals(RegressorType.GRADIENT_BOOSTING,
                new SmileGradientBoostingRegressor(ModelFixtures.boosting("gbt"), 1L).type());
    }
}
