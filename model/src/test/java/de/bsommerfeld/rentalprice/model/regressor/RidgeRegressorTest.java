package de.bsommerfeld.rentalprice.model.regressor;

import de.bsommerfeld.rentalprice.features.matrix.FeatureMatrix;
import de.bsommerfeld.rentalprice.model.ModelFixtures;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RidgeRegressorTest {

    @Test
    void fit_linearData_shouldRecoverSignal() {
        FeatureMatrix data = ModelFixtures.linear(200, 1L);
        FittedRegressor fitted = new RidgeRegressor("ridge", 0.01)
                .fit(ModelFixtures.predictors(data), data.column(ModelFixtures.TARGET));

        assertEquals(50 + 8 * 5 - 3 * 2, fitted.predict(new double[] {5, 2}), 0.5);
        assertEquals(50 + 8 * 1 - 3 * 4, fitted.predict(new double[] {1, 4}), 0.5);
    }

    @Test
    void fit_constantColumn_shouldBeIgnored() {
        double[][] x = {{1, 7}, {2, 7}, {3, 7}, {4, 7}};
        double[] y = {2, 4, 6, 8};

        FittedRegressor fitted = new RidgeRegressor("ridge", 1e-6).fit(x, y);

        assertEquals(10.0, fitted.predict(new double[] {5, 7}), 1e-3);
        assertEquals(10.0, fitted.predict(new double[] {5, -100}), 1e-3);
    }

    @Test
    void fit_allColumnsConstant_shouldPredictMean() {
        double[][] x = {{1}, {1}, {1}};
        double[] y = {10, 20, 30};

        FittedRegressor fitted = new RidgeRegressor("ridge", 1.0).fit(x, y);

        assertEquals(20.0, fitted.predict(new double[] {42}), 1e-12);
    }

    @Test
    void fit_largerAlpha_shouldShrinkTowardsMean() {
        FeatureMatrix data = ModelFixtures.linear(100, 2L);
        double[][] x = ModelFixtures.predictors(data);
        double[] y = data.column(ModelFixtures.TARGET);

        double loose = new RidgeRegressor("loose", 0.01).fit(x, y).predict(new double[] {10, 0});
        double tight = new RidgeRegressor("tight", 1e6).fit(x, y).predict(new double[] {10, 0});

        assertTrue(tight < loose);
    }

    @Test
    void constructor_nonPositiveAlpha_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> new RidgeRegressor("ridge", 0.0));
    }
}
