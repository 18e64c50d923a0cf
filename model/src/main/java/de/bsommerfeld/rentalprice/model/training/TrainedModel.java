package de.bsommerfeld.rentalprice.model.training;

import com.google.common.collect.ImmutableList;
import de.bsommerfeld.rentalprice.core.config.RegressorType;
import de.bsommerfeld.rentalprice.features.matrix.FeatureVector;
import de.bsommerfeld.rentalprice.model.regressor.FittedRegressor;

import java.time.Duration;
import java.util.List;

/**
 * A successfully fitted regressor together with the predictor columns it
 * was trained on. Rows are resolved by column name, so any matrix carrying
 * those columns can be scored.
 */
public final class TrainedModel implements PricePredictor {

    private final String name;
    private final RegressorType type;
    private final ImmutableList<String> featureColumns;
    private final FittedRegressor fitted;
    private final Duration trainingTime;

    public TrainedModel(String name, RegressorType type, List<String> featureColumns,
            FittedRegressor fitted, Duration trainingTime) {
        this.name = name;
        this.type = type;
        this.featureColumns = ImmutableList.copyOf(featureColumns);
        this.fitted = fitted;
        this.trainingTime = trainingTime;
    }

    @Override
    public String name() {
        return name;
    }

    public RegressorType type() {
        return type;
    }

    public List<String> featureColumns() {
        return featureColumns;
    }

    public Duration trainingTime() {
        return trainingTime;
    }

    @Override
    public double predict(FeatureVector row) {
        double[] x = new double[featureColumns.size()];
        for (int j = 0; j < x.length; j++) {
            x[j] = row.get(featureColumns.get(j));
        }
        return fitted.predict(x);
    }

    @Override
    public String toString() {
        return "TrainedModel[" + name + ", " + type + "]";
    }
}
