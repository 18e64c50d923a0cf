package de.bsommerfeld.rentalprice.model.training;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import de.bsommerfeld.rentalprice.core.exception.InsufficientModelsException;
import de.bsommerfeld.rentalprice.features.matrix.FeatureVector;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted average of at least two trained models. Weights are
 * non-negative and sum to one.
 */
public final class Ensemble implements PricePredictor {

    public static final String NAME = "ensemble";
    static final double WEIGHT_TOLERANCE = 1e-6;

    private final ImmutableList<TrainedModel> models;
    private final double[] weights;

    public Ensemble(List<TrainedModel> models, double[] weights) {
        if (models.size() < 2) {
            throw new InsufficientModelsException(models.size(), List.of());
        }
        Preconditions.checkArgument(models.size() == weights.length,
                "%s models but %s weights", models.size(), weights.length);
        double sum = 0;
        for (double w : weights) {
            Preconditions.checkArgument(w >= 0 && Double.isFinite(w), "invalid ensemble weight %s", w);
            sum += w;
        }
        Preconditions.checkArgument(Math.abs(sum - 1.0) <= WEIGHT_TOLERANCE, "weights sum to %s", sum);
        this.models = ImmutableList.copyOf(models);
        this.weights = weights.clone();
    }

    @Override
    public String name() {
        return NAME;
    }

    public List<TrainedModel> models() {
        return models;
    }

    public double[] weights() {
        return weights.clone();
    }

    public double weightOf(String modelName) {
        for (int i = 0; i < models.size(); i++) {
            if (models.get(i).name().equals(modelName)) {
                return weights[i];
            }
        }
        throw new IllegalArgumentException("Not an ensemble member: " + modelName);
    }

    @Override
    public double predict(FeatureVector row) {
        double total = 0;
        for (int i = 0; i < models.size(); i++) {
            total += weights[i] * models.get(i).predict(row);
        }
        return total;
    }

    /**
     * Each member's weighted share of the prediction for {@code row}, in
     * member order. The values add up to {@link #predict(FeatureVector)}.
     */
    public Map<String, Double> contributions(FeatureVector row) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (int i = 0; i < models.size(); i++) {
            out.put(models.get(i).name(), weights[i] * models.get(i).predict(row));
        }
        return out;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Ensemble[");
        for (int i = 0; i < models.size(); i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(models.get(i).name()).append('=').append(String.format("%.3f", weights[i]));
        }
        return sb.append(']').toString();
    }
}
