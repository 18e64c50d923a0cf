package de.bsommerfeld.rentalprice.model.evaluation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One row of an {@link EvaluationReport}. Failed models carry a reason and
 * no metrics.
 */
public record ModelEvaluation(String name, ModelStatus status, Map<Metric, Double> metrics, String failureReason) {

    public ModelEvaluation {
        metrics = metrics.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(metrics));
    }

    public static ModelEvaluation trained(String name, Map<Metric, Double> metrics) {
        return new ModelEvaluation(name, ModelStatus.TRAINED, metrics, null);
    }

    public static ModelEvaluation failed(String name, String reason) {
        return new ModelEvaluation(name, ModelStatus.FAILED, Map.of(), reason);
    }

    public boolean isTrained() {
        return status == ModelStatus.TRAINED;
    }

    /** NaN for failed models. */
    public double metric(Metric metric) {
        Double value = metrics.get(metric);
        return value == null ? Double.NaN : value;
    }
}
