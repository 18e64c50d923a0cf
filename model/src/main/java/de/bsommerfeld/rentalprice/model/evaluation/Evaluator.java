package de.bsommerfeld.rentalprice.model.evaluation;

import de.bsommerfeld.rentalprice.features.matrix.FeatureMatrix;
import de.bsommerfeld.rentalprice.model.training.Ensemble;
import de.bsommerfeld.rentalprice.model.training.PricePredictor;
import de.bsommerfeld.rentalprice.model.training.TrainedModel;
import de.bsommerfeld.rentalprice.model.training.TrainingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Scores trained models and the ensemble on held-out rows and ranks them by
 * a primary metric. Inputs are only read.
 */
public class Evaluator {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);
    static final String NO_ENSEMBLE = "insufficient base models";

    private final Metric primaryMetric;

    public Evaluator(Metric primaryMetric) {
        this.primaryMetric = primaryMetric;
    }

    /**
     * @throws de.bsommerfeld.rentalprice.core.exception.ConfigurationException for unknown metric names
     */
    public Evaluator(String primaryMetric) {
        this(Metric.fromName(primaryMetric));
    }

    public Metric primaryMetric() {
        return primaryMetric;
    }

    public EvaluationReport evaluate(TrainingResult result) {
        String ensembleReason = result.ensembleFailure().map(Throwable::getMessage).orElse(NO_ENSEMBLE);
        return evaluate(result.models(), result.ensemble().orElse(null), result.failures(), ensembleReason,
                result.split().test(), result.targetColumn());
    }

    /**
     * @param ensemble may be null, reported as failed
     * @param failures failed model names with their reasons
     */
    public EvaluationReport evaluate(List<TrainedModel> models, Ensemble ensemble, Map<String, String> failures,
            FeatureMatrix test, String targetColumn) {
        return evaluate(models, ensemble, failures, NO_ENSEMBLE, test, targetColumn);
    }

    private EvaluationReport evaluate(List<TrainedModel> models, Ensemble ensemble, Map<String, String> failures,
            String ensembleReason, FeatureMatrix test, String targetColumn) {
        double[] target = test.column(targetColumn);
        int[] labelled = IntStream.range(0, target.length)
                .filter(i -> Double.isFinite(target[i]))
                .toArray();
        FeatureMatrix scored = labelled.length == test.rowCount() ? test : test.select(labelled);
        double[] actual = scored.column(targetColumn);

        List<ModelEvaluation> trained = new ArrayList<>();
        for (TrainedModel model : models) {
            trained.add(score(model, scored, actual));
        }
        List<ModelEvaluation> failed = new ArrayList<>();
        if (ensemble != null) {
            trained.add(score(ensemble, scored, actual));
        } else {
            failed.add(ModelEvaluation.failed(Ensemble.NAME, ensembleReason));
        }
        failures.forEach((name, reason) -> failed.add(ModelEvaluation.failed(name, reason)));

        trained.sort(ranking());
        List<ModelEvaluation> ranking = new ArrayList<>(trained);
        ranking.addAll(failed);
        EvaluationReport report = new EvaluationReport(primaryMetric, ranking);
        report.bestModel().ifPresent(best -> LOG.info("Best model by {}: {} ({})",
                primaryMetric.key(), best.name(), best.metric(primaryMetric)));
        return report;
    }

    private ModelEvaluation score(PricePredictor predictor, FeatureMatrix test, double[] actual) {
        double[] predicted = predictor.predict(test);
        Map<Metric, Double> metrics = new EnumMap<>(Metric.class);
        for (Metric metric : Metric.values()) {
            metrics.put(metric, metric.compute(actual, predicted));
        }
        return ModelEvaluation.trained(predictor.name(), metrics);
    }

    private Comparator<ModelEvaluation> ranking() {
        // NaN scores sink to the bottom of the trained block
        return (a, b) -> {
            double x = a.metric(primaryMetric);
            double y = b.metric(primaryMetric);
            if (Double.isNaN(x) || Double.isNaN(y)) {
                return Boolean.compare(Double.isNaN(x), Double.isNaN(y));
            }
            return primaryMetric.higherIsBetter() ? Double.compare(y, x) : Double.compare(x, y);
        };
    }
}
