package de.bsommerfeld.rentalprice.model.evaluation;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ranked comparison of trained models, the ensemble and failed models.
 * Trained entries come first, best primary metric on top.
 */
public final class EvaluationReport {

    private static final Metric[] COLUMNS = {Metric.RMSE, Metric.MAE, Metric.R2, Metric.MAPE,
            Metric.WITHIN_10_PCT, Metric.WITHIN_20_PCT};

    private final Metric primaryMetric;
    private final ImmutableList<ModelEvaluation> ranking;

    EvaluationReport(Metric primaryMetric, List<ModelEvaluation> ranking) {
        this.primaryMetric = primaryMetric;
        this.ranking = ImmutableList.copyOf(ranking);
    }

    public Metric primaryMetric() {
        return primaryMetric;
    }

    public List<ModelEvaluation> ranking() {
        return ranking;
    }

    public Optional<ModelEvaluation> bestModel() {
        return ranking.stream().filter(ModelEvaluation::isTrained).findFirst();
    }

    public Optional<ModelEvaluation> get(String name) {
        return ranking.stream().filter(e -> e.name().equals(name)).findFirst();
    }

    /** Fixed-width comparison table, one line per entry in rank order. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%-4s %-20s %-8s %-12s %-12s %-10s %-10s %-12s %-12s%n",
                "#", "Model", "Status", "RMSE", "MAE", "R2", "MAPE (%)", "Within 10%", "Within 20%"));
        int rank = 1;
        for (ModelEvaluation entry : ranking) {
            if (entry.isTrained()) {
                double[] v = new double[COLUMNS.length];
                for (int i = 0; i < v.length; i++) {
                    v[i] = entry.metric(COLUMNS[i]);
                }
                sb.append(String.format(Locale.ROOT,
                        "%-4d %-20s %-8s %-12.2f %-12.2f %-10.4f %-10.2f %-12.2f %-12.2f%n",
                        rank, entry.name(), entry.status(), v[0], v[1], v[2], v[3], v[4], v[5]));
            } else {
                sb.append(String.format(Locale.ROOT, "%-4s %-20s %-8s %s%n",
                        "-", entry.name(), entry.status(), entry.failureReason()));
            }
            rank++;
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "EvaluationReport[" + primaryMetric.key() + ", " + ranking.size() + " entries]";
    }
}
