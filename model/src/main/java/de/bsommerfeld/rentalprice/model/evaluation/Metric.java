package de.bsommerfeld.rentalprice.model.evaluation;

import de.bsommerfeld.rentalprice.core.exception.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Regression quality metrics. Percentage metrics are expressed in percent
 * and ignore rows whose actual value is zero; they are NaN when no such row
 * remains.
 */
public enum Metric {

    MAE("mae", false),
    MSE("mse", false),
    RMSE("rmse", false),
    R2("r2", true),
    MAPE("mape", false),
    WITHIN_10_PCT("within_10pct", true),
    WITHIN_20_PCT("within_20pct", true);

    private final String key;
    private final boolean higherIsBetter;

    Metric(String key, boolean higherIsBetter) {
        this.key = key;
        this.higherIsBetter = higherIsBetter;
    }

    public String key() {
        return key;
    }

    public boolean higherIsBetter() {
        return higherIsBetter;
    }

    public double compute(double[] actual, double[] predicted) {
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException(actual.length + " actual values but " + predicted.length + " predictions");
        }
        if (actual.length == 0) {
            return Double.NaN;
        }
        switch (this) {
            case MAE:
                return meanAbsoluteError(actual, predicted);
            case MSE:
                return meanSquaredError(actual, predicted);
            case RMSE:
                return Math.sqrt(meanSquaredError(actual, predicted));
            case R2:
                return rSquared(actual, predicted);
            case MAPE:
                return meanAbsolutePercentageError(actual, predicted);
            case WITHIN_10_PCT:
                return withinPercent(actual, predicted, 0.10);
            case WITHIN_20_PCT:
                return withinPercent(actual, predicted, 0.20);
            default:
                throw new IllegalStateException("Unhandled metric " + this);
        }
    }

    /**
     * Resolves a metric by key ({@code rmse}, {@code within_10pct}) or
     * constant name, ignoring case.
     *
     * @throws ConfigurationException for unknown names
     */
    public static Metric fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (Metric metric : values()) {
                if (metric.key.equals(normalized) || metric.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                    return metric;
                }
            }
        }
        throw new ConfigurationException("Unknown metric '" + name + "', expected one of "
                + Arrays.stream(values()).map(Metric::key).collect(Collectors.joining(", ")));
    }

    private static double meanAbsoluteError(double[] actual, double[] predicted) {
        double sum = 0;
        for (int i = 0; i < actual.length; i++) {
            sum += Math.abs(actual[i] - predicted[i]);
        }
        return sum / actual.length;
    }

    private static double meanSquaredError(double[] actual, double[] predicted) {
        double sum = 0;
        for (int i = 0; i < actual.length; i++) {
            double d = actual[i] - predicted[i];
            sum += d * d;
        }
        return sum / actual.length;
    }

    private static double rSquared(double[] actual, double[] predicted) {
        double mean = Arrays.stream(actual).average().orElse(0);
        double ssTot = 0;
        double ssRes = 0;
        for (int i = 0; i < actual.length; i++) {
            ssTot += (actual[i] - mean) * (actual[i] - mean);
            ssRes += (actual[i] - predicted[i]) * (actual[i] - predicted[i]);
        }
        return ssTot == 0 ? 0.0 : 1.0 - ssRes / ssTot;
    }

    private static double meanAbsolutePercentageError(double[] actual, double[] predicted) {
        double sum = 0;
        int n = 0;
        for (int i = 0; i < actual.length; i++) {
            if (actual[i] != 0) {
                sum += Math.abs((actual[i] - predicted[i]) / actual[i]);
                n++;
            }
        }
        return n == 0 ? Double.NaN : 100.0 * sum / n;
    }

    private static double withinPercent(double[] actual, double[] predicted, double threshold) {
        int hits = 0;
        int n = 0;
        for (int i = 0; i < actual.length; i++) {
            if (actual[i] != 0) {
                n++;
                if (Math.abs(actual[i] - predicted[i]) / Math.abs(actual[i]) <= threshold) {
                    hits++;
                }
            }
        }
        return n == 0 ? Double.NaN : 100.0 * hits / n;
    }
}
