package de.bsommerfeld.rentalprice.features.engine;

/**
 * Explicit neutral values written where a signal is missing. Each is
 * outside the valid range of the columns it is used for.
 */
public final class Sentinels {

    /** Bounded indicators and counts whose source field is absent. */
    public static final double UNKNOWN = -1.0;

    /** Rating consistency is {@code -stddev}, so valid values are never positive. */
    public static final double CONSISTENCY_UNKNOWN = 1.0;

    private Sentinels() {
    }

    public static double orUnknown(Number value) {
        return value != null && !Double.isNaN(value.doubleValue()) ? value.doubleValue() : UNKNOWN;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double flag(boolean value) {
        return value ? 1.0 : 0.0;
    }
}
