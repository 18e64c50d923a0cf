package de.bsommerfeld.rentalprice.features.matrix;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One listing's feature row, addressable by column name.
 */
public final class FeatureVector {

    private final String listingId;
    private final FeatureSchema schema;
    private final double[] values;

    public FeatureVector(String listingId, FeatureSchema schema, double[] values) {
        if (values.length != schema.size()) {
            throw new IllegalArgumentException("expected " + schema.size() + " values, got " + values.length);
        }
        this.listingId = listingId;
        this.schema = schema;
        this.values = values.clone();
    }

    public String listingId() {
        return listingId;
    }

    public FeatureSchema schema() {
        return schema;
    }

    public double get(String column) {
        return values[schema.indexOf(column)];
    }

    public double[] values() {
        return values.clone();
    }

    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(schema.columns().get(i), values[i]);
        }
        return map;
    }

    @Override
    public String toString() {
        return "FeatureVector[" + listingId + "]";
    }
}
