package de.bsommerfeld.rentalprice.features.matrix;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Map;

/**
 * Dense, immutable feature table: one row per listing in input order, one
 * column per schema entry.
 */
public final class FeatureMatrix {

    private final ImmutableList<String> listingIds;
    private final FeatureSchema schema;
    private final double[][] values;

    public FeatureMatrix(List<String> listingIds, FeatureSchema schema, double[][] values) {
        Preconditions.checkArgument(listingIds.size() == values.length,
                "%s ids for %s rows", listingIds.size(), values.length);
        this.listingIds = ImmutableList.copyOf(listingIds);
        this.schema = schema;
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            Preconditions.checkArgument(values[i].length == schema.size(),
                    "row %s has %s values, schema has %s", i, values[i].length, schema.size());
            this.values[i] = values[i].clone();
        }
    }

    public int rowCount() {
        return values.length;
    }

    public int columnCount() {
        return schema.size();
    }

    public FeatureSchema schema() {
        return schema;
    }

    public List<String> columns() {
        return schema.columns();
    }

    public List<String> listingIds() {
        return listingIds;
    }

    public FeatureVector row(int i) {
        return new FeatureVector(listingIds.get(i), schema, values[i]);
    }

    public double value(int row, String column) {
        return values[row][schema.indexOf(column)];
    }

    public double[] column(String column) {
        int c = schema.indexOf(column);
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i][c];
        }
        return out;
    }

    /**
     * Values of the given columns for every row, in the order requested.
     */
    public double[][] columns(List<String> columns) {
        int[] indices = new int[columns.size()];
        for (int j = 0; j < indices.length; j++) {
            indices[j] = schema.indexOf(columns.get(j));
        }
        double[][] out = new double[values.length][indices.length];
        for (int i = 0; i < values.length; i++) {
            for (int j = 0; j < indices.length; j++) {
                out[i][j] = values[i][indices[j]];
            }
        }
        return out;
    }

    /** Sub-matrix of the given rows, in the given order. */
    public FeatureMatrix select(int[] rows) {
        ImmutableList.Builder<String> ids = ImmutableList.builder();
        double[][] picked = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            ids.add(listingIds.get(rows[i]));
            picked[i] = values[rows[i]];
        }
        return new FeatureMatrix(ids.build(), schema, picked);
    }

    /** Columns grouped by the engine that produced them. */
    public Map<String, List<String>> summary() {
        return schema.columnsBySource();
    }

    @Override
    public String toString() {
        return "FeatureMatrix[" + rowCount() + " x " + columnCount() + "]";
    }
}
