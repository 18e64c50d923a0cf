package de.bsommerfeld.rentalprice.features.matrix;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered column names of a feature matrix and the engine that produced
 * each one. Column names are unique.
 */
public final class FeatureSchema {

    private final ImmutableList<String> columns;
    private final ImmutableList<String> sources;
    private final ImmutableMap<String, Integer> index;

    public FeatureSchema(List<String> columns, List<String> sources) {
        Preconditions.checkArgument(columns.size() == sources.size(), "columns and sources differ in size");
        this.columns = ImmutableList.copyOf(columns);
        this.sources = ImmutableList.copyOf(sources);
        ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
        for (int i = 0; i < columns.size(); i++) {
            builder.put(columns.get(i), i);
        }
        this.index = builder.buildOrThrow();
    }

    public List<String> columns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    public boolean contains(String column) {
        return index.containsKey(column);
    }

    /**
     * @throws IllegalArgumentException for unknown columns
     */
    public int indexOf(String column) {
        Integer i = index.get(column);
        Preconditions.checkArgument(i != null, "Unknown feature column: %s", column);
        return i;
    }

    public String sourceOf(String column) {
        return sources.get(indexOf(column));
    }

    /** Columns grouped by producing engine, both in schema order. */
    public Map<String, List<String>> columnsBySource() {
        Map<String, ImmutableList.Builder<String>> grouped = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            grouped.computeIfAbsent(sources.get(i), s -> ImmutableList.builder()).add(columns.get(i));
        }
        ImmutableMap.Builder<String, List<String>> result = ImmutableMap.builder();
        grouped.forEach((source, cols) -> result.put(source, cols.build()));
        return result.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureSchema))
            return false;
        FeatureSchema other = (FeatureSchema) o;
        return columns.equals(other.columns) && sources.equals(other.sources);
    }

    @Override
    public int hashCode() {
        return columns.hashCode() * 31 + sources.hashCode();
    }

    @Override
    public String toString() {
        return "FeatureSchema" + columns;
    }
}
