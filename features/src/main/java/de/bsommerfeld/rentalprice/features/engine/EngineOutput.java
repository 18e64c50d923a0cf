package de.bsommerfeld.rentalprice.features.engine;

import java.util.List;

/**
 * Result of one engine over a whole batch. {@code rows[i]} belongs to the
 * i-th input listing and has exactly {@code columns.size()} values.
 */
public record EngineOutput(String engine, List<String> columns, double[][] rows, List<SoftFailure> failures) {

    public EngineOutput {
        columns = List.copyOf(columns);
        failures = List.copyOf(failures);
    }

    public int rowCount() {
        return rows.length;
    }
}
