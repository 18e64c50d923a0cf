package de.bsommerfeld.rentalprice.core.event;

import java.time.Duration;
import java.util.List;

/**
 * Events published on the {@link PipelineEventBus} during a run.
 */
public class PipelineEvents {

    private PipelineEvents() {
    }

    /**
     * Fired once per feature run after every engine has contributed its
     * columns.
     */
    public record FeaturesAssembledEvent(int rows, int columns, int softFailures) {
    }

    /**
     * Fired for each listing an engine could not process cleanly. The row is
     * still emitted, filled with the engine's sentinels.
     */
    public record MalformedRecordEvent(String listingId, String engine, String reason) {
    }

    public record ModelTrainedEvent(String modelName, Duration duration) {
    }

    public record ModelFailedEvent(String modelName, String reason) {
    }

    public record EnsembleBuiltEvent(List<String> modelNames, List<Double> weights) {
    }
}
