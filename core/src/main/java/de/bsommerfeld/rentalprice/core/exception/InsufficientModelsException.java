package de.bsommerfeld.rentalprice.core.exception;

import java.util.List;

/**
 * Thrown when an ensemble is requested but fewer than two base models
 * trained successfully. The successfully trained models stay usable on
 * their own.
 */
public class InsufficientModelsException extends RuntimeException {

    private final int trainedCount;
    private final List<String> failedModels;

    public InsufficientModelsException(int trainedCount, List<String> failedModels) {
        super("Insufficient base models for an ensemble: " + trainedCount
                + " trained, at least 2 required (failed: " + failedModels + ")");
        this.trainedCount = trainedCount;
        this.failedModels = List.copyOf(failedModels);
    }

    public int getTrainedCount() {
        return trainedCount;
    }

    public List<String> getFailedModels() {
        return failedModels;
    }
}
