package de.bsommerfeld.rentalprice.core.exception;

/**
 * Thrown when a single regressor cannot be fitted. The orchestrator records
 * it against the regressor and continues with the remaining ones.
 */
public class TrainingFailureException extends RuntimeException {

    private final String modelName;

    public TrainingFailureException(String modelName, String message) {
        super(message);
        this.modelName = modelName;
    }

    public TrainingFailureException(String modelName, String message, Throwable cause) {
        super(message, cause);
        this.modelName = modelName;
    }

    public String getModelName() {
        return modelName;
    }
}
