package de.bsommerfeld.rentalprice.core.exception;

/**
 * Thrown when the run configuration is structurally invalid: a missing or
 * malformed key, a weight set that does not sum to one, or two feature
 * engines declaring the same column. Always raised before any feature is
 * computed or any model is trained.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
