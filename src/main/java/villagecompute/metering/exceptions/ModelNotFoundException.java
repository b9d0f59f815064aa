package villagecompute.metering.exceptions;

/**
 * Thrown when the requested model has no pricing entry in the catalog.
 */
public class ModelNotFoundException extends ResourceNotFoundException {

    public ModelNotFoundException(String message) {
        super(message);
    }

    public ModelNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
