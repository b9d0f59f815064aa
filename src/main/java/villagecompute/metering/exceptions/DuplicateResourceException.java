package villagecompute.metering.exceptions;

/**
 * Exception thrown when attempting to create a resource that already exists (e.g., a message id that was already
 * settled).
 *
 * <p>
 * Extends RuntimeException per project standards. Typically mapped to HTTP 409 Conflict.
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String message) {
        super(message);
    }

    public DuplicateResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
