package villagecompute.metering.exceptions;

/**
 * Exception thrown when a referenced resource is not found (e.g., conversation, epoch, member, model).
 *
 * <p>
 * Extends RuntimeException per project standards. Typically mapped to HTTP 404 Not Found by the routing layer.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
