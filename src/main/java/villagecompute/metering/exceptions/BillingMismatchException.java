package villagecompute.metering.exceptions;

/**
 * Thrown when the funding source declared by the caller differs from the one resolved on the server, usually because
 * in-flight reservations changed the picture after the client computed it.
 */
public class BillingMismatchException extends RuntimeException {

    public BillingMismatchException(String message) {
        super(message);
    }

    public BillingMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
