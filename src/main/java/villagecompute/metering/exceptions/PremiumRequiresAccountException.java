package villagecompute.metering.exceptions;

/**
 * Thrown when a guest or trial user requests a premium model.
 */
public class PremiumRequiresAccountException extends RuntimeException {

    public PremiumRequiresAccountException(String message) {
        super(message);
    }

    public PremiumRequiresAccountException(String message, Throwable cause) {
        super(message, cause);
    }
}
