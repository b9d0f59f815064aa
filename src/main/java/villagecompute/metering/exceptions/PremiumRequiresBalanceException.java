package villagecompute.metering.exceptions;

/**
 * Thrown when an authenticated user without purchased balance requests a premium model.
 */
public class PremiumRequiresBalanceException extends RuntimeException {

    public PremiumRequiresBalanceException(String message) {
        super(message);
    }

    public PremiumRequiresBalanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
