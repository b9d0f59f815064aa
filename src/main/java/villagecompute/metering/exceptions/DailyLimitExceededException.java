package villagecompute.metering.exceptions;

/**
 * Thrown when a guest has used up the daily message quota for their guest key.
 */
public class DailyLimitExceededException extends RuntimeException {

    public DailyLimitExceededException(String message) {
        super(message);
    }

    public DailyLimitExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
