package villagecompute.metering.exceptions;

/**
 * Thrown when the conversation's current epoch row is missing at settlement time.
 */
public class EpochNotFoundException extends ResourceNotFoundException {

    public EpochNotFoundException(String message) {
        super(message);
    }

    public EpochNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
