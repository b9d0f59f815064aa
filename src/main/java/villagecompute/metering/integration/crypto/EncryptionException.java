package villagecompute.metering.integration.crypto;

/**
 * Thrown when a message cannot be sealed or opened.
 */
public class EncryptionException extends RuntimeException {

    public EncryptionException(String message) {
        super(message);
    }

    public EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
