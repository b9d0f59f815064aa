package villagecompute.metering.exceptions;

/**
 * Thrown when settlement cannot claim sequence numbers because the conversation no longer exists (usually a racing
 * delete).
 */
public class ConversationNotFoundException extends ResourceNotFoundException {

    public ConversationNotFoundException(String message) {
        super(message);
    }

    public ConversationNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
