package villagecompute.metering.exceptions;

/**
 * Thrown when the requester is not an active member of the group conversation being billed.
 */
public class MemberNotFoundException extends ResourceNotFoundException {

    public MemberNotFoundException(String message) {
        super(message);
    }

    public MemberNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
