package villagecompute.metering.exceptions;

/**
 * Thrown when the atomic reservation pushed a scope past its ceiling because of concurrent in-flight calls.
 *
 * <p>
 * Distinct from {@link InsufficientBalanceException}: the account is not empty, other requests are holding the funds.
 * Retrying shortly is expected to succeed.
 */
public class BalanceReservedException extends RuntimeException {

    public BalanceReservedException(String message) {
        super(message);
    }

    public BalanceReservedException(String message, Throwable cause) {
        super(message, cause);
    }
}
